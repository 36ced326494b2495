package com.vcc.copilot.service;

import com.vcc.copilot.model.ChatTurn;
import com.vcc.copilot.model.ContextDocument;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the message list sent upstream: one guarded system message carrying the ranked context,
 * followed by the caller's turns in order.
 */
@Component
public class PromptBuilder {

    static final String GUARDRAILS = String.join("\n",
            "You are the project assistant in a client portal. Answer questions about the client's projects.",
            "Rules:",
            "- Answer only from the context provided below.",
            "- If the context does not contain the answer, say that you do not know.",
            "- Never fabricate dates, figures, names or commitments.",
            "- Never reveal internal notes or information about other clients.",
            "- Refer to sources by their label when you use them.");

    static final String NO_CONTEXT = "No project context is available for this question.";

    public List<ChatTurn> build(List<ChatTurn> turns, List<ContextDocument> documents) {
        List<ChatTurn> messages = new ArrayList<>(turns.size() + 1);
        messages.add(ChatTurn.system(systemMessage(documents)));
        messages.addAll(turns);
        return messages;
    }

    String systemMessage(List<ContextDocument> documents) {
        StringBuilder system = new StringBuilder(GUARDRAILS).append("\n\nContext:\n");
        if (documents.isEmpty()) {
            system.append(NO_CONTEXT);
            return system.toString();
        }
        for (int i = 0; i < documents.size(); i++) {
            ContextDocument document = documents.get(i);
            if (i > 0) {
                system.append("\n\n");
            }
            system.append('[').append(i + 1).append("] ").append(document.sourceLabel())
                    .append('\n').append(document.text());
        }
        return system.toString();
    }
}
