package com.vcc.copilot.service;

import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.model.ChatTurn;
import com.vcc.copilot.model.ContextDocument;
import com.vcc.copilot.model.GenerationOptions;
import com.vcc.copilot.model.GenerationResult;
import com.vcc.copilot.model.ServiceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Guarded prompt construction plus the upstream call.
 */
@Service
public class ResponseGenerator {
    private static final Logger log = LoggerFactory.getLogger(ResponseGenerator.class);

    static final double MIN_TEMPERATURE = 0.0;
    static final double MAX_TEMPERATURE = 2.0;

    private final PromptBuilder promptBuilder;
    private final UpstreamClient upstreamClient;
    private final CopilotProperties properties;

    public ResponseGenerator(PromptBuilder promptBuilder,
                             UpstreamClient upstreamClient,
                             CopilotProperties properties) {
        this.promptBuilder = promptBuilder;
        this.upstreamClient = upstreamClient;
        this.properties = properties;
    }

    /**
     * Answer the conversation using only the given context documents.
     *
     * @param turns     caller turns, user and assistant only
     * @param documents ranked context, best first
     * @param options   effective options from {@link #effectiveOptions}
     */
    public Mono<GenerationResult> respond(List<ChatTurn> turns,
                                          List<ContextDocument> documents,
                                          GenerationOptions options) {
        List<ChatTurn> messages = promptBuilder.build(turns, documents);
        log.debug("Generating response: model={}, maxTokens={}, contextDocs={}, turns={}",
                options.model(), options.maxTokens(), documents.size(), turns.size());
        return upstreamClient.complete(messages, options);
    }

    /**
     * Resolve model parameters for a tier. Caller overrides can only lower the token ceiling.
     */
    public GenerationOptions effectiveOptions(ServiceTier tier, Double temperature, Integer maxTokens) {
        CopilotProperties.TierConfig tierConfig = properties.tierConfig(tier);
        CopilotProperties.UpstreamConfig upstream = properties.getUpstream();

        String model = tierConfig.getModel() != null && !tierConfig.getModel().isBlank()
                ? tierConfig.getModel()
                : upstream.getDefaultModel();

        int ceiling = tierConfig.getMaxTokensPerRequest();
        int tokens = maxTokens != null && maxTokens > 0 ? Math.min(maxTokens, ceiling) : ceiling;

        double temp = temperature != null
                ? Math.max(MIN_TEMPERATURE, Math.min(MAX_TEMPERATURE, temperature))
                : upstream.getDefaultTemperature();

        return new GenerationOptions(model, tokens, temp);
    }
}
