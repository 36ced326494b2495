package com.vcc.copilot.service;

import com.vcc.copilot.config.CopilotProperties;
import com.vcc.copilot.entity.FileRefEntity;
import com.vcc.copilot.entity.MessageEntity;
import com.vcc.copilot.entity.ProjectEntity;
import com.vcc.copilot.entity.TaskEntity;
import com.vcc.copilot.model.AccessScope;
import com.vcc.copilot.model.AssembledContext;
import com.vcc.copilot.model.ContextDocument;
import com.vcc.copilot.model.DocumentKind;
import com.vcc.copilot.repository.FileRefRepository;
import com.vcc.copilot.repository.MessageRepository;
import com.vcc.copilot.repository.ProjectRepository;
import com.vcc.copilot.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds the ranked, bounded context window for a question.
 *
 * <p>Four sources are fetched concurrently, each keyed only by the subject and the project ids
 * of an {@link AccessScope}:
 * <ol>
 *   <li>project descriptions</li>
 *   <li>client-visible tasks (grant needs can_view_tasks)</li>
 *   <li>non-internal messages from conversations the subject takes part in</li>
 *   <li>client-visible file metadata (grant needs can_view_files)</li>
 * </ol>
 * Candidates are then ranked, cut to {@code maxDocuments} and trimmed to the token budget by
 * dropping the lowest-scoring documents first.
 */
@Service
public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final MessageRepository messageRepository;
    private final FileRefRepository fileRefRepository;
    private final RelevanceRanker ranker;
    private final CopilotProperties.ContextConfig config;

    public ContextAssembler(ProjectRepository projectRepository,
                            TaskRepository taskRepository,
                            MessageRepository messageRepository,
                            FileRefRepository fileRefRepository,
                            RelevanceRanker ranker,
                            CopilotProperties properties) {
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.messageRepository = messageRepository;
        this.fileRefRepository = fileRefRepository;
        this.ranker = ranker;
        this.config = properties.getContext();
    }

    /**
     * Ranked context documents for a query, at most {@code maxDocuments} long.
     */
    public Mono<List<ContextDocument>> build(UUID subjectId, String query, AccessScope scope) {
        return assemble(subjectId, query, scope).map(AssembledContext::documents);
    }

    /**
     * Ranked context documents together with per-source candidate counts.
     */
    public Mono<AssembledContext> assemble(UUID subjectId, String query, AccessScope scope) {
        if (scope == null || scope.isEmpty()) {
            return Mono.just(AssembledContext.empty());
        }
        List<UUID> projectIds = List.copyOf(scope.projectIds());

        return Mono.zip(
                        projectRepository.findScopedDescriptions(subjectId, projectIds)
                                .filter(project -> scope.contains(project.getId()))
                                .map(this::fromProject)
                                .collectList(),
                        taskRepository.findVisibleTasks(subjectId, projectIds, config.getTaskLimit())
                                .filter(task -> task.isVisibleToClient() && scope.contains(task.getProjectId()))
                                .map(this::fromTask)
                                .collectList(),
                        messageRepository.findParticipantMessages(subjectId, projectIds, config.getMessageLimit())
                                .filter(message -> !message.isInternalNote() && scope.contains(message.getProjectId()))
                                .map(this::fromMessage)
                                .collectList(),
                        fileRefRepository.findSharedFiles(subjectId, projectIds, config.getFileLimit())
                                .filter(file -> scope.contains(file.getProjectId()))
                                .map(this::fromFile)
                                .collectList())
                .map(sources -> {
                    Map<DocumentKind, Integer> counts = new EnumMap<>(DocumentKind.class);
                    counts.put(DocumentKind.CONTAINER, sources.getT1().size());
                    counts.put(DocumentKind.TASK, sources.getT2().size());
                    counts.put(DocumentKind.MESSAGE, sources.getT3().size());
                    counts.put(DocumentKind.FILE, sources.getT4().size());

                    List<ContextDocument> candidates = new ArrayList<>();
                    candidates.addAll(sources.getT1());
                    candidates.addAll(sources.getT2());
                    candidates.addAll(sources.getT3());
                    candidates.addAll(sources.getT4());

                    List<ContextDocument> selected = select(query, candidates);
                    log.debug("Assembled context for subject {}: candidates={}, selected={}",
                            subjectId, counts, selected.size());
                    return new AssembledContext(counts, selected);
                });
    }

    /**
     * Rank, cut to the document limit, then enforce the token budget. Pure.
     */
    List<ContextDocument> select(String query, List<ContextDocument> candidates) {
        List<ContextDocument> ranked = ranker.rank(query, candidates);
        List<ContextDocument> top = new ArrayList<>(ranked.subList(0, Math.min(config.getMaxDocuments(), ranked.size())));
        return enforceBudget(top);
    }

    private List<ContextDocument> enforceBudget(List<ContextDocument> ranked) {
        int budget = config.getTokenBudget();
        int total = 0;
        for (ContextDocument document : ranked) {
            total += estimateTokens(document);
        }

        // ranked is best-first, so the tail holds the lowest scores
        while (total > budget && ranked.size() > 1) {
            ContextDocument dropped = ranked.remove(ranked.size() - 1);
            total -= estimateTokens(dropped);
        }

        if (total > budget && ranked.size() == 1) {
            ContextDocument only = ranked.get(0);
            int labelChars = only.sourceLabel() != null ? only.sourceLabel().length() : 0;
            int maxChars = Math.max(0, budget * config.getCharsPerToken() - labelChars);
            ranked.set(0, only.withText(only.text().substring(0, Math.min(maxChars, only.text().length()))));
        }
        return List.copyOf(ranked);
    }

    int estimateTokens(ContextDocument document) {
        int chars = (document.sourceLabel() != null ? document.sourceLabel().length() : 0)
                + (document.text() != null ? document.text().length() : 0);
        return (chars + config.getCharsPerToken() - 1) / config.getCharsPerToken();
    }

    // ==================== Document Projections ====================
    // Text carries content fields only. Field names stay out so a query word such as
    // "status" or "task" cannot match every document of a kind.

    private ContextDocument fromProject(ProjectEntity project) {
        StringBuilder text = new StringBuilder(project.getName());
        appendLine(text, project.getStatus());
        appendLine(text, project.getDescription());
        appendLine(text, project.getClientNotes());
        return ContextDocument.unscored(project.getId(), DocumentKind.CONTAINER,
                "Project: " + project.getName(), text.toString(), project.getDateCreated(), project.getId());
    }

    private ContextDocument fromTask(TaskEntity task) {
        StringBuilder text = new StringBuilder(task.getTitle());
        appendLine(text, task.getStatus());
        appendLine(text, task.getPriority());
        appendLine(text, task.getDueDate() != null ? task.getDueDate().toString() : null);
        appendLine(text, task.getDescription());
        return ContextDocument.unscored(task.getId(), DocumentKind.TASK,
                "Task: " + task.getTitle(), text.toString(), task.getDateCreated(), task.getProjectId());
    }

    private ContextDocument fromMessage(MessageEntity message) {
        String title = message.getConversationTitle() != null ? message.getConversationTitle() : "Conversation";
        StringBuilder text = new StringBuilder();
        appendLine(text, message.getConversationTitle());
        appendLine(text, message.getText());
        return ContextDocument.unscored(message.getId(), DocumentKind.MESSAGE,
                "Message: " + title, text.toString(), message.getCreatedAt(), message.getProjectId());
    }

    private ContextDocument fromFile(FileRefEntity file) {
        String name = file.getTitle() != null && !file.getTitle().isBlank()
                ? file.getTitle()
                : file.getFilenameDownload();
        StringBuilder text = new StringBuilder(name);
        appendLine(text, file.getType());
        appendLine(text, file.getDescription());
        return ContextDocument.unscored(file.getId(), DocumentKind.FILE,
                "File: " + name, text.toString(), file.getUploadedOn(), file.getProjectId());
    }

    private static void appendLine(StringBuilder text, String value) {
        if (value != null && !value.isBlank()) {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append(value.trim());
        }
    }
}
