package com.vcc.copilot.service;

import com.vcc.copilot.entity.ProjectEntity;
import com.vcc.copilot.model.AccessScope;
import com.vcc.copilot.repository.ProjectRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Resolves the projects a subject may read: client-visible projects with an access grant.
 * Content fetches are only ever keyed by ids returned from here.
 */
@Service
public class AccessScopeResolver {
    private static final Logger log = LoggerFactory.getLogger(AccessScopeResolver.class);

    private final ProjectRepository projectRepository;

    public AccessScopeResolver(ProjectRepository projectRepository) {
        this.projectRepository = projectRepository;
    }

    /**
     * @param subjectId          Subject (contact) ID
     * @param requestedProjectId Optional project to narrow to; null for every accessible project
     * @return accessible scope; empty (never an error) when the requested project is not accessible
     */
    public Mono<AccessScope> resolve(UUID subjectId, UUID requestedProjectId) {
        return projectRepository.findAccessibleByContactId(subjectId)
                .map(ProjectEntity::getId)
                .collectList()
                .map(accessible -> narrow(accessible, requestedProjectId))
                .doOnNext(scope -> log.debug("Resolved scope for subject {}: {} project(s), requested={}",
                        subjectId, scope.projectIds().size(), requestedProjectId));
    }

    private AccessScope narrow(List<UUID> accessible, UUID requestedProjectId) {
        if (requestedProjectId == null) {
            return AccessScope.of(accessible);
        }
        return accessible.contains(requestedProjectId)
                ? AccessScope.of(List.of(requestedProjectId))
                : AccessScope.empty();
    }
}
