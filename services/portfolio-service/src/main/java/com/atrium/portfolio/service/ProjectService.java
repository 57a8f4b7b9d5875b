package com.atrium.portfolio.service;

import com.atrium.access.Effect;
import com.atrium.access.RequestPipeline;
import com.atrium.access.Target;
import com.atrium.audit.AuditAction;
import com.atrium.audit.EntityKind;
import com.atrium.audit.EntityRef;
import com.atrium.portfolio.domain.NewProject;
import com.atrium.portfolio.domain.Project;
import com.atrium.portfolio.domain.ProjectChanges;
import com.atrium.portfolio.domain.ProjectDetails;
import com.atrium.portfolio.domain.ProjectQuery;
import com.atrium.portfolio.domain.Tag;
import com.atrium.portfolio.infrastructure.store.InMemoryPortfolioStore;
import com.atrium.security.Action;
import com.atrium.security.NotFoundException;
import com.atrium.security.Principal;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Project CRUD. Creation stamps the caller as owner; updates and deletes are allowed to admins
 * for any project and to editors for their own.
 */
@Service
public class ProjectService {

    private final RequestPipeline pipeline;
    private final InMemoryPortfolioStore store;
    private final TagService tagService;

    public ProjectService(RequestPipeline pipeline, InMemoryPortfolioStore store, TagService tagService) {
        this.pipeline = pipeline;
        this.store = store;
        this.tagService = tagService;
    }

    public ProjectDetails create(Principal caller, NewProject request) {
        return pipeline.authorizeAndExecute(caller, Action.CREATE, Target.creation(),
                (principal, meta) -> {
                    List<Tag> tags = tagService.upsert(meta.tenantId(), request.tagNames());
                    var project = store.createProject(
                            meta.tenantId(),
                            meta.ownerUserId(),
                            request.title().trim(),
                            request.description().trim(),
                            request.githubUrl(),
                            request.isPublic(),
                            tags.stream().map(Tag::id).toList());
                    return Effect.mutation(details(project), AuditAction.CREATE, ref(project.id()));
                });
    }

    /** @throws NotFoundException if the project does not exist in the caller's tenant */
    public ProjectDetails get(Principal caller, long projectId) {
        return pipeline.authorizeAndExecute(caller, Action.READ, Target.entity(ref(projectId)),
                (principal, meta) -> Effect.read(details(existing(projectId))));
    }

    public List<ProjectDetails> list(Principal caller, ProjectQuery query) {
        return pipeline.authorizeAndExecute(caller, Action.READ, Target.tenant(),
                (principal, meta) -> {
                    Optional<Long> tagId = Optional.empty();
                    if (query.tag() != null) {
                        Optional<Tag> tag = store.findTag(principal.tenantId(), query.tag());
                        if (tag.isEmpty()) {
                            return Effect.read(List.<ProjectDetails>of());
                        }
                        tagId = tag.map(Tag::id);
                    }
                    Optional<Long> requiredTag = tagId;
                    List<ProjectDetails> page = store.listProjects(principal.tenantId()).stream()
                            .filter(query.matchesFields())
                            .filter(p -> requiredTag.map(p.tagIds()::contains).orElse(true))
                            .sorted(query.sort().comparator())
                            .skip(query.offset())
                            .limit(query.limit())
                            .map(this::details)
                            .toList();
                    return Effect.read(page);
                });
    }

    /** Applies the non-null fields of {@code changes}. */
    public ProjectDetails update(Principal caller, long projectId, ProjectChanges changes) {
        return pipeline.authorizeAndExecute(caller, Action.UPDATE, Target.entity(ref(projectId)),
                (principal, meta) -> {
                    Project current = existing(projectId);
                    List<Long> tagIds = changes.tagNames() == null
                            ? current.tagIds()
                            : tagService.upsert(meta.tenantId(), changes.tagNames()).stream()
                                    .map(Tag::id)
                                    .toList();
                    var updated = store.updateProject(new Project(
                            current.id(),
                            current.tenantId(),
                            current.ownerUserId(),
                            changes.title() != null ? changes.title().trim() : current.title(),
                            changes.description() != null ? changes.description().trim() : current.description(),
                            changes.githubUrl() != null ? changes.githubUrl() : current.githubUrl(),
                            changes.isPublic() != null ? changes.isPublic() : current.isPublic(),
                            tagIds,
                            current.createdAt(),
                            current.updatedAt()));
                    return Effect.mutation(details(updated), AuditAction.UPDATE, ref(projectId));
                });
    }

    public void delete(Principal caller, long projectId) {
        pipeline.authorizeAndExecute(caller, Action.DELETE, Target.entity(ref(projectId)),
                (principal, meta) -> {
                    store.deleteProject(projectId);
                    return Effect.mutation(Boolean.TRUE, AuditAction.DELETE, ref(projectId));
                });
    }

    private Project existing(long projectId) {
        return store.findProject(projectId)
                .orElseThrow(() -> NotFoundException.of(EntityKind.PROJECT.value(), projectId));
    }

    private ProjectDetails details(Project project) {
        return new ProjectDetails(project, store.findTags(project.tagIds()));
    }

    private static EntityRef ref(long projectId) {
        return EntityRef.of(EntityKind.PROJECT, projectId);
    }
}
