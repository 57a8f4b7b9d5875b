package com.atrium.portfolio.service;

import com.atrium.access.Effect;
import com.atrium.access.RequestPipeline;
import com.atrium.access.Target;
import com.atrium.audit.AuditAction;
import com.atrium.audit.EntityKind;
import com.atrium.audit.EntityRef;
import com.atrium.portfolio.domain.Tag;
import com.atrium.portfolio.infrastructure.store.InMemoryPortfolioStore;
import com.atrium.security.Action;
import com.atrium.security.ConflictException;
import com.atrium.security.Principal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Service;

@Service
public class TagService {

    private final RequestPipeline pipeline;
    private final InMemoryPortfolioStore store;

    public TagService(RequestPipeline pipeline, InMemoryPortfolioStore store) {
        this.pipeline = pipeline;
        this.store = store;
    }

    /**
     * Creates a tag in the caller's tenant. The name is trimmed and lower-cased first.
     *
     * @throws ConflictException if the tenant already has a tag with that name
     */
    public Tag create(Principal caller, String name) {
        String normalized = Tag.normalize(name);
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("Tag name must not be blank");
        }
        return pipeline.authorizeAndExecute(caller, Action.CREATE_TAG, Target.creation(),
                (principal, meta) -> {
                    if (store.findTag(meta.tenantId(), normalized).isPresent()) {
                        throw new ConflictException("Tag already exists");
                    }
                    var tag = store.createTag(meta.tenantId(), normalized);
                    return Effect.mutation(tag, AuditAction.CREATE, EntityRef.of(EntityKind.TAG, tag.id()));
                });
    }

    /** Tags of the caller's tenant, ordered by name. */
    public List<Tag> list(Principal caller) {
        return pipeline.authorizeAndExecute(caller, Action.READ, Target.tenant(),
                (principal, meta) -> Effect.read(store.listTags(principal.tenantId())));
    }

    /**
     * Resolves tag names to tags of the tenant, creating the missing ones. Blank names are
     * skipped and duplicates collapse. Must run inside the caller's unit of work.
     */
    List<Tag> upsert(long tenantId, Collection<String> names) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String name : names) {
            String n = Tag.normalize(name);
            if (!n.isEmpty()) {
                normalized.add(n);
            }
        }
        List<Tag> tags = new ArrayList<>();
        for (String name : normalized) {
            tags.add(store.findTag(tenantId, name).orElseGet(() -> store.createTag(tenantId, name)));
        }
        return tags;
    }
}
