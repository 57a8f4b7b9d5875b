package com.atrium.portfolio.service;

import com.atrium.access.Effect;
import com.atrium.access.RequestPipeline;
import com.atrium.access.Target;
import com.atrium.portfolio.domain.Organization;
import com.atrium.portfolio.infrastructure.store.InMemoryPortfolioStore;
import com.atrium.security.Action;
import com.atrium.security.NotFoundException;
import com.atrium.security.Principal;
import org.springframework.stereotype.Service;

@Service
public class OrganizationService {

    private final RequestPipeline pipeline;
    private final InMemoryPortfolioStore store;

    public OrganizationService(RequestPipeline pipeline, InMemoryPortfolioStore store) {
        this.pipeline = pipeline;
        this.store = store;
    }

    /** The caller's own organization. */
    public Organization current(Principal caller) {
        return pipeline.authorizeAndExecute(caller, Action.READ, Target.tenant(),
                (principal, meta) -> Effect.read(store.findOrganization(principal.tenantId())
                        .orElseThrow(() -> NotFoundException.of("organization", principal.tenantId()))));
    }
}
