package com.atrium.portfolio.infrastructure.seed;

import com.atrium.identity.CredentialVerifier;
import com.atrium.portfolio.infrastructure.store.InMemoryPortfolioStore;
import com.atrium.security.Role;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Creates the "Demo Org" organization with one admin, one editor and one viewer when
 * {@code atrium.seed.demo-tenant=true}. Existing organizations and users are left alone.
 */
@Component
@ConditionalOnProperty(prefix = "atrium.seed", name = "demo-tenant", havingValue = "true")
public class DemoTenantSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(DemoTenantSeeder.class);

    public static final String ORGANIZATION_NAME = "Demo Org";

    static final List<DemoUser> USERS = List.of(
            new DemoUser("admin@example.com", "admin12345", Role.ADMIN),
            new DemoUser("editor@example.com", "editor12345", Role.EDITOR),
            new DemoUser("viewer@example.com", "viewer12345", Role.VIEWER));

    private final InMemoryPortfolioStore store;
    private final CredentialVerifier verifier;

    public DemoTenantSeeder(InMemoryPortfolioStore store, CredentialVerifier verifier) {
        this.store = store;
        this.verifier = verifier;
    }

    @Override
    public void run(ApplicationArguments args) {
        store.inTransaction(() -> {
            var org = store.findOrganizationByName(ORGANIZATION_NAME)
                    .orElseGet(() -> store.createOrganization(ORGANIZATION_NAME));
            for (DemoUser user : USERS) {
                if (store.findByEmail(user.email()).isEmpty()) {
                    store.createUser(org.id(), user.email(), user.role(), verifier.hash(user.password()));
                    log.info("Seeded {} user {}", user.role().value(), user.email());
                }
            }
            return org;
        });
    }

    record DemoUser(String email, String password, Role role) {}
}
