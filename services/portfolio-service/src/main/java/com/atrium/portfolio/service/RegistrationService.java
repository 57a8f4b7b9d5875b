package com.atrium.portfolio.service;

import com.atrium.access.AuthenticatedSession;
import com.atrium.access.CredentialAuthenticator;
import com.atrium.identity.CredentialVerifier;
import com.atrium.observability.MetricFactory;
import com.atrium.portfolio.infrastructure.store.InMemoryPortfolioStore;
import com.atrium.security.ConflictException;
import com.atrium.security.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Self-service sign-up: creates an organization together with its first admin and logs
 * that admin in.
 */
@Service
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    private final InMemoryPortfolioStore store;
    private final CredentialVerifier verifier;
    private final CredentialAuthenticator authenticator;
    private final MetricFactory metrics;

    public RegistrationService(
            InMemoryPortfolioStore store,
            CredentialVerifier verifier,
            CredentialAuthenticator authenticator,
            MetricFactory metrics) {
        this.store = store;
        this.verifier = verifier;
        this.authenticator = authenticator;
        this.metrics = metrics;
    }

    /**
     * @throws ConflictException if the organization name or the email is already taken
     */
    public AuthenticatedSession register(String organizationName, String email, String password) {
        String name = organizationName.trim();
        String normalizedEmail = CredentialAuthenticator.normalizeEmail(email);
        String hash = verifier.hash(password);

        var admin = store.inTransaction(() -> {
            if (store.findOrganizationByName(name).isPresent()) {
                throw new ConflictException("Organization name already exists");
            }
            if (store.findByEmail(normalizedEmail).isPresent()) {
                throw new ConflictException("Email already registered");
            }
            var org = store.createOrganization(name);
            return store.createUser(org.id(), normalizedEmail, Role.ADMIN, hash);
        });

        log.info("Registered organization {} with admin user {}", admin.tenantId(), admin.id());
        metrics.recordAuthAttempt("register", "success");
        return authenticator.issueFor(admin);
    }
}
