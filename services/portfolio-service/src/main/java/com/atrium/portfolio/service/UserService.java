package com.atrium.portfolio.service;

import com.atrium.access.CredentialAuthenticator;
import com.atrium.access.Effect;
import com.atrium.access.RequestPipeline;
import com.atrium.access.Target;
import com.atrium.access.spi.UserAccount;
import com.atrium.audit.AuditAction;
import com.atrium.audit.EntityKind;
import com.atrium.audit.EntityRef;
import com.atrium.identity.CredentialVerifier;
import com.atrium.portfolio.infrastructure.store.InMemoryPortfolioStore;
import com.atrium.security.Action;
import com.atrium.security.ConflictException;
import com.atrium.security.Principal;
import com.atrium.security.Role;
import java.util.List;
import org.springframework.stereotype.Service;

/** User administration within the caller's organization. Requires {@code manage-users}. */
@Service
public class UserService {

    private final RequestPipeline pipeline;
    private final InMemoryPortfolioStore store;
    private final CredentialVerifier verifier;

    public UserService(
            RequestPipeline pipeline, InMemoryPortfolioStore store, CredentialVerifier verifier) {
        this.pipeline = pipeline;
        this.store = store;
        this.verifier = verifier;
    }

    /**
     * Creates a user in the caller's tenant.
     *
     * @throws ConflictException if the email is registered anywhere
     */
    public UserAccount create(Principal caller, String email, String password, Role role) {
        String normalizedEmail = CredentialAuthenticator.normalizeEmail(email);
        // Argon2 runs before the unit of work so the store lock is not held while hashing
        String hash = verifier.hash(password);
        return pipeline.authorizeAndExecute(caller, Action.MANAGE_USERS, Target.tenant(),
                (principal, meta) -> {
                    if (store.findByEmail(normalizedEmail).isPresent()) {
                        throw new ConflictException("Email already registered");
                    }
                    var user = store.createUser(
                            principal.tenantId(), normalizedEmail, role, hash);
                    return Effect.mutation(
                            user, AuditAction.CREATE, EntityRef.of(EntityKind.USER, user.id()));
                });
    }

    /** Users of the caller's tenant, ordered by id. */
    public List<UserAccount> list(Principal caller) {
        return pipeline.authorizeAndExecute(caller, Action.MANAGE_USERS, Target.tenant(),
                (principal, meta) -> Effect.read(store.listUsers(principal.tenantId())));
    }
}
