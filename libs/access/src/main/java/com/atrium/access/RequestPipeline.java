package com.atrium.access;

import com.atrium.access.spi.ResourceMetaSource;
import com.atrium.access.spi.UnitOfWork;
import com.atrium.audit.AuditEntry;
import com.atrium.audit.AuditRecorder;
import com.atrium.audit.EntityRef;
import com.atrium.observability.MetricFactory;
import com.atrium.security.Action;
import com.atrium.security.AuthorizationEvaluator;
import com.atrium.security.Decision;
import com.atrium.security.DenyReason;
import com.atrium.security.ForbiddenException;
import com.atrium.security.NotFoundException;
import com.atrium.security.Principal;
import com.atrium.security.ResourceMeta;
import com.atrium.security.TenantIsolationEnforcer;
import com.atrium.security.TenantMismatchException;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Runs one authenticated call: resolve principal, load target metadata, authorize,
 * execute, audit.
 * <p>
 * The principal is resolved before anything is read from storage. Everything after that
 * runs in a single unit of work, so the mutation and its audit entry are stored together
 * or not at all. A target in another tenant is reported exactly like a missing one.
 */
public class RequestPipeline {

    private static final Logger log = LoggerFactory.getLogger(RequestPipeline.class);

    static final String PIPELINE_TIMER = "atrium.pipeline.duration";

    private final PrincipalResolver resolver;
    private final ResourceMetaSource resources;
    private final UnitOfWork unitOfWork;
    private final AuditRecorder auditRecorder;
    private final MetricFactory metrics;

    public RequestPipeline(PrincipalResolver resolver, ResourceMetaSource resources, UnitOfWork unitOfWork,
                           AuditRecorder auditRecorder, MetricFactory metrics) {
        this.resolver = resolver;
        this.resources = resources;
        this.unitOfWork = unitOfWork;
        this.auditRecorder = auditRecorder;
        this.metrics = metrics;
    }

    /**
     * @param accessToken bare access token of the caller
     * @param action      the requested action
     * @param target      what the action applies to
     * @param operation   business code to run once authorized
     * @return the operation's result
     * @throws com.atrium.security.UnauthenticatedException if the token does not resolve
     * @throws NotFoundException                             if the target is absent or foreign
     * @throws ForbiddenException                            if the decision is deny
     */
    public <T> T authorizeAndExecute(String accessToken, Action action, Target target, GuardedOperation<T> operation) {
        requireArguments(action, target, operation);
        return authorizeAndExecute(resolver.resolve(accessToken), action, target, operation);
    }

    /**
     * Same as {@link #authorizeAndExecute(String, Action, Target, GuardedOperation)} for a caller
     * already resolved by {@link PrincipalResolver} earlier in the same request.
     */
    public <T> T authorizeAndExecute(Principal principal, Action action, Target target, GuardedOperation<T> operation) {
        if (principal == null) {
            throw new IllegalArgumentException("principal is required");
        }
        requireArguments(action, target, operation);

        Timer.Sample sample = Timer.start(metrics.registry());
        String outcome = "error";
        try {
            Completed<T> completed = unitOfWork.inTransaction(() -> runGuarded(principal, action, target, operation));
            if (completed.auditEntry() != null) {
                auditRecorder.publish(completed.auditEntry());
            }
            outcome = "success";
            return completed.value();
        } catch (ForbiddenException e) {
            outcome = "forbidden";
            throw e;
        } catch (NotFoundException e) {
            outcome = "not_found";
            throw e;
        } finally {
            sample.stop(metrics.timer(PIPELINE_TIMER, "Duration of guarded operations",
                    "action", tagValue(action), "outcome", outcome));
        }
    }

    private <T> Completed<T> runGuarded(Principal principal, Action action, Target target,
                                        GuardedOperation<T> operation) {
        ResourceMeta meta = loadMeta(principal, target);

        try {
            TenantIsolationEnforcer.enforce(principal, meta.tenantId());
        } catch (TenantMismatchException e) {
            log.info("Denied {} on {}: {}", action, target, DenyReason.TENANT_MISMATCH);
            metrics.recordDecision(tagValue(action), "deny", tagValue(DenyReason.TENANT_MISMATCH));
            throw notFound(target.entityRef());
        }

        Decision decision = AuthorizationEvaluator.authorize(principal, action, meta);
        metrics.recordDecision(tagValue(action), decision.label(),
                decision.allowed() ? "none" : tagValue(decision.reason()));
        if (!decision.allowed()) {
            log.info("Denied {} on {}: {}", action, target, decision.reason());
            throw new ForbiddenException(action, decision.reason());
        }

        Effect<T> effect = operation.execute(principal, meta);
        if (effect == null) {
            throw new IllegalStateException("operation for " + action + " returned no effect");
        }
        if (!effect.isMutation()) {
            return new Completed<>(effect.value(), null);
        }
        if (!action.mutating()) {
            throw new IllegalStateException("non-mutating action " + action + " produced a change");
        }
        AuditEntry entry = auditRecorder.record(
                principal.userId(), principal.tenantId(), effect.auditAction(), effect.changed());
        return new Completed<>(effect.value(), entry);
    }

    private static void requireArguments(Action action, Target target, GuardedOperation<?> operation) {
        if (action == null || target == null || operation == null) {
            throw new IllegalArgumentException("action, target and operation are required");
        }
    }

    private ResourceMeta loadMeta(Principal principal, Target target) {
        return switch (target.scope()) {
            case CREATION -> ResourceMeta.createdBy(principal);
            case TENANT -> ResourceMeta.unowned(principal.tenantId());
            case ENTITY -> resources.load(target.entityRef(), principal.tenantId())
                    .orElseThrow(() -> notFound(target.entityRef()));
        };
    }

    private static NotFoundException notFound(EntityRef entity) {
        if (entity == null) {
            return new NotFoundException("Resource not found");
        }
        return NotFoundException.of(entity.kind().value(), entity.id());
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private record Completed<T>(T value, AuditEntry auditEntry) {
    }
}
