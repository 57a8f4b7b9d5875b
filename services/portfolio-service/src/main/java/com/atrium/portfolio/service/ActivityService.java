package com.atrium.portfolio.service;

import com.atrium.access.Effect;
import com.atrium.access.RequestPipeline;
import com.atrium.access.Target;
import com.atrium.audit.AuditEntry;
import com.atrium.audit.AuditRecorder;
import com.atrium.security.Action;
import com.atrium.security.Principal;
import java.util.List;
import org.springframework.stereotype.Service;

/** Read access to the caller's audit trail. Requires {@code view-audit}. */
@Service
public class ActivityService {

    public static final int MAX_LIMIT = 100;

    private final RequestPipeline pipeline;
    private final AuditRecorder recorder;

    public ActivityService(RequestPipeline pipeline, AuditRecorder recorder) {
        this.pipeline = pipeline;
        this.recorder = recorder;
    }

    /** The caller's tenant's entries, newest first. */
    public List<AuditEntry> list(Principal caller, int limit, int offset) {
        return pipeline.authorizeAndExecute(caller, Action.VIEW_AUDIT, Target.tenant(),
                (principal, meta) -> Effect.read(recorder.history(principal.tenantId(), limit, offset)));
    }
}
