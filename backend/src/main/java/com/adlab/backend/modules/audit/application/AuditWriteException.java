package com.adlab.backend.modules.audit.application;

import com.adlab.backend.global.error.GovernanceErrorKind;
import com.adlab.backend.global.error.GovernanceException;
import com.adlab.backend.global.error.GovernanceStage;

/**
 * An audit entry could not be recorded. When raised after a governed mutation the mutation has
 * already committed.
 */
public class AuditWriteException extends GovernanceException {

    public AuditWriteException(String detail) {
        super(GovernanceErrorKind.AUDIT_WRITE_ERROR, GovernanceStage.AUDIT_WRITE, detail);
    }

    public AuditWriteException(String detail, Throwable cause) {
        super(GovernanceErrorKind.AUDIT_WRITE_ERROR, GovernanceStage.AUDIT_WRITE, detail, cause);
    }
}
