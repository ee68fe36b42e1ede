package com.caf.backend.modules.audit.application;

import com.caf.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class AuditWriteFailureException extends ProblemException {

    public AuditWriteFailureException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "AUDIT_WRITE_FAILED", "audit entry could not be written", cause);
    }
}
