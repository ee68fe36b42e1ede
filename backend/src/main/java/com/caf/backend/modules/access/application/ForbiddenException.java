package com.caf.backend.modules.access.application;

import com.caf.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Uniform denial. Carries no hint of which rule fired or whether the target exists.
 */
public class ForbiddenException extends ProblemException {

    public static final String CODE = "FORBIDDEN";
    public static final String UNIFORM_DETAIL = "not authorized";

    public ForbiddenException() {
        super(HttpStatus.FORBIDDEN, CODE, UNIFORM_DETAIL);
    }

    public ForbiddenException(Throwable cause) {
        super(HttpStatus.FORBIDDEN, CODE, UNIFORM_DETAIL, cause);
    }
}
