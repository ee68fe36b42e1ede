package com.caf.backend.global.security;

import java.io.IOException;

import com.caf.backend.global.error.ProblemResponse;
import com.caf.backend.modules.access.application.ForbiddenException;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

/**
 * Renders filter-level denials with the same body as policy engine denials.
 */
@Component
public class RestAccessDeniedHandler implements AccessDeniedHandler {

    private final ProblemResponseWriter problemResponseWriter;

    public RestAccessDeniedHandler(ProblemResponseWriter problemResponseWriter) {
        this.problemResponseWriter = problemResponseWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response, AccessDeniedException accessDeniedException)
            throws IOException {
        problemResponseWriter.write(response, ProblemResponse.of(
                HttpStatus.FORBIDDEN,
                ForbiddenException.CODE,
                ForbiddenException.UNIFORM_DETAIL,
                request.getRequestURI()
        ));
    }
}
