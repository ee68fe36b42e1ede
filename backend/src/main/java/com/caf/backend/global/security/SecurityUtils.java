package com.caf.backend.global.security;

import java.util.UUID;

import com.caf.backend.global.error.ProblemException;
import com.caf.backend.modules.access.domain.Actor;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    public static JwtAuthenticationPrincipal getCurrentPrincipal() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null || !(authentication.getPrincipal() instanceof JwtAuthenticationPrincipal principal)) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "authentication required");
        }
        return principal;
    }

    public static UUID getCurrentUserId() {
        return getCurrentPrincipal().userId();
    }

    /**
     * The actor for the current request, immutable for its duration.
     */
    public static Actor getCurrentActor() {
        return getCurrentPrincipal().toActor();
    }
}
