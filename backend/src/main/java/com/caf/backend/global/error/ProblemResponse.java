package com.caf.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 style error body. {@code code} is the stable identifier clients branch on; {@code type}
 * is derived from it.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_PREFIX = "https://caf.org.mx/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(typeOf(safeCode), httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, instance, safeCode);
    }

    static String typeOf(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replace('_', '-').replaceAll("[^a-z0-9\\-.]+", "-");
    }
}
