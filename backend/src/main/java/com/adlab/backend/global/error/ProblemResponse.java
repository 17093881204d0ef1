package com.adlab.backend.global.error;

import java.time.OffsetDateTime;

import org.springframework.http.HttpStatus;

public record ProblemResponse(
        String type,
        String title,
        int status,
        String code,
        String detail,
        String instance,
        String stage,
        OffsetDateTime timestamp
) {

    public static final String INTERNAL_ERROR_CODE = "internal_error";
    public static final String INTERNAL_ERROR_DETAIL = "Unexpected server error";

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:adlab:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        return build(httpStatus, safeCode, DEFAULT_TYPE_PREFIX + ProblemException.normalize(safeCode), detail, instance, null);
    }

    public static ProblemResponse from(ProblemException ex, String instance) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return build(status, ex.getCode(), ex.getProblemType(), ex.getDetailMessage(), instance, ex.getStage());
    }

    private static ProblemResponse build(HttpStatus status, String code, String type, String detail, String instance,
                                         String stage) {
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : status.getReasonPhrase();
        return new ProblemResponse(type, status.getReasonPhrase(), status.value(), code, safeDetail, instance, stage,
                OffsetDateTime.now());
    }
}
