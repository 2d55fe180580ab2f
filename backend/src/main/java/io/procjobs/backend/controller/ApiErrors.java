package io.procjobs.backend.controller;

import io.procjobs.backend.model.dto.ErrorResponse;
import io.procjobs.backend.model.entity.InvalidJobFieldException;
import io.procjobs.backend.model.entity.JobStateConflictException;
import io.procjobs.backend.service.exception.InvalidJobQueryException;
import io.procjobs.backend.service.exception.InvalidPreferenceException;
import io.procjobs.backend.service.exception.JobAccessDeniedException;
import io.procjobs.backend.service.exception.JobNotFoundException;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Translates service exceptions into error responses.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static ResponseEntity<ErrorResponse> invalidPreference(InvalidPreferenceException e) {
        return build(HttpStatus.BAD_REQUEST, "InvalidParameterValue", e.getMessage(), "Prefer", e.getRawValue());
    }

    static ResponseEntity<ErrorResponse> invalidQuery(InvalidJobQueryException e) {
        HttpStatus status = e.getKind() == InvalidJobQueryException.Kind.UNPROCESSABLE
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        return build(status, "InvalidParameterValue", e.getMessage(), e.getField(), e.getRawValue());
    }

    static ResponseEntity<ErrorResponse> invalidField(InvalidJobFieldException e) {
        Object value = e.getRejectedValue();
        return build(HttpStatus.BAD_REQUEST, "InvalidParameterValue", e.getMessage(), e.getField(),
                value == null ? null : String.valueOf(value));
    }

    static ResponseEntity<ErrorResponse> notFound(JobNotFoundException e) {
        String resource = e.getResourceType();
        String type = "NoSuch" + Character.toUpperCase(resource.charAt(0)) + resource.substring(1);
        return build(HttpStatus.NOT_FOUND, type, e.getMessage(), null, e.getResourceId());
    }

    static ResponseEntity<ErrorResponse> notFound(String type, String detail, String value) {
        return build(HttpStatus.NOT_FOUND, type, detail, null, value);
    }

    static ResponseEntity<ErrorResponse> accessDenied(JobAccessDeniedException e) {
        return e.isAuthenticated()
                ? build(HttpStatus.FORBIDDEN, "Forbidden", e.getMessage(), null, e.getResourceId())
                : build(HttpStatus.UNAUTHORIZED, "Unauthorized", e.getMessage(), null, e.getResourceId());
    }

    static ResponseEntity<ErrorResponse> conflict(JobStateConflictException e) {
        return build(HttpStatus.CONFLICT, "JobStateConflict", e.getMessage(), "status", e.getRequested().getValue());
    }

    static ResponseEntity<ErrorResponse> internalError(String detail) {
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", detail, null, null);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String type, String detail,
                                                       String field, String value) {
        ErrorResponse body = ErrorResponse.builder()
                .type(type)
                .title(status.getReasonPhrase())
                .detail(detail)
                .status(status.value())
                .field(field)
                .value(value)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
