package com.csd.formulary.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned by the REST layer, for example:
 * {
 *   "code": "FUNCTION_COLLISION",
 *   "message": "Package 'pkg' has conflicting functions: ADD",
 *   "details": {"pkg": ["ADD"]}
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private final String code;
    private final String message;
    private final Map<String, ?> details;

    public ErrorResponse(String code, String message) {
        this(code, message, null);
    }

    public ErrorResponse(String code, String message, Map<String, ?> details) {
        this.code = code;
        this.message = message;
        this.details = details;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, ?> getDetails() {
        return details;
    }
}
