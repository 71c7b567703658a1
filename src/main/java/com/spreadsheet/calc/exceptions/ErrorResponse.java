package com.spreadsheet.calc.exceptions;

/**
 * Simple DTO to structure error responses with a code, a message and the HTTP status.
 * For example:
 * {
 *   "code": "UNKNOWN_FUNCTION",
 *   "message": "Unknown function: FOO",
 *   "status": 400
 * }
 */
public class ErrorResponse {
    private final String code;
    private final String message;
    private final int status;

    public ErrorResponse(String code, String message, int status) {
        this.code = code;
        this.message = message;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatus() {
        return status;
    }
}
