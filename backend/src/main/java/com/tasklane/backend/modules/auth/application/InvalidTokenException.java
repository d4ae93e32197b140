package com.tasklane.backend.modules.auth.application;

public class InvalidTokenException extends RuntimeException {

    private final AuthError reason;

    public InvalidTokenException(AuthError reason, String message) {
        this(reason, message, null);
    }

    public InvalidTokenException(AuthError reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public AuthError getReason() {
        return reason;
    }
}
