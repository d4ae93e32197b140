package com.tasklane.backend.modules.auth.application;

import com.tasklane.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * A stored password digest is not a bcrypt digest. The account cannot authenticate
 * until the credential is repaired, so the request fails as a server error.
 */
public class CorruptCredentialException extends ProblemException {

    public CorruptCredentialException() {
        this(null);
    }

    public CorruptCredentialException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "CORRUPT_CREDENTIAL", "Stored credential is unreadable", cause);
    }
}
