package com.tasklane.backend.modules.auth.application;

/**
 * Why a bearer token was rejected. Internal only: every value maps to the same 401.
 */
public enum AuthError {
    MALFORMED,
    INVALID_SIGNATURE,
    EXPIRED
}
