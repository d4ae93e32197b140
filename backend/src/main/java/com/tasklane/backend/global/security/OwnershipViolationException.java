package com.tasklane.backend.global.security;

import com.tasklane.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public class OwnershipViolationException extends ProblemException {

    public static final String CODE = "NOT_RESOURCE_OWNER";

    public OwnershipViolationException() {
        super(HttpStatus.FORBIDDEN, CODE, "You do not have access to this resource");
    }
}
