package com.vidnyan.codeguard.domain.exception;

/**
 * Base of the unchecked exceptions thrown by the analysis engine.
 */
public class CodeGuardException extends RuntimeException {

    public CodeGuardException(String message) {
        super(message);
    }

    public CodeGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
