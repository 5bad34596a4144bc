package com.vidnyan.codeguard.domain.exception;

/**
 * A pattern file that cannot be read or does not describe valid rules.
 */
public class PatternConfigurationException extends CodeGuardException {

    public PatternConfigurationException(String message) {
        super(message);
    }

    public PatternConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
