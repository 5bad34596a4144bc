package com.vidnyan.codeguard.domain.context;

/**
 * Enclosing constructs that protect a statement.
 */
public enum GuardKind {
    /** Body of a try statement with at least one catch clause. */
    EXCEPTION,
    /** synchronized block or method, or a try whose finally block unlocks. */
    LOCK,
    /** Body of a try-with-resources statement. */
    RESOURCE
}
