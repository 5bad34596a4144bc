package com.vidnyan.codeguard.domain.syntax;

/**
 * Language-neutral node kinds. Detectors match on the kinds they care about
 * and ignore the rest.
 */
public enum NodeKind {
    MODULE,
    IMPORT,
    CLASS_DEF,
    FUNCTION_DEF,
    CONSTRUCTOR_DEF,
    LAMBDA,
    PARAMETER,
    VARIABLE_DECL,
    BLOCK,
    IF,
    RETURN,
    THROW,
    TRY,
    TRY_BODY,
    EXCEPTION_HANDLER,
    FINALLY_BODY,
    LOCK_BLOCK,
    NO_OP,
    CALL,
    NEW_INSTANCE,
    ATTRIBUTE_ACCESS,
    NAME,
    ASSIGNMENT,
    AUGMENTED_ASSIGNMENT,
    BINARY_OP,
    UNARY_OP,
    SUBSCRIPT,
    STRING_LITERAL,
    NUMBER_LITERAL,
    LITERAL,
    OTHER;

    public boolean isCallable() {
        return this == FUNCTION_DEF || this == CONSTRUCTOR_DEF || this == LAMBDA;
    }
}
