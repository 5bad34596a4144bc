package com.vidnyan.codeguard.domain.pattern;

import com.vidnyan.codeguard.domain.model.Severity;

import java.util.List;
import java.util.Locale;

/**
 * A family of calls that must run inside an exception handler,
 * e.g. database operations.
 *
 * @param receivers       lower-case fragments of the receiver name ({@code jdbc}, {@code template});
 *                        a capitalized entry is a type name and must match exactly ({@code Files})
 * @param methods         method names
 * @param constructors    types whose construction counts as the operation ({@code FileReader})
 * @param acceptResources whether a try-with-resources block counts as handling
 */
public record OperationRequirement(
    String id,
    List<String> receivers,
    List<String> methods,
    List<String> constructors,
    boolean acceptResources,
    Severity severity,
    String fixStrategy
) {

    public OperationRequirement {
        receivers = List.copyOf(receivers);
        methods = List.copyOf(methods);
        constructors = List.copyOf(constructors);
    }

    public boolean matches(String receiverName, String method) {
        if (!methods.contains(method)) return false;
        String lower = receiverName.toLowerCase(Locale.ROOT);
        return receivers.stream().anyMatch(r -> !r.isEmpty() && Character.isUpperCase(r.charAt(0))
                ? r.equals(receiverName)
                : lower.contains(r));
    }

    public boolean matchesConstruction(String type) {
        return constructors.contains(type);
    }

    public String label() {
        return id.replace('_', ' ');
    }
}
