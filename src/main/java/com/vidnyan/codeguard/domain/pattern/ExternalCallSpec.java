package com.vidnyan.codeguard.domain.pattern;

import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.syntax.SyntaxNode;

import java.util.List;

/**
 * A network or process API that must be given a timeout.
 *
 * @param call           method name ({@code waitFor}) or dotted suffix ({@code HttpClient.newBuilder});
 *                       {@code new Type} matches a constructor call
 * @param timeoutMarkers calls that supply the timeout, looked up in the fluent chain and the enclosing method
 * @param minArgs        argument count at which the call itself carries a timeout, 0 when it never does
 */
public record ExternalCallSpec(
    String call,
    ViolationType type,
    List<String> timeoutMarkers,
    int minArgs,
    String description
) {

    public ExternalCallSpec {
        timeoutMarkers = List.copyOf(timeoutMarkers);
    }

    /**
     * Whether a call or constructor node invokes this API.
     */
    public boolean matches(SyntaxNode node) {
        return CallMatcher.matches(call, node);
    }
}
