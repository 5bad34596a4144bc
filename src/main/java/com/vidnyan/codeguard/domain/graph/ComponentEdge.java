package com.vidnyan.codeguard.domain.graph;

import com.vidnyan.codeguard.domain.model.Location;

import java.util.List;

/**
 * "from references to" with the evidence found in the caller's sources.
 *
 * @param references    where the reference was seen, in scan order
 * @param errorHandled  a reference sits in a try/catch, or the caller uses a circuit breaker or fallback
 * @param retried       the referencing sources mention retry or backoff
 */
public record ComponentEdge(
    String from,
    String to,
    List<Location> references,
    boolean errorHandled,
    boolean retried
) {

    public ComponentEdge {
        references = List.copyOf(references);
    }
}
