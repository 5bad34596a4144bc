package com.vidnyan.codeguard.domain.detector;

import com.vidnyan.codeguard.domain.model.Violation;

import java.util.List;

/**
 * A stateless checker run once per parsed file.
 * Implementations share no mutable state, so detectors may run in any order
 * and on many files at once.
 */
public interface ViolationDetector {

    List<Violation> detect(DetectionContext context);

    /**
     * Get the detector name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
