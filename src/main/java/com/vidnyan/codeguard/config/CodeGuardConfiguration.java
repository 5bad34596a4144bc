package com.vidnyan.codeguard.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.codeguard.adapter.out.pattern.PatternLibraryLoader;
import com.vidnyan.codeguard.domain.detector.ViolationDetector;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for CodeGuard components.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class CodeGuardConfiguration {

    /**
     * ObjectMapper for JSON reports and contracts.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Pattern library shared read-only by every worker.
     */
    @Bean
    public PatternLibrary patternLibrary(PatternLibraryLoader loader) {
        PatternLibrary library = loader.load();
        log.info("Pattern library: {} business flows, {} integration rules (source: {})",
                library.businessRules().size(), library.integrationRules().size(), library.source());
        return library;
    }

    /**
     * Log available detectors on startup.
     */
    @Bean
    public String logDetectors(List<ViolationDetector> detectors) {
        log.info("Registered {} violation detectors:", detectors.size());
        detectors.forEach(d -> log.info("  - {}", d.getName()));
        return "detectors-logged";
    }
}
