package com.vidnyan.codeguard;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the analysis engine.
 * Can be configured via application.yml or {@code --codeguard.analysis.*} arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "codeguard.analysis")
public class AnalysisProperties {

    /**
     * Path to the repository to analyze. Nothing runs while it is blank.
     */
    private String repositoryPath = "";

    private boolean includeTests = false;

    /**
     * Lines above a finding searched for guards.
     * Default: the pattern library's {@code defensive.lookback_lines}
     */
    private Integer lookbackLines;

    /**
     * Upper bound of parallel workers; also capped by the CPU count.
     */
    private int workerThreads = Runtime.getRuntime().availableProcessors();

    private String componentsDir = "components";

    private String contractsDir = "contracts";

    /**
     * {@code text} or {@code json}.
     */
    private String reportFormat = "text";

    /**
     * File to write the report to; printed to stdout when blank.
     */
    private String reportOutput = "";

    /**
     * Exit with status 1 when the report holds a critical finding.
     */
    private boolean failOnCritical = true;
}
