package com.vidnyan.codeguard.application.port.out;

import com.vidnyan.codeguard.domain.report.AnalysisReport;

/**
 * Port for turning a report into text for a file or the console.
 */
public interface ReportRenderer {

    /**
     * Format name this renderer answers to ({@code json}, {@code text}).
     */
    String format();

    /**
     * Render the report. Equal reports render to identical strings.
     */
    String render(AnalysisReport report);
}
