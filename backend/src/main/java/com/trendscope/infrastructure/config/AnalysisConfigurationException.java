package com.trendscope.infrastructure.config;

/**
 * Raised when analysis tables cannot be built from configuration.
 * Always fatal: the application refuses to start with partial tables.
 */
public class AnalysisConfigurationException extends RuntimeException {

    public AnalysisConfigurationException(String message) {
        super(message);
    }

    public AnalysisConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
