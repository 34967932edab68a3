package com.contextfusion.common.exception;

/**
 * Failure of a fusion component that must reach the caller, such as a session write.
 */
public class ContextFusionException extends RuntimeException {
    private final String component;

    public ContextFusionException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public ContextFusionException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
