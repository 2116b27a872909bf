package com.minichess.core.ai;

/**
 * Thrown when search settings are rejected before a search starts.
 */
public class SearchConfigurationException extends IllegalArgumentException {

    public SearchConfigurationException(String message) {
        super(message);
    }
}
