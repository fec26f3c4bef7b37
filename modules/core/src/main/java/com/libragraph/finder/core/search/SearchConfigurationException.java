package com.libragraph.finder.core.search;

/**
 * Thrown when a query cannot be run as configured. Raised before any archive is opened.
 */
public class SearchConfigurationException extends IllegalArgumentException {

    public SearchConfigurationException(String message) {
        super(message);
    }
}
