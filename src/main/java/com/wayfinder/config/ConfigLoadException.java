package com.wayfinder.config;

/**
 * Exception thrown when a navigator configuration file cannot be read or
 * is not valid JSON.
 */
public class ConfigLoadException extends Exception {
    
    public ConfigLoadException(String message) {
        super(message);
    }
    
    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
