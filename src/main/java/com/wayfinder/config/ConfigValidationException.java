package com.wayfinder.config;

/**
 * Exception thrown when well-formed configuration holds illegal values.
 */
public class ConfigValidationException extends Exception {
    
    private final String field;
    
    public ConfigValidationException(String message) {
        this(message, (String) null);
    }
    
    public ConfigValidationException(String message, String field) {
        super(message);
        this.field = field;
    }
    
    public ConfigValidationException(String message, Throwable cause) {
        super(message, cause);
        this.field = null;
    }
    
    /**
     * Gets the offending field.
     * 
     * @return the field name, or null if the error is not tied to one field
     */
    public String getField() {
        return field;
    }
}
