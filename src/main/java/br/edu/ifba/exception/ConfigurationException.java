package br.edu.ifba.exception;

/**
 * Thrown when the resolution configuration is invalid.
 * Raised before any record is processed and aborts the whole run.
 */
public class ConfigurationException extends RuntimeException {
    
    public ConfigurationException(final String message) {
        super(message);
    }
    
    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
