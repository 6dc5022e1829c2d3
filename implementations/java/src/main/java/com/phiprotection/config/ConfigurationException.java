package com.phiprotection.config;

/**
 * Thrown at startup when a required secret is missing or unusable.
 * There is no fallback value for any secret.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
