package com.tubedigest.config;

public class DigestConfigurationException extends RuntimeException {
    public DigestConfigurationException(String message) {
        super(message);
    }
}
