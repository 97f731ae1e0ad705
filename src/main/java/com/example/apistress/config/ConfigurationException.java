package com.example.apistress.config;

/** Invalid run configuration. Raised before the log is opened and before any request is sent. */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
