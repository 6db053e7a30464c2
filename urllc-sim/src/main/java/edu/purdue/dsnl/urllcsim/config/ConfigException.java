package edu.purdue.dsnl.urllcsim.config;

/** Invalid configuration. Raised before any event is scheduled. */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
