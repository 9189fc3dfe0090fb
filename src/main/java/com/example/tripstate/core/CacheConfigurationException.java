package com.example.tripstate.core;

/**
 * Thrown when a {@link BoundedCache} is built with an unusable size or TTL.
 */
public class CacheConfigurationException extends IllegalArgumentException {

    public CacheConfigurationException(String message) {
        super(message);
    }
}
