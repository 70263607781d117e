package com.example.elemental.persistence;

/**
 * Raised when elemental data or configuration cannot be loaded.
 */
public class ElementDataException extends RuntimeException {

    private final String resourcePath;

    public ElementDataException(String resourcePath, String message) {
        super(resourcePath + ": " + message);
        this.resourcePath = resourcePath;
    }

    public ElementDataException(String resourcePath, String message, Throwable cause) {
        super(resourcePath + ": " + message, cause);
        this.resourcePath = resourcePath;
    }

    public String getResourcePath() {
        return resourcePath;
    }
}
