package com.netforge.core.schematic;

/**
 * Thrown when a schematic snapshot cannot be read or parsed.
 */
public class SchematicReadException extends RuntimeException {

    public SchematicReadException(String message) {
        super(message);
    }

    public SchematicReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
