package com.components.bom.exception;

/**
 * Thrown when a BOM header row offers no usable column at all.
 * <p>
 * Fatal for the file being read: no partial result is produced, but the session and any other
 * file keep working.
 * </p>
 */
public class BomSchemaException extends RuntimeException {

    public BomSchemaException(final String message) {
        super(message);
    }
}
