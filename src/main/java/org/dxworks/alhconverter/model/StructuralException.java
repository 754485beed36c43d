package org.dxworks.alhconverter.model;

/**
 * Raised when an operation would break the shape of the alarm tree.
 * Fatal to the operation it occurs in.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }
}
