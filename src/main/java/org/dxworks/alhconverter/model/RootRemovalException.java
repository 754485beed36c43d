package org.dxworks.alhconverter.model;

public class RootRemovalException extends StructuralException {

    public RootRemovalException(String message) {
        super(message);
    }
}
