package org.dxworks.alhconverter.model;

public class DuplicateIdentifierException extends StructuralException {

    private final String identifier;

    public DuplicateIdentifierException(String identifier, String message) {
        super("Duplicate ID '" + identifier + "' " + message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
