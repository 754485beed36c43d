package org.dxworks.alhconverter.model;

public final class Guidance {
    public final String title;
    public final String details;

    public Guidance(String title, String details) {
        this.title = title;
        this.details = details;
    }
}
