package org.dxworks.alhconverter.model;

public final class Display {
    public final String title;
    public final String details; // display file path or resource URL

    public Display(String title, String details) {
        this.title = title;
        this.details = details;
    }
}
