package org.dxworks.alhconverter.model;

public final class Command {
    public final String title;
    public final String details; // the command line to run

    public Command(String title, String details) {
        this.title = title;
        this.details = details;
    }
}
