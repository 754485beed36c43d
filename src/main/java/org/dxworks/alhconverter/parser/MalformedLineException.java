package org.dxworks.alhconverter.parser;

/**
 * A line of an alarm handler file that can't be applied. The parser reports it and skips the line.
 */
public class MalformedLineException extends Exception {

    public MalformedLineException(String message) {
        super(message);
    }
}
