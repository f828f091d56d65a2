package com.streetsweeping.engine.service;

/**
 * A geometry field could not be turned into a usable line.
 */
public class GeometryParseException extends Exception {

    public GeometryParseException(String message) {
        super(message);
    }

    public GeometryParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
