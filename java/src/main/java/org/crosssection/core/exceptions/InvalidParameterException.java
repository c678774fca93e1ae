package org.crosssection.core.exceptions;

/**
 * Material or processing parameter out of range, missing or unknown.
 */
public class InvalidParameterException extends CrossSectionException {
    public InvalidParameterException(String message) {
        super("Invalid parameter: " + message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super("Invalid parameter: " + message, cause);
    }
}
