package org.crosssection.core.exceptions;

public class InvalidSpectrumException extends CrossSectionException {
    public InvalidSpectrumException(String message) {
        super("Invalid spectrum: " + message);
    }

    public InvalidSpectrumException(String message, Throwable cause) {
        super("Invalid spectrum: " + message, cause);
    }
}
