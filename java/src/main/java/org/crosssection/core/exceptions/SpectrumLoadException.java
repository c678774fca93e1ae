package org.crosssection.core.exceptions;

/**
 * A required raw curve is missing, empty or unreadable.
 */
public class SpectrumLoadException extends CrossSectionException {
    public SpectrumLoadException(String message) {
        super("Cannot load spectrum: " + message);
    }

    public SpectrumLoadException(String message, Throwable cause) {
        super("Cannot load spectrum: " + message, cause);
    }
}
