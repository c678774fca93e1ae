package org.crosssection.core.exceptions;

public class DomainMismatchException extends CrossSectionException {
    public DomainMismatchException(String message) {
        super("Wavelength domains do not overlap: " + message);
    }

    public DomainMismatchException(String message, Throwable cause) {
        super("Wavelength domains do not overlap: " + message, cause);
    }
}
