package org.crosssection.core.exceptions;

/**
 * Zero or non-finite denominator, integral or ratio.
 */
public class NumericalException extends CrossSectionException {
    public NumericalException(String message) {
        super("Numerical error: " + message);
    }

    public NumericalException(String message, Throwable cause) {
        super("Numerical error: " + message, cause);
    }
}
