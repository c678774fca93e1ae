package org.crosssection.core.exceptions;

/**
 * Base class for every failure raised by the cross-section pipeline.
 */
public class CrossSectionException extends RuntimeException {
    public CrossSectionException(String message) {
        super(message);
    }

    public CrossSectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
