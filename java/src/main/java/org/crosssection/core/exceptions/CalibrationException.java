package org.crosssection.core.exceptions;

public class CalibrationException extends CrossSectionException {
    public CalibrationException(String message) {
        super("Baseline calibration failed: " + message);
    }

    public CalibrationException(String message, Throwable cause) {
        super("Baseline calibration failed: " + message, cause);
    }
}
