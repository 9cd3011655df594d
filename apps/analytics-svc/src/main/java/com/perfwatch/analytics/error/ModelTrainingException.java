package com.perfwatch.analytics.error;

/**
 * The forecasting model failed to converge. Callers recover by falling back to linear
 * extrapolation.
 */
public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message) {
        super(message);
    }

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
