package com.perfwatch.analytics.error;

/**
 * An internal computation produced a non-finite value.
 */
public class NumericFaultException extends ArithmeticException {

    public NumericFaultException(String message) {
        super(message);
    }

    public static double requireFinite(double value, String what) {
        if (!Double.isFinite(value)) {
            throw new NumericFaultException(what + " is not finite: " + value);
        }
        return value;
    }

    public static double[] requireFinite(double[] values, String what) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new NumericFaultException(what + " at index " + i + " is not finite: " + values[i]);
            }
        }
        return values;
    }
}
