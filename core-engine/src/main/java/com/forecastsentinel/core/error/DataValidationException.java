package com.forecastsentinel.core.error;

/**
 * Raised when an input series or request parameter violates a structural
 * invariant: too few points, non-finite or missing values, unparseable or
 * duplicate dates, out-of-range horizon and similar.
 *
 * <p>
 * Always caller-fixable. A transport layer should surface it as a client-side
 * failure.
 * </p>
 *
 * @since 1.0.0
 */
public class DataValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public DataValidationException(String message) {
        super(message);
    }

    public DataValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
