package com.forecastsentinel.core.error;

/**
 * Raised when model fitting or a statistical computation fails for a
 * structurally valid series (numerical degeneracy, no converging candidate,
 * non-finite output).
 *
 * <p>
 * Surfaced as a server-side failure. The core never retries.
 * </p>
 *
 * @since 1.0.0
 */
public class ComputationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ComputationException(String message) {
        super(message);
    }

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
