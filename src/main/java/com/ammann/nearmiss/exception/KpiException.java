package com.ammann.nearmiss.exception;

/**
 * Base unchecked exception for all application-level errors raised by the near-miss engine.
 *
 * <p>Callers distinguish {@link ValidationException} (rejected before any work began)
 * from {@link ComputationException} (an unexpected fault during computation).
 */
public class KpiException extends RuntimeException
{
    public KpiException(String message, Throwable cause) {
        super(message, cause);
    }
    public KpiException(String message) {
        super(message);
    }

    public KpiException(Throwable cause) {
        super(cause);
    }
}
