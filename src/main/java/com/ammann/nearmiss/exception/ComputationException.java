package com.ammann.nearmiss.exception;

/**
 * Unexpected failure while fetching, indexing, matching or aggregating.
 *
 * <p>The engine is side-effect free, so a computation either completes or fails
 * as a whole; no partial result is ever returned alongside this exception.
 */
public class ComputationException extends KpiException
{
    public ComputationException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public ComputationException(Throwable cause)
    {
        super("Close-call computation failed", cause);
    }
}
