package com.questrail.chamber.api;

/**
 * Raised when a command carries a malformed or out-of-range value.
 */
public final class ValidationException extends ChamberCommandException
{
    public ValidationException(String message) {
        super(message);
    }
}
