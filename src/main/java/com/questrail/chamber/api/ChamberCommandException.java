package com.questrail.chamber.api;

/**
 * Base type of every rejection a {@link ChamberController} command can produce.
 *
 * <p>A rejected command never changes controller state.</p>
 */
public abstract class ChamberCommandException extends RuntimeException
{
    protected ChamberCommandException(String message) {
        super(message);
    }
}
