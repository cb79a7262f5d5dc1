package com.questrail.chamber.checkpoint;

import java.io.IOException;

/**
 * The stored checkpoint exists but cannot be decoded into a run.
 *
 * <p>Recovery treats this exactly like "no checkpoint" and removes the file.</p>
 */
public final class CheckpointCorruptException extends IOException
{
    public CheckpointCorruptException(String message) {
        super(message);
    }

    public CheckpointCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
