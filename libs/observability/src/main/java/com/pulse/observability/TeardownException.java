package com.pulse.observability;

import com.pulse.observability.spi.Subsystem;

/**
 * A single failed teardown step of {@link Pulse#shutdown()}.
 */
public class TeardownException extends Exception {

    private final Subsystem subsystem;

    public TeardownException(Subsystem subsystem, Throwable cause) {
        super("Failed to shut down %s: %s".formatted(subsystem.displayName(), cause.getMessage()), cause);
        this.subsystem = subsystem;
    }

    /**
     * Returns the subsystem whose teardown failed.
     */
    public Subsystem subsystem() {
        return subsystem;
    }
}
