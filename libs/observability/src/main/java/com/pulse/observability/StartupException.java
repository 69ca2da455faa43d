package com.pulse.observability;

import com.pulse.observability.spi.Subsystem;

/**
 * Thrown by {@link Pulse#create} when a subsystem cannot be constructed.
 * <p>
 * No handle exists after this exception; collaborators built earlier in the same call have
 * already been torn down.
 */
public class StartupException extends Exception {

    private final Subsystem subsystem;

    public StartupException(Subsystem subsystem, Throwable cause) {
        super("Failed to start %s: %s".formatted(subsystem.displayName(), cause.getMessage()), cause);
        this.subsystem = subsystem;
    }

    /**
     * Returns the subsystem whose constructor failed.
     */
    public Subsystem subsystem() {
        return subsystem;
    }
}
