package com.pulse.observability;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Opt-in process-wide slot for a {@link Pulse} handle.
 * <p>
 * Nothing is installed automatically; code that owns the handle decides whether to publish it.
 * The slot never shuts the handle down: uninstall it, then shut it down.
 */
public final class GlobalPulse {

    private static final AtomicReference<Pulse> INSTANCE = new AtomicReference<>();

    private GlobalPulse() {
        // utility class
    }

    /**
     * Publishes the handle.
     *
     * @throws IllegalStateException if another handle is already installed
     */
    public static void install(Pulse pulse) {
        if (pulse == null) {
            throw new IllegalArgumentException("pulse must not be null");
        }
        if (!INSTANCE.compareAndSet(null, pulse)) {
            throw new IllegalStateException("A Pulse handle is already installed");
        }
    }

    public static Optional<Pulse> get() {
        return Optional.ofNullable(INSTANCE.get());
    }

    /**
     * Returns the installed handle.
     *
     * @throws IllegalStateException if none is installed
     */
    public static Pulse require() {
        Pulse pulse = INSTANCE.get();
        if (pulse == null) {
            throw new IllegalStateException("No Pulse handle installed; call GlobalPulse.install first");
        }
        return pulse;
    }

    /**
     * Clears the slot and returns what was installed.
     */
    public static Optional<Pulse> uninstall() {
        return Optional.ofNullable(INSTANCE.getAndSet(null));
    }
}
