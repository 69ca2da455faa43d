package com.pulse.observability;

/**
 * Unit of work run by {@link PulseSession} with a live {@link Pulse} handle.
 *
 * @param <T> result type
 * @param <E> checked exception the work may throw
 */
@FunctionalInterface
public interface PulseScope<T, E extends Exception> {

    T run(Pulse pulse) throws E;
}
