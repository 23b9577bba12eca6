package org.postfixer.runtime;

/**
 * A stack-machine execution backend. The compiler core only depends on this interface,
 * so tests and callers can substitute any implementation.
 */
public interface IExecutionBackend {

    /**
     * @return A short name for log messages.
     */
    String getName();

    /**
     * Acquires a compilation context.
     * @return A new, open session.
     */
    IBackendSession openSession();
}
