package org.postfixer.runtime;

/**
 * The available execution backends.
 */
public enum BackendType {
    /** Walks the instruction list on every evaluation. */
    INTERPRETER,
    /** Compiles the instruction list once into method handles. */
    METHOD_HANDLE
}
