package org.postfixer.runtime;

import org.postfixer.runtime.interpreter.InterpretingBackend;
import org.postfixer.runtime.jit.MethodHandleBackend;

/**
 * Creates the backend selected by {@link RuntimeOptions}.
 */
public final class BackendFactory {

    private BackendFactory() {}

    public static IExecutionBackend create(RuntimeOptions options) {
        return switch (options.backendType()) {
            case INTERPRETER -> new InterpretingBackend(options.maxStackDepth());
            case METHOD_HANDLE -> new MethodHandleBackend(options.maxStackDepth());
        };
    }
}
