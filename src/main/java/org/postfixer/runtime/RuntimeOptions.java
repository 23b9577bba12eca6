package org.postfixer.runtime;

import com.typesafe.config.Config;

/**
 * Settings of the execution backend.
 *
 * @param backendType Which backend to create.
 * @param maxStackDepth The largest number of values a program may hold on the stack at once.
 */
public record RuntimeOptions(BackendType backendType, int maxStackDepth) {

    /** Stack slots available to a program unless configured otherwise. */
    public static final int DEFAULT_MAX_STACK_DEPTH = 32;

    private static final String BACKEND_PATH = "postfixer.backend";

    public RuntimeOptions {
        if (backendType == null) {
            throw new IllegalArgumentException("backendType must not be null");
        }
        if (maxStackDepth < 1) {
            throw new IllegalArgumentException("maxStackDepth must be positive, was " + maxStackDepth);
        }
    }

    public static RuntimeOptions defaults() {
        return new RuntimeOptions(BackendType.INTERPRETER, DEFAULT_MAX_STACK_DEPTH);
    }

    /**
     * Reads the {@code postfixer.backend} block. Missing keys fall back to the defaults.
     * @param config The application configuration.
     * @return The options.
     */
    public static RuntimeOptions fromConfig(Config config) {
        RuntimeOptions defaults = defaults();
        if (!config.hasPath(BACKEND_PATH)) {
            return defaults;
        }
        Config backend = config.getConfig(BACKEND_PATH);
        BackendType type = backend.hasPath("type")
                ? backend.getEnum(BackendType.class, "type")
                : defaults.backendType();
        int depth = backend.hasPath("max-stack-depth")
                ? backend.getInt("max-stack-depth")
                : defaults.maxStackDepth();
        return new RuntimeOptions(type, depth);
    }
}
