package org.postfixer.compiler.api;

/**
 * An exception that is thrown when an expression cannot be tokenized, parsed or compiled.
 * <p>
 * It is part of the public API and carries a {@link CompilerErrorCode} so callers can react
 * to the kind of failure without inspecting the message.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final transient SourceInfo sourceInfo;

    /**
     * Constructs a new compilation exception with the specified error code and detail message.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     */
    public CompilationException(CompilerErrorCode errorCode, String message) {
        this(errorCode, message, (SourceInfo) null);
    }

    /**
     * Constructs a new compilation exception pointing at a position in the input.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param sourceInfo Where the failure was detected. Can be null.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, SourceInfo sourceInfo) {
        super(sourceInfo == null ? message : String.format("%s at %s", message, sourceInfo));
        this.errorCode = errorCode;
        this.sourceInfo = sourceInfo;
    }

    /**
     * Constructs a new compilation exception with the specified error code, detail message and cause.
     * @param errorCode The kind of failure.
     * @param message The detail message.
     * @param cause The cause.
     */
    public CompilationException(CompilerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.sourceInfo = null;
    }

    public CompilerErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return The position of the failure, or null if the failure is not tied to a position.
     */
    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }
}
