package dev.braceline.exec;

/**
 * Runtime exception used when the interpreter cannot be started or waited for.
 */
public class ScriptExecutionException extends RuntimeException {

    public ScriptExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
