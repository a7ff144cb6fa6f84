package edu.sunyk.containers.preprocessing;

import java.io.IOException;

/**
 * A row of an operation script that cannot be turned into an {@link Operation}.
 */
public class ScriptFormatException extends IOException {
    private static final long serialVersionUID = 1L;

    private final long line;

    public ScriptFormatException(long line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    public ScriptFormatException(long line, String message, Throwable cause) {
        super("line " + line + ": " + message, cause);
        this.line = line;
    }

    public long getLine() {
        return line;
    }
}
