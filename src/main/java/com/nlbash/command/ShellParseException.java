package com.nlbash.command;

/**
 * Thrown when command text cannot be parsed.
 */
public class ShellParseException extends IllegalArgumentException {
    private final String command;

    public ShellParseException(String message, String command) {
        super(message + ": " + command);
        this.command = command;
    }

    public String getCommand() {
        return command;
    }
}
