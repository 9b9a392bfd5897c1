package com.pkgmeta.core.requirement;

/**
 * Thrown when a requirement or marker expression cannot be parsed.
 *
 * <p>Callers iterating a manifest catch this per entry and skip the entry.
 */
public class RequirementSyntaxException extends IllegalArgumentException {

    private final String input;
    private final int position;

    public RequirementSyntaxException(String message, String input, int position) {
        super(message + " at position " + position + " in: " + input);
        this.input = input;
        this.position = position;
    }

    public String getInput() {
        return input;
    }

    public int getPosition() {
        return position;
    }
}
