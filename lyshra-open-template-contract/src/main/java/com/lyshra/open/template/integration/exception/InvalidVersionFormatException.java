package com.lyshra.open.template.integration.exception;

import lombok.Getter;

/**
 * Thrown when a version string or a range expression cannot be parsed.
 */
@Getter
public class InvalidVersionFormatException extends IllegalArgumentException {

    private final String input;

    public InvalidVersionFormatException(String input) {
        super("Invalid version string: " + input + ". Expected format: X.Y.Z[-prerelease][+build]");
        this.input = input;
    }
}
