/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.exceptions;

/**
 * An exception that gets thrown if a structural rule of the syntax tree or of the translation state is broken.
 * This points to a bug in the caller or to input that should have been rejected earlier
 */
public class InvariantViolationException extends RuntimeException {
    public InvariantViolationException(Class<?> clazz, String message) {
        super(clazz.getSimpleName() + " " + message);
    }
}
