/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.exceptions;

/**
 * An exception that gets thrown if the input uses notation that is recognized but not modelled
 */
public class UnsupportedElementException extends RuntimeException {
    public UnsupportedElementException(String element, String value) {
        super("unsupported " + element + (value == null ? "" : " [" + value + "]"));
    }
}
