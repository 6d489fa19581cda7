/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.exceptions;

/**
 * Thrown by a raising comparison of two syntax trees. The message names the node kind and the first field that differs
 */
public class NodeMismatchException extends RuntimeException {
    public NodeMismatchException(String nodeKind, String field, Object expected, Object actual) {
        super(nodeKind + " differs in " + field + ": [" + expected + "] != [" + actual + "]");
    }
}
