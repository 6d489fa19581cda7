/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

/**
 * A node of the music tree. Every node kind dispatches to its own method of a {@link Visitor} and can be compared
 * structurally against a node built elsewhere. Token identifiers are never part of such a comparison
 */
public interface SyntaxNode {

    <T> T accept(Visitor<T> visitor);

    /**
     * @return true if the other node has the same kind and the same contents
     */
    boolean compare(SyntaxNode other);

    /**
     * Same as {@link #compare(SyntaxNode)} but throws a {@link net.scoreworks.mtn.exceptions.NodeMismatchException}
     * that names the first field that differs
     */
    void compareRaise(SyntaxNode other);
}
