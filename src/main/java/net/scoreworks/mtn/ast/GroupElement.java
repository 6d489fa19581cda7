/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

/**
 * A child of a {@link NoteGroup}: either a {@link Chord} or a nested {@link NoteGroup}
 */
public interface GroupElement extends SyntaxNode {
}
