/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

/**
 * Something that can be attached to a note: a plain token or a {@link Tuplet}
 */
public interface NoteModifier extends SyntaxNode {
}
