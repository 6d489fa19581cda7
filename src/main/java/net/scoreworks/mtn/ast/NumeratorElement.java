/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

/**
 * A part of a {@link Numerator}: a {@link Numeral} or a plus token
 */
public interface NumeratorElement extends SyntaxNode {
}
