/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

/**
 * A part of a compound time signature: a {@link TimesigFraction} or a joining token such as plus or equals
 */
public interface TimesigElement extends SyntaxNode {
}
