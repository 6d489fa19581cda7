/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.exceptions.NodeMismatchException;
import org.apache.commons.lang3.math.Fraction;

import java.util.List;
import java.util.Objects;

/**
 * Shared building blocks of {@link SyntaxNode#compare(SyntaxNode)} and {@link SyntaxNode#compareRaise(SyntaxNode)}
 */
final class NodeComparison {

    private NodeComparison() {}

    static boolean lists(List<? extends SyntaxNode> base, List<? extends SyntaxNode> other) {
        if (base.size() != other.size())
            return false;
        for (int i = 0; i < base.size(); i++) {
            if (!base.get(i).compare(other.get(i)))
                return false;
        }
        return true;
    }

    static void listsRaise(String kind, String field, List<? extends SyntaxNode> base, List<? extends SyntaxNode> other) {
        if (base.size() != other.size())
            throw new NodeMismatchException(kind, field + " length", base.size(), other.size());
        for (int i = 0; i < base.size(); i++)
            base.get(i).compareRaise(other.get(i));
    }

    /**
     * Compare two optional nodes. Two missing nodes are equal
     */
    static boolean maybe(SyntaxNode base, SyntaxNode other) {
        if (base == null || other == null)
            return base == other;
        return base.compare(other);
    }

    static void maybeRaise(String kind, String field, SyntaxNode base, SyntaxNode other) {
        if (base == null || other == null) {
            if (base != other)
                throw new NodeMismatchException(kind, field, base, other);
            return;
        }
        base.compareRaise(other);
    }

    static boolean sameTime(Fraction base, Fraction other) {
        if (base == null || other == null)
            return base == other;
        return base.compareTo(other) == 0;
    }

    static void fieldRaise(String kind, String field, Object expected, Object actual) {
        boolean equal = expected instanceof Fraction && actual instanceof Fraction
                ? sameTime((Fraction) expected, (Fraction) actual)
                : Objects.equals(expected, actual);
        if (!equal)
            throw new NodeMismatchException(kind, field, expected, actual);
    }

    /**
     * Check that the other node is of the expected kind and return it as such
     */
    static <N extends SyntaxNode> N sameKind(Class<N> clazz, SyntaxNode other) {
        if (!clazz.isInstance(other))
            throw new NodeMismatchException(clazz.getSimpleName(), "kind", clazz.getSimpleName(),
                    other == null ? null : other.getClass().getSimpleName());
        return clazz.cast(other);
    }
}
