/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.exceptions.InvariantViolationException;
import net.scoreworks.mtn.semantics.Vocabulary;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Markings that are not bound to a note, such as dynamics, wedges, segno and coda
 */
public class Direction extends TopLevel {
    private static final Comparator<Token> BY_TYPE = Comparator.comparing(Direction::sortKey);

    private final List<Token> directives;

    public Direction(Fraction delta, List<Token> directives) {
        super(delta);
        this.directives = new ArrayList<>(directives);
    }

    public List<Token> getDirectives() {
        return directives;
    }

    /**
     * Join the directives of another direction at the same time into this one
     */
    public Direction merge(Direction other) {
        if (!compareDelta(other))
            throw new InvariantViolationException(Direction.class, "can only merge directions at the same time but got "
                    + delta + " and " + other.delta);
        directives.addAll(other.directives);
        sort();
        return this;
    }

    public void sort() {
        directives.sort(BY_TYPE);
    }

    private static String sortKey(Token token) {
        Object type = token.getModifier("type");
        if (type == null)
            return "";
        return token.getTokenType().getValue() + "_" + Vocabulary.valueOf(type);
    }

    @Override
    protected int getPrecedence() {
        return 3;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDirection(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Direction))
            return false;
        Direction direction = (Direction) other;
        return compareDelta(direction) && NodeComparison.lists(directives, direction.directives);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Direction direction = NodeComparison.sameKind(Direction.class, other);
        compareDeltaRaise(direction);
        NodeComparison.listsRaise("Direction", "directives", directives, direction.directives);
    }

    @Override
    public String toString() {
        return "Direction (Delta " + delta + "): " + directives;
    }
}
