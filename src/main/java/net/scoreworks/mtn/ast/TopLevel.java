/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.StaffPosition;
import org.apache.commons.lang3.math.Fraction;
import org.jetbrains.annotations.NotNull;

/**
 * A node that sits directly in a {@link Measure}. Elements of a measure are ordered by time, then by kind and
 * finally by their position on the staff
 */
public abstract class TopLevel implements SyntaxNode, Comparable<TopLevel> {
    /** time since the start of the measure, in quarter notes */
    protected Fraction delta;

    protected TopLevel(Fraction delta) {
        this.delta = delta;
    }

    public Fraction getDelta() {
        return delta;
    }

    public void setDelta(Fraction delta) {
        this.delta = delta;
    }

    /**
     * Rank among elements at the same time: barlines first, note groups last
     */
    protected abstract int getPrecedence();

    public StaffPosition getPosition() {
        return StaffPosition.UNSET;
    }

    @Override
    public int compareTo(@NotNull TopLevel other) {
        int byTime = delta.compareTo(other.delta);
        if (byTime != 0)
            return byTime;
        int byKind = Integer.compare(getPrecedence(), other.getPrecedence());
        if (byKind != 0)
            return byKind;
        int byPosition = getPosition().compareTo(other.getPosition());
        if (byPosition != 0)
            return byPosition;
        return tieBreak(other);
    }

    /**
     * Order between elements of the same kind that share time and position
     */
    protected int tieBreak(TopLevel other) {
        return 0;
    }

    protected boolean compareDelta(TopLevel other) {
        return NodeComparison.sameTime(delta, other.delta);
    }

    protected void compareDeltaRaise(TopLevel other) {
        NodeComparison.fieldRaise(getClass().getSimpleName(), "delta", delta, other.delta);
    }
}
