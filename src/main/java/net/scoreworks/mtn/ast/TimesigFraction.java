/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import org.apache.commons.lang3.math.Fraction;

/**
 * One fraction of a time signature. A missing denominator stands for a single-number signature
 */
public class TimesigFraction implements TimesigElement {
    private final Numerator numerator;
    private final Denominator denominator;

    public TimesigFraction(Numerator numerator, Denominator denominator) {
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public Numerator getNumerator() {
        return numerator;
    }

    public Denominator getDenominator() {
        return denominator;
    }

    public Fraction getValue() {
        if (denominator == null)
            return Fraction.getFraction(numerator.getValue(), 1);
        return Fraction.getReducedFraction(numerator.getValue(), denominator.getValue());
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitTimesigFraction(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof TimesigFraction))
            return false;
        TimesigFraction fraction = (TimesigFraction) other;
        return numerator.compare(fraction.numerator) && NodeComparison.maybe(denominator, fraction.denominator);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        TimesigFraction fraction = NodeComparison.sameKind(TimesigFraction.class, other);
        numerator.compareRaise(fraction.numerator);
        NodeComparison.maybeRaise("TimesigFraction", "denominator", denominator, fraction.denominator);
    }

    @Override
    public String toString() {
        return "(" + numerator + "/" + denominator + ")";
    }
}
