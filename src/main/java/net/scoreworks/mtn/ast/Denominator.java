/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

public class Denominator implements SyntaxNode {
    private final Numeral digits;

    public Denominator(Numeral digits) {
        this.digits = digits;
    }

    public Numeral getDigits() {
        return digits;
    }

    public int getValue() {
        return digits.getValue();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDenominator(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        return other instanceof Denominator && digits.compare(((Denominator) other).digits);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Denominator denominator = NodeComparison.sameKind(Denominator.class, other);
        digits.compareRaise(denominator.digits);
    }

    @Override
    public String toString() {
        return digits.toString();
    }
}
