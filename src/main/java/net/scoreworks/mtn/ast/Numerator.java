/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import java.util.List;

/**
 * Upper part of a time signature fraction. Additive numerators like 3+2 hold several numerals joined by plus tokens
 */
public class Numerator implements SyntaxNode {
    private final List<NumeratorElement> digitsOrSum;

    public Numerator(List<NumeratorElement> digitsOrSum) {
        this.digitsOrSum = digitsOrSum;
    }

    public List<NumeratorElement> getDigitsOrSum() {
        return digitsOrSum;
    }

    /**
     * @return the sum of all numerals
     */
    public int getValue() {
        int value = 0;
        for (NumeratorElement element : digitsOrSum) {
            if (element instanceof Numeral)
                value += ((Numeral) element).getValue();
        }
        return value;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitNumerator(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        return other instanceof Numerator && NodeComparison.lists(digitsOrSum, ((Numerator) other).digitsOrSum);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Numerator numerator = NodeComparison.sameKind(Numerator.class, other);
        NodeComparison.listsRaise("Numerator", "digits", digitsOrSum, numerator.digitsOrSum);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (NumeratorElement element : digitsOrSum)
            builder.append(element);
        return builder.toString();
    }
}
