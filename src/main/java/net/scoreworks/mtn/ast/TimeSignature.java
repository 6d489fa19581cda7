/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.exceptions.InvariantViolationException;
import org.apache.commons.lang3.math.Fraction;

import java.util.List;

/**
 * A time signature written either as a single symbol (common or cut time) or as a sequence of fractions with the
 * tokens joining them. The resolved length of a measure is kept in quarter notes regardless of how it is written
 */
public class TimeSignature implements SyntaxNode {
    private final Token timeSymbol;
    private final List<TimesigElement> compoundTimeSignature;
    private final Fraction timeValue;

    public TimeSignature(Token timeSymbol, List<TimesigElement> compoundTimeSignature, Fraction timeValue) {
        if (timeSymbol != null && compoundTimeSignature != null)
            throw new InvariantViolationException(TimeSignature.class, "is either a symbol or a compound signature");
        this.timeSymbol = timeSymbol;
        this.compoundTimeSignature = compoundTimeSignature;
        this.timeValue = timeValue;
    }

    /**
     * A signature that is not drawn and lasts four quarters
     */
    public static TimeSignature defaultTimeSignature() {
        return new TimeSignature(null, null, Fraction.getFraction(4, 1));
    }

    public Token getTimeSymbol() {
        return timeSymbol;
    }

    public List<TimesigElement> getCompoundTimeSignature() {
        return compoundTimeSignature;
    }

    public Fraction getTimeValue() {
        return timeValue;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitTimeSignature(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof TimeSignature))
            return false;
        TimeSignature signature = (TimeSignature) other;
        if (!NodeComparison.sameTime(timeValue, signature.timeValue))
            return false;
        if (!NodeComparison.maybe(timeSymbol, signature.timeSymbol))
            return false;
        if (compoundTimeSignature == null || signature.compoundTimeSignature == null)
            return compoundTimeSignature == signature.compoundTimeSignature;
        return NodeComparison.lists(compoundTimeSignature, signature.compoundTimeSignature);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        TimeSignature signature = NodeComparison.sameKind(TimeSignature.class, other);
        NodeComparison.fieldRaise("TimeSignature", "time value", timeValue, signature.timeValue);
        NodeComparison.maybeRaise("TimeSignature", "symbol", timeSymbol, signature.timeSymbol);
        if (compoundTimeSignature == null || signature.compoundTimeSignature == null) {
            NodeComparison.fieldRaise("TimeSignature", "compound signature", compoundTimeSignature,
                    signature.compoundTimeSignature);
            return;
        }
        NodeComparison.listsRaise("TimeSignature", "compound signature", compoundTimeSignature,
                signature.compoundTimeSignature);
    }

    @Override
    public String toString() {
        return "Time: " + timeValue;
    }
}
