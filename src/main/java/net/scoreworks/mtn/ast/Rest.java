/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.NoteType;
import net.scoreworks.mtn.semantics.StaffPosition;
import org.apache.commons.lang3.math.Fraction;

import java.util.List;

public class Rest extends TopLevel {
    private final Token restToken;
    private final List<Token> dots;
    private final List<NoteModifier> modifiers;

    public Rest(Fraction delta, Token restToken, List<Token> dots, List<NoteModifier> modifiers) {
        super(delta);
        this.restToken = restToken;
        this.dots = dots;
        this.modifiers = modifiers;
    }

    public Token getRestToken() {
        return restToken;
    }

    public List<Token> getDots() {
        return dots;
    }

    public List<NoteModifier> getModifiers() {
        return modifiers;
    }

    public NoteType getRestType() {
        return (NoteType) restToken.getModifier("type");
    }

    @Override
    protected int getPrecedence() {
        return 4;
    }

    @Override
    public StaffPosition getPosition() {
        return restToken.getPosition();
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitRest(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Rest))
            return false;
        Rest rest = (Rest) other;
        return compareDelta(rest)
                && restToken.compare(rest.restToken)
                && NodeComparison.lists(dots, rest.dots)
                && NodeComparison.lists(modifiers, rest.modifiers);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Rest rest = NodeComparison.sameKind(Rest.class, other);
        compareDeltaRaise(rest);
        restToken.compareRaise(rest.restToken);
        NodeComparison.listsRaise("Rest", "dots", dots, rest.dots);
        NodeComparison.listsRaise("Rest", "modifiers", modifiers, rest.modifiers);
    }

    @Override
    public String toString() {
        return "Rest (Delta " + delta + "): " + restToken;
    }
}
