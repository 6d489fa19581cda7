/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.*;

import java.util.Collection;

/**
 * Counts the nodes of a subtree, tokens included. Missing optional children do not count
 */
public class VisitorCountNodes implements Visitor<Integer> {

    @Override
    public Integer visitScore(Score score) {
        return 1 + countAll(score.getMeasures());
    }

    @Override
    public Integer visitMeasure(Measure measure) {
        return 1 + count(measure.getLeftBarline()) + countAll(measure.getElements()) + count(measure.getRightBarline());
    }

    @Override
    public Integer visitToken(Token token) {
        return 1;
    }

    @Override
    public Integer visitNote(Note note) {
        return 1 + count(note.getNotehead()) + countAll(note.getDots()) + countAll(note.getAccidentals())
                + countAll(note.getModifiers());
    }

    @Override
    public Integer visitChord(Chord chord) {
        return 1 + count(chord.getStem()) + countAll(chord.getNotes());
    }

    @Override
    public Integer visitRest(Rest rest) {
        return 1 + count(rest.getRestToken()) + countAll(rest.getDots()) + countAll(rest.getModifiers());
    }

    @Override
    public Integer visitNoteGroup(NoteGroup noteGroup) {
        return 1 + countAll(noteGroup.getChildren()) + countAll(noteGroup.getAppendages());
    }

    @Override
    public Integer visitTuplet(Tuplet tuplet) {
        return 1 + count(tuplet.getNumber()) + count(tuplet.getTuplet());
    }

    @Override
    public Integer visitAttributes(Attributes attributes) {
        return 1 + countAll(attributes.getKeys().values()) + countAll(attributes.getClefs().values())
                + countAll(attributes.getTimesigs().values());
    }

    @Override
    public Integer visitTimeSignature(TimeSignature timeSignature) {
        int compound = timeSignature.getCompoundTimeSignature() == null ? 0
                : countAll(timeSignature.getCompoundTimeSignature());
        return 1 + count(timeSignature.getTimeSymbol()) + compound;
    }

    @Override
    public Integer visitTimesigFraction(TimesigFraction timesigFraction) {
        return 1 + count(timesigFraction.getNumerator()) + count(timesigFraction.getDenominator());
    }

    @Override
    public Integer visitNumerator(Numerator numerator) {
        return 1 + countAll(numerator.getDigitsOrSum());
    }

    @Override
    public Integer visitDenominator(Denominator denominator) {
        return 1 + count(denominator.getDigits());
    }

    @Override
    public Integer visitNumeral(Numeral numeral) {
        return 1 + countAll(numeral.getDigits());
    }

    @Override
    public Integer visitKey(Key key) {
        return 1 + countAll(key.getNaturals()) + countAll(key.getAccidentals());
    }

    @Override
    public Integer visitClef(Clef clef) {
        return 1 + count(clef.getClefToken());
    }

    @Override
    public Integer visitDirection(Direction direction) {
        return 1 + countAll(direction.getDirectives());
    }

    @Override
    public Integer visitBarline(Barline barline) {
        return 1 + countAll(barline.getBarlines()) + countAll(barline.getModifiers());
    }

    //=====PRIVATE METHODS==============================================================================================

    private int count(SyntaxNode node) {
        return node == null ? 0 : node.accept(this);
    }

    private int countAll(Collection<? extends SyntaxNode> nodes) {
        int output = 0;
        for (SyntaxNode node : nodes)
            output += count(node);
        return output;
    }
}
