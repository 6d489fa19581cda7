/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.*;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Collects every token of a subtree in traversal order
 */
public class VisitorGetTokens implements Visitor<List<Token>> {

    @Override
    public List<Token> visitScore(Score score) {
        return visitAll(score.getMeasures());
    }

    @Override
    public List<Token> visitMeasure(Measure measure) {
        List<Token> output = new ArrayList<>();
        if (measure.getLeftBarline() != null)
            output.addAll(visitBarline(measure.getLeftBarline()));
        output.addAll(visitAll(measure.getElements()));
        if (measure.getRightBarline() != null)
            output.addAll(visitBarline(measure.getRightBarline()));
        return output;
    }

    @Override
    public List<Token> visitToken(Token token) {
        List<Token> output = new ArrayList<>();
        output.add(token);
        return output;
    }

    @Override
    public List<Token> visitNote(Note note) {
        List<Token> output = visitToken(note.getNotehead());
        output.addAll(note.getDots());
        output.addAll(note.getAccidentals());
        output.addAll(visitAll(note.getModifiers()));
        return output;
    }

    @Override
    public List<Token> visitChord(Chord chord) {
        List<Token> output = new ArrayList<>();
        if (chord.getStem() != null)
            output.add(chord.getStem());
        output.addAll(visitAll(chord.getNotes()));
        return output;
    }

    @Override
    public List<Token> visitRest(Rest rest) {
        List<Token> output = visitToken(rest.getRestToken());
        output.addAll(rest.getDots());
        output.addAll(visitAll(rest.getModifiers()));
        return output;
    }

    @Override
    public List<Token> visitNoteGroup(NoteGroup noteGroup) {
        List<Token> output = visitAll(noteGroup.getChildren());
        output.addAll(noteGroup.getAppendages());
        return output;
    }

    @Override
    public List<Token> visitTuplet(Tuplet tuplet) {
        List<Token> output = tuplet.getNumber() == null ? new ArrayList<>() : visitNumeral(tuplet.getNumber());
        output.add(tuplet.getTuplet());
        return output;
    }

    @Override
    public List<Token> visitAttributes(Attributes attributes) {
        List<Token> output = visitAll(attributes.getKeys().values());
        output.addAll(visitAll(attributes.getClefs().values()));
        output.addAll(visitAll(attributes.getTimesigs().values()));
        return output;
    }

    @Override
    public List<Token> visitTimeSignature(TimeSignature timeSignature) {
        if (timeSignature.getTimeSymbol() != null)
            return visitToken(timeSignature.getTimeSymbol());
        if (timeSignature.getCompoundTimeSignature() != null)
            return visitAll(timeSignature.getCompoundTimeSignature());
        return new ArrayList<>();
    }

    @Override
    public List<Token> visitTimesigFraction(TimesigFraction timesigFraction) {
        List<Token> output = visitNumerator(timesigFraction.getNumerator());
        if (timesigFraction.getDenominator() != null)
            output.addAll(visitDenominator(timesigFraction.getDenominator()));
        return output;
    }

    @Override
    public List<Token> visitNumerator(Numerator numerator) {
        return visitAll(numerator.getDigitsOrSum());
    }

    @Override
    public List<Token> visitDenominator(Denominator denominator) {
        return visitNumeral(denominator.getDigits());
    }

    @Override
    public List<Token> visitNumeral(Numeral numeral) {
        return new ArrayList<>(numeral.getDigits());
    }

    @Override
    public List<Token> visitKey(Key key) {
        List<Token> output = new ArrayList<>(key.getNaturals());
        output.addAll(key.getAccidentals());
        return output;
    }

    @Override
    public List<Token> visitClef(Clef clef) {
        return clef.getClefToken() == null ? new ArrayList<>() : visitToken(clef.getClefToken());
    }

    @Override
    public List<Token> visitDirection(Direction direction) {
        return new ArrayList<>(direction.getDirectives());
    }

    @Override
    public List<Token> visitBarline(Barline barline) {
        List<Token> output = new ArrayList<>(barline.getBarlines());
        output.addAll(barline.getModifiers());
        return output;
    }

    //=====PRIVATE METHODS==============================================================================================

    /**
     * Tokens of every node in order, missing attribute values are skipped
     */
    private List<Token> visitAll(Collection<? extends SyntaxNode> nodes) {
        List<Token> output = new ArrayList<>();
        for (SyntaxNode node : nodes) {
            if (node != null)
                output.addAll(node.accept(this));
        }
        return output;
    }
}
