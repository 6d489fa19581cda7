/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntSupplier;

/**
 * Deep copy of a subtree. Every token of the copy gets a fresh identifier, so the copy can be placed next to the
 * original without the two being mistaken for the same symbol
 */
public class VisitorDuplicate implements Visitor<SyntaxNode> {
    private final IntSupplier identifiers;

    /**
     * @param identifiers source of the token identifiers of the copy
     */
    public VisitorDuplicate(IntSupplier identifiers) {
        this.identifiers = identifiers;
    }

    @Override
    public Score visitScore(Score score) {
        return new Score(copyAll(score.getMeasures()), score.getScoreId());
    }

    @Override
    public Measure visitMeasure(Measure measure) {
        return new Measure(copyAll(measure.getElements()), copy(measure.getLeftBarline()),
                copy(measure.getRightBarline()), measure.getStaves(), measure.getMeasureId(), measure.getPartId(),
                measure.getDuration());
    }

    @Override
    public Token visitToken(Token token) {
        return new Token(token.getTokenType(), new LinkedHashMap<>(token.getModifiers()), token.getPosition(),
                identifiers.getAsInt());
    }

    @Override
    public Note visitNote(Note note) {
        return new Note(visitToken(note.getNotehead()), copyAll(note.getDots()), copyAll(note.getAccidentals()),
                copyAll(note.getModifiers()));
    }

    @Override
    public Chord visitChord(Chord chord) {
        return new Chord(chord.getDelta(), copy(chord.getStem()), copyAll(chord.getNotes()));
    }

    @Override
    public Rest visitRest(Rest rest) {
        return new Rest(rest.getDelta(), visitToken(rest.getRestToken()), copyAll(rest.getDots()),
                copyAll(rest.getModifiers()));
    }

    @Override
    public NoteGroup visitNoteGroup(NoteGroup noteGroup) {
        return new NoteGroup(noteGroup.getDelta(), copyAll(noteGroup.getChildren()),
                copyAll(noteGroup.getAppendages()));
    }

    @Override
    public Tuplet visitTuplet(Tuplet tuplet) {
        return new Tuplet(copy(tuplet.getNumber()), visitToken(tuplet.getTuplet()));
    }

    @Override
    public Attributes visitAttributes(Attributes attributes) {
        return new Attributes(attributes.getDelta(), attributes.getNstaves(), copyValues(attributes.getKeys()),
                copyValues(attributes.getClefs()), copyValues(attributes.getTimesigs()));
    }

    @Override
    public TimeSignature visitTimeSignature(TimeSignature timeSignature) {
        List<TimesigElement> compound = timeSignature.getCompoundTimeSignature();
        return new TimeSignature(copy(timeSignature.getTimeSymbol()), compound == null ? null : copyAll(compound),
                timeSignature.getTimeValue());
    }

    @Override
    public TimesigFraction visitTimesigFraction(TimesigFraction timesigFraction) {
        return new TimesigFraction(visitNumerator(timesigFraction.getNumerator()),
                copy(timesigFraction.getDenominator()));
    }

    @Override
    public Numerator visitNumerator(Numerator numerator) {
        return new Numerator(copyAll(numerator.getDigitsOrSum()));
    }

    @Override
    public Denominator visitDenominator(Denominator denominator) {
        return new Denominator(visitNumeral(denominator.getDigits()));
    }

    @Override
    public Numeral visitNumeral(Numeral numeral) {
        return new Numeral(copyAll(numeral.getDigits()));
    }

    @Override
    public Key visitKey(Key key) {
        return new Key(copyAll(key.getAccidentals()), copyAll(key.getNaturals()), key.getAlterations(),
                key.getFifths());
    }

    @Override
    public Clef visitClef(Clef clef) {
        return new Clef(copy(clef.getClefToken()), clef.getSign(), clef.getOctave(), clef.getPosition());
    }

    @Override
    public Direction visitDirection(Direction direction) {
        return new Direction(direction.getDelta(), copyAll(direction.getDirectives()));
    }

    @Override
    public Barline visitBarline(Barline barline) {
        return new Barline(barline.getDelta(), copyAll(barline.getBarlines()), copyAll(barline.getModifiers()));
    }

    //=====PRIVATE METHODS==============================================================================================

    @SuppressWarnings("unchecked")
    private <N extends SyntaxNode> N copy(N node) {
        return node == null ? null : (N) node.accept(this);
    }

    private <N extends SyntaxNode> List<N> copyAll(List<N> nodes) {
        List<N> output = new ArrayList<>(nodes.size());
        for (N node : nodes)
            output.add(copy(node));
        return output;
    }

    private <N extends SyntaxNode> Map<Integer, N> copyValues(Map<Integer, N> nodes) {
        Map<Integer, N> output = new TreeMap<>();
        for (Map.Entry<Integer, N> entry : nodes.entrySet())
            output.put(entry.getKey(), copy(entry.getValue()));
        return output;
    }
}
