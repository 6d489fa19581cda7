/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.*;
import net.scoreworks.mtn.semantics.Vocabulary;
import net.scoreworks.mtn.translation.MeasureId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes a subtree in the bracket notation read by tree edit distance tools, where every node is
 * {@code {label{child}{child}}}. Token labels are the token type followed by the modifier values in the order of
 * their names; a boolean modifier is written by its name.
 * <p>
 * A score becomes one line per measure, prefixed by the identifier of the measure
 */
public class VisitorToApted implements Visitor<String> {

    @Override
    public String visitScore(Score score) {
        List<String> lines = new ArrayList<>();
        for (Measure measure : score.getMeasures())
            lines.add(new MeasureId(measure.getPartId(), measure.getMeasureId()) + ": " + visitMeasure(measure));
        return String.join("\n", lines);
    }

    @Override
    public String visitMeasure(Measure measure) {
        StringBuilder output = new StringBuilder("measure");
        if (measure.getLeftBarline() != null)
            output.append(visitBarline(measure.getLeftBarline()));
        output.append(visitAll(measure.getElements()));
        if (measure.getRightBarline() != null)
            output.append(visitBarline(measure.getRightBarline()));
        return bracket(output);
    }

    @Override
    public String visitToken(Token token) {
        StringBuilder output = new StringBuilder(token.getTokenType().getValue());
        for (Map.Entry<String, Object> entry : new TreeMap<>(token.getModifiers()).entrySet()) {
            output.append('_');
            if (entry.getValue() instanceof Boolean)
                output.append(entry.getKey());
            else
                output.append(Vocabulary.valueOf(entry.getValue()));
        }
        return bracket(output);
    }

    @Override
    public String visitNote(Note note) {
        StringBuilder output = new StringBuilder("note").append(visitToken(note.getNotehead()));
        output.append(visitAll(note.getDots()))
                .append(visitAll(note.getAccidentals()))
                .append(visitAll(note.getModifiers()));
        return bracket(output);
    }

    @Override
    public String visitChord(Chord chord) {
        StringBuilder output = new StringBuilder("chord");
        if (chord.getStem() != null)
            output.append(visitToken(chord.getStem()));
        output.append(visitAll(chord.getNotes()));
        return bracket(output);
    }

    @Override
    public String visitRest(Rest rest) {
        StringBuilder output = new StringBuilder("rest").append(visitToken(rest.getRestToken()));
        output.append(visitAll(rest.getDots())).append(visitAll(rest.getModifiers()));
        return bracket(output);
    }

    @Override
    public String visitNoteGroup(NoteGroup noteGroup) {
        StringBuilder output = new StringBuilder("group");
        output.append(visitAll(noteGroup.getAppendages())).append(visitAll(noteGroup.getChildren()));
        return bracket(output);
    }

    @Override
    public String visitTuplet(Tuplet tuplet) {
        StringBuilder output = new StringBuilder("tuplet").append(visitToken(tuplet.getTuplet()));
        if (tuplet.getNumber() != null)
            output.append(visitNumeral(tuplet.getNumber()));
        return bracket(output);
    }

    @Override
    public String visitAttributes(Attributes attributes) {
        StringBuilder output = new StringBuilder("attributes");
        output.append(visitAll(attributes.getKeys().values()))
                .append(visitAll(attributes.getClefs().values()))
                .append(visitAll(attributes.getTimesigs().values()));
        return bracket(output);
    }

    @Override
    public String visitTimeSignature(TimeSignature timeSignature) {
        StringBuilder output = new StringBuilder("time_signature");
        if (timeSignature.getTimeSymbol() != null)
            output.append(visitToken(timeSignature.getTimeSymbol()));
        if (timeSignature.getCompoundTimeSignature() != null)
            output.append(visitAll(timeSignature.getCompoundTimeSignature()));
        return bracket(output);
    }

    @Override
    public String visitTimesigFraction(TimesigFraction timesigFraction) {
        StringBuilder output = new StringBuilder("fraction").append(visitNumerator(timesigFraction.getNumerator()));
        if (timesigFraction.getDenominator() != null)
            output.append(visitDenominator(timesigFraction.getDenominator()));
        return bracket(output);
    }

    @Override
    public String visitNumerator(Numerator numerator) {
        return bracket(new StringBuilder("numerator").append(visitAll(numerator.getDigitsOrSum())));
    }

    @Override
    public String visitDenominator(Denominator denominator) {
        return bracket(new StringBuilder("denominator").append(visitNumeral(denominator.getDigits())));
    }

    @Override
    public String visitNumeral(Numeral numeral) {
        return bracket(new StringBuilder("number").append(visitAll(numeral.getDigits())));
    }

    @Override
    public String visitKey(Key key) {
        StringBuilder output = new StringBuilder("key");
        output.append(visitAll(key.getAccidentals())).append(visitAll(key.getNaturals()));
        return bracket(output);
    }

    /**
     * @return the clef or an empty string if the clef is not drawn
     */
    @Override
    public String visitClef(Clef clef) {
        if (clef.getClefToken() == null)
            return "";
        return bracket(new StringBuilder("clef").append(visitToken(clef.getClefToken())));
    }

    @Override
    public String visitDirection(Direction direction) {
        return bracket(new StringBuilder("direction").append(visitAll(direction.getDirectives())));
    }

    @Override
    public String visitBarline(Barline barline) {
        StringBuilder output = new StringBuilder("barline");
        output.append(visitAll(barline.getBarlines())).append(visitAll(barline.getModifiers()));
        return bracket(output);
    }

    //=====PRIVATE METHODS==============================================================================================

    private String visitAll(Collection<? extends SyntaxNode> nodes) {
        StringBuilder output = new StringBuilder();
        for (SyntaxNode node : nodes) {
            if (node != null)
                output.append(node.accept(this));
        }
        return output.toString();
    }

    private static String bracket(CharSequence label) {
        return "{" + label + "}";
    }
}
