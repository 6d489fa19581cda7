/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.*;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.TokenType;
import net.scoreworks.mtn.semantics.Vocabulary;
import net.scoreworks.mtn.translation.MeasureId;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes measures as flat sequences of words that a sequence model can read. Note groups are bracketed by
 * {@code group:begin} and {@code group:end}, attributes and directions are announced by a marker word and every
 * top level element may be preceded by the time it occurs at, as {@code delta:1/2}.
 * <p>
 * The visitor remembers the last time it wrote within a measure, so one instance must not be shared between threads
 */
public class VisitorToSequence implements Visitor<List<String>> {
    public static final String GROUP_BEGIN = "group:begin";
    public static final String GROUP_END = "group:end";

    private final boolean statefulParsing;
    private final boolean simpleNumbers;
    private Fraction lastTime = Fraction.ZERO;

    /**
     * @param statefulParsing only write a time if it differs from the time of the previous element
     * @param simpleNumbers write digits as plain numbers and time signature fractions as a single word
     */
    public VisitorToSequence(boolean statefulParsing, boolean simpleNumbers) {
        this.statefulParsing = statefulParsing;
        this.simpleNumbers = simpleNumbers;
    }

    public VisitorToSequence() {
        this(true, true);
    }

    /**
     * Sequence of every measure of a score
     */
    public Map<MeasureId, List<String>> visitMeasures(Score score) {
        Map<MeasureId, List<String>> output = new LinkedHashMap<>();
        for (Measure measure : score.getMeasures())
            output.put(new MeasureId(measure.getPartId(), measure.getMeasureId()), visitMeasure(measure));
        return output;
    }

    @Override
    public List<String> visitScore(Score score) {
        List<String> output = new ArrayList<>();
        for (List<String> measure : visitMeasures(score).values())
            output.addAll(measure);
        return output;
    }

    @Override
    public List<String> visitMeasure(Measure measure) {
        lastTime = Fraction.ZERO;
        List<String> output = new ArrayList<>();
        if (measure.getLeftBarline() != null)
            output.addAll(visitBarline(measure.getLeftBarline()));
        output.addAll(visitAll(measure.getElements()));
        if (measure.getRightBarline() != null)
            output.addAll(visitBarline(measure.getRightBarline()));
        lastTime = Fraction.ZERO;
        return output;
    }

    @Override
    public List<String> visitToken(Token token) {
        List<String> output = new ArrayList<>();
        if (simpleNumbers && token.getTokenType() == TokenType.NUMBER) {
            output.add(Vocabulary.valueOf(token.getModifier("type")));
            return output;
        }

        StringBuilder word = new StringBuilder(token.getTokenType().getValue());
        if (!token.getModifiers().isEmpty()) {
            List<String> modifiers = new ArrayList<>();
            for (Map.Entry<String, Object> entry : token.getModifiers().entrySet())
                modifiers.add(entry.getKey() + "=" + Vocabulary.valueOf(entry.getValue()));
            word.append(':').append(StringUtils.join(modifiers, '&'));
        }
        output.add(word.toString());

        StaffPosition position = token.getPosition();
        if (token.getTokenType() == TokenType.NOTEHEAD && position.getStaff() != null)
            output.add("staff:" + position.getStaff());
        if ((token.getTokenType() == TokenType.NOTEHEAD || token.getTokenType() == TokenType.ACCIDENTAL)
                && position.getPosition() != null)
            output.add("position:" + position.getPosition());
        return output;
    }

    @Override
    public List<String> visitNote(Note note) {
        List<String> output = visitToken(note.getNotehead());
        output.addAll(visitAll(note.getDots()));
        output.addAll(visitAll(note.getAccidentals()));
        output.addAll(visitAll(note.getModifiers()));
        return output;
    }

    @Override
    public List<String> visitChord(Chord chord) {
        List<String> output = new ArrayList<>();
        if (chord.getStem() != null)
            output.addAll(visitToken(chord.getStem()));
        output.addAll(visitAll(chord.getNotes()));
        return output;
    }

    @Override
    public List<String> visitRest(Rest rest) {
        List<String> output = time(rest);
        output.addAll(visitToken(rest.getRestToken()));
        output.addAll(visitAll(rest.getDots()));
        output.addAll(visitAll(rest.getModifiers()));
        return output;
    }

    @Override
    public List<String> visitNoteGroup(NoteGroup noteGroup) {
        List<String> output = time(noteGroup);
        output.add(GROUP_BEGIN);
        output.addAll(visitAll(noteGroup.getAppendages()));
        output.addAll(visitAll(noteGroup.getChildren()));
        output.add(GROUP_END);
        return output;
    }

    @Override
    public List<String> visitTuplet(Tuplet tuplet) {
        List<String> output = visitToken(tuplet.getTuplet());
        if (tuplet.getNumber() == null)
            return output;
        List<String> number = visitNumeral(tuplet.getNumber());
        if (simpleNumbers)
            output.set(0, output.get(0) + "&" + StringUtils.join(number, ""));
        else
            output.addAll(number);
        return output;
    }

    @Override
    public List<String> visitAttributes(Attributes attributes) {
        List<String> output = time(attributes);
        output.add("attributes");
        for (int staff = 1; staff <= attributes.getNstaves(); staff++) {
            Clef clef = attributes.getClef(staff);
            Key key = attributes.getKey(staff);
            TimeSignature timeSignature = attributes.getTimesig(staff);
            if (clef == null && key == null && timeSignature == null)
                continue;
            output.add("staff:" + staff);
            if (clef != null)
                output.addAll(visitClef(clef));
            if (key != null)
                output.addAll(visitKey(key));
            if (timeSignature != null)
                output.addAll(visitTimeSignature(timeSignature));
        }
        return output;
    }

    @Override
    public List<String> visitTimeSignature(TimeSignature timeSignature) {
        if (timeSignature.getTimeSymbol() != null)
            return visitToken(timeSignature.getTimeSymbol());
        if (timeSignature.getCompoundTimeSignature() != null)
            return visitAll(timeSignature.getCompoundTimeSignature());
        return new ArrayList<>();
    }

    @Override
    public List<String> visitTimesigFraction(TimesigFraction timesigFraction) {
        List<String> output = new ArrayList<>();
        output.add("(");
        output.addAll(visitNumerator(timesigFraction.getNumerator()));
        if (timesigFraction.getDenominator() != null) {
            output.add("/");
            output.addAll(visitDenominator(timesigFraction.getDenominator()));
        }
        output.add(")");
        if (!simpleNumbers)
            return output;
        List<String> joined = new ArrayList<>();
        joined.add(StringUtils.join(output, ""));
        return joined;
    }

    @Override
    public List<String> visitNumerator(Numerator numerator) {
        return visitAll(numerator.getDigitsOrSum());
    }

    @Override
    public List<String> visitDenominator(Denominator denominator) {
        return visitNumeral(denominator.getDigits());
    }

    @Override
    public List<String> visitNumeral(Numeral numeral) {
        return visitAll(numeral.getDigits());
    }

    @Override
    public List<String> visitKey(Key key) {
        List<String> output = visitAll(key.getNaturals());
        output.addAll(visitAll(key.getAccidentals()));
        return output;
    }

    @Override
    public List<String> visitClef(Clef clef) {
        return clef.getClefToken() == null ? new ArrayList<>() : visitToken(clef.getClefToken());
    }

    @Override
    public List<String> visitDirection(Direction direction) {
        List<String> output = time(direction);
        output.add("directions");
        output.addAll(visitAll(direction.getDirectives()));
        return output;
    }

    @Override
    public List<String> visitBarline(Barline barline) {
        List<String> output = time(barline);
        output.addAll(visitAll(barline.getBarlines()));
        output.addAll(visitAll(barline.getModifiers()));
        return output;
    }

    //=====PRIVATE METHODS==============================================================================================

    /**
     * @return a list holding the time of the element, or an empty list if it is the time last written
     */
    private List<String> time(TopLevel element) {
        List<String> output = new ArrayList<>();
        if (statefulParsing && element.getDelta().compareTo(lastTime) == 0)
            return output;
        lastTime = element.getDelta();
        output.add("delta:" + TimeFormat.format(element.getDelta()));
        return output;
    }

    private List<String> visitAll(Collection<? extends SyntaxNode> nodes) {
        List<String> output = new ArrayList<>();
        for (SyntaxNode node : nodes)
            output.addAll(node.accept(this));
        return output;
    }
}
