/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.ast.Attributes;
import net.scoreworks.mtn.ast.Barline;
import net.scoreworks.mtn.ast.Chord;
import net.scoreworks.mtn.ast.Clef;
import net.scoreworks.mtn.ast.Denominator;
import net.scoreworks.mtn.ast.Direction;
import net.scoreworks.mtn.ast.Key;
import net.scoreworks.mtn.ast.Measure;
import net.scoreworks.mtn.ast.Note;
import net.scoreworks.mtn.ast.NoteGroup;
import net.scoreworks.mtn.ast.NoteModifier;
import net.scoreworks.mtn.ast.Numeral;
import net.scoreworks.mtn.ast.Numerator;
import net.scoreworks.mtn.ast.NumeratorElement;
import net.scoreworks.mtn.ast.Rest;
import net.scoreworks.mtn.ast.Score;
import net.scoreworks.mtn.ast.SyntaxNode;
import net.scoreworks.mtn.ast.TimeSignature;
import net.scoreworks.mtn.ast.TimesigElement;
import net.scoreworks.mtn.ast.TimesigFraction;
import net.scoreworks.mtn.ast.Token;
import net.scoreworks.mtn.ast.TopLevel;
import net.scoreworks.mtn.ast.Tuplet;
import net.scoreworks.mtn.exceptions.InvariantViolationException;
import net.scoreworks.mtn.exceptions.MalformedInputException;
import net.scoreworks.mtn.exceptions.UnsupportedElementException;
import net.scoreworks.mtn.semantics.AccidentalType;
import net.scoreworks.mtn.semantics.BarlineType;
import net.scoreworks.mtn.semantics.ClefType;
import net.scoreworks.mtn.semantics.Digits;
import net.scoreworks.mtn.semantics.MusicalKey;
import net.scoreworks.mtn.semantics.NamedPitch;
import net.scoreworks.mtn.semantics.NotePitch;
import net.scoreworks.mtn.semantics.NoteType;
import net.scoreworks.mtn.semantics.NoteheadType;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.StartStop;
import net.scoreworks.mtn.semantics.TimeRelation;
import net.scoreworks.mtn.semantics.TimeSymbol;
import net.scoreworks.mtn.semantics.TokenType;
import net.scoreworks.mtn.visitors.VisitorDuplicate;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.Fraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static net.scoreworks.mtn.translation.XmlElements.attribute;
import static net.scoreworks.mtn.translation.XmlElements.child;
import static net.scoreworks.mtn.translation.XmlElements.children;
import static net.scoreworks.mtn.translation.XmlElements.intAttribute;
import static net.scoreworks.mtn.translation.XmlElements.parseDecimal;
import static net.scoreworks.mtn.translation.XmlElements.parseInt;
import static net.scoreworks.mtn.translation.XmlElements.requireText;
import static net.scoreworks.mtn.translation.XmlElements.text;

/**
 * Translates a partwise MusicXML document into the music tree.
 * <p>
 * Every measure is read twice. The first pass only follows the clock and records the attribute changes, so that
 * the second pass, which builds the elements, knows the clef in force wherever a note is placed. Translation is
 * stateful: ties and slurs are matched across measures, beams may even cross barlines
 */
public class MusicXmlTranslator implements Translator<Element> {
    private static final Logger logger = LoggerFactory.getLogger(MusicXmlTranslator.class);

    private static final String UNKNOWN_ID = "<INVALID>";
    /** tuplets sort before every token among the notations of a note */
    private static final Comparator<NoteModifier> NOTATION_ORDER = Comparator.comparing(
            modifier -> modifier instanceof Token ? ((Token) modifier).getTokenType().getValue() : "a");

    private final MusicState state = new MusicState();
    private final SymbolTable symbolTable = new SymbolTable();
    private final GroupStack groupStack = new GroupStack(state, symbolTable);
    /** chord that notes marked as chord members join, separately for grace notes */
    private final Map<Boolean, Chord> currentChord = new HashMap<>();
    private Measure lastMeasure;

    @Override
    public Score translate(Element source, String scoreId, Set<MeasureId> firstLine) {
        if (!"score-partwise".equals(source.getTagName()))
            throw new UnsupportedElementException("score layout", source.getTagName());
        List<Measure> measures = new ArrayList<>();
        for (Element part : children(source, "part")) {
            measures.addAll(visitPart(part, firstLine).values());
            symbolTable.reset();
        }
        return new Score(measures, scoreId);
    }

    @Override
    public void reset() {
        state.reset();
        symbolTable.reset();
        groupStack.reset();
        currentChord.clear();
        lastMeasure = null;
    }

    //=====PRIVATE METHODS==============================================================================================

    private void newMeasure() {
        state.newMeasure();
        symbolTable.newMeasure();
        // beams may go on into the next measure, so the group stack is kept
        currentChord.clear();
    }

    private void newPart() {
        state.reset();
        groupStack.reset();
        currentChord.clear();
        lastMeasure = null;
    }

    private Map<MeasureId, Measure> visitPart(Element part, Set<MeasureId> firstLine) {
        String partId = attribute(part, "id", null);
        logger.debug("Translating part {}", partId);
        Map<MeasureId, Measure> output = new LinkedHashMap<>();
        for (Element measureElement : children(part, "measure")) {
            String measureId = attribute(measureElement, "number", null);
            if (partId == null || measureId == null)
                throw new MalformedInputException("part or measure without identifier in part " + partId);
            MeasureId identifier = new MeasureId(partId, measureId);
            logger.debug("Translating measure {}", identifier);

            Measure measure = visitMeasure(measureElement);
            if (firstLine.contains(identifier))
                addStartMeasureElements(measure);
            postprocessMeasure(measure);
            measure.setMeasureId(measureId);
            measure.setPartId(partId);
            output.put(identifier, measure);

            lastMeasure = measure;
            newMeasure();
        }
        if (lastMeasure != null && lastMeasure.getRightBarline() == null) {
            logger.debug("Closing part {} with a regular barline", partId);
            lastMeasure.setRightBarline(regularBarline(lastMeasure.getDuration()));
        }
        newPart();
        return output;
    }

    /**
     * Merge directions at the same time, flatten note groups, make sure the barline between this measure and the
     * previous one exists on both sides and sort the elements
     */
    private void postprocessMeasure(Measure measure) {
        List<TopLevel> elements = new ArrayList<>();
        Direction direction = null;
        for (TopLevel child : measure.getElements()) {
            if (child instanceof Direction) {
                Direction current = (Direction) child;
                if (direction == null) {
                    direction = current;
                } else if (direction.getDelta().compareTo(current.getDelta()) == 0) {
                    direction.merge(current);
                } else {
                    elements.add(direction);
                    direction = current;
                }
                continue;
            }
            if (direction != null) {
                elements.add(direction);
                direction = null;
            }
            if (child instanceof NoteGroup)
                ((NoteGroup) child).simplify();
            elements.add(child);
        }
        if (direction != null)
            elements.add(direction);

        stitchBarlines(measure);
        measure.setElements(elements);
    }

    private void stitchBarlines(Measure measure) {
        if (lastMeasure == null)
            return;
        if (measure.getLeftBarline() != null) {
            // two different barlines on both sides of a line break are kept as they are
            if (lastMeasure.getRightBarline() == null) {
                Barline right = duplicate(measure.getLeftBarline());
                right.setDelta(lastMeasure.getDuration());
                lastMeasure.setRightBarline(right);
            }
        } else if (lastMeasure.getRightBarline() != null) {
            Barline left = duplicate(lastMeasure.getRightBarline());
            left.setDelta(Fraction.ZERO);
            measure.setLeftBarline(left);
        } else {
            logger.debug("Adding a regular barline before measure {}", measure.getMeasureId());
            Barline right = regularBarline(lastMeasure.getDuration());
            lastMeasure.setRightBarline(right);
            Barline left = duplicate(right);
            left.setDelta(Fraction.ZERO);
            measure.setLeftBarline(left);
        }
    }

    /**
     * Repeat clef and key at the start of a system. Key accidentals are computed again because the clef they are
     * drawn under may have changed since the key was set
     */
    private void addStartMeasureElements(Measure measure) {
        logger.debug("Repeating clef and key at the start of a line");
        Attributes firstLiner = duplicate(state.startAttributes(true));
        for (Map.Entry<Integer, Key> entry : firstLiner.getKeys().entrySet()) {
            int staff = entry.getKey();
            Key key = entry.getValue();
            Clef clef = firstLiner.getClef(staff);
            if (key == null || clef == null)
                continue;
            if (key.getFifths() != null) {
                AccidentalType accidental = key.getFifths() > 0 ? AccidentalType.SHARP : AccidentalType.FLAT;
                key.setAccidentals(keyAccidentalTokens(key.getFifths(), accidental, staff, clef));
            } else {
                List<NamedPitch> steps = new ArrayList<>();
                List<AccidentalType> alterations = new ArrayList<>();
                AccidentalType[] table = key.getAlterations();
                for (int step = 0; step < table.length; step++) {
                    if (table[step] != null) {
                        steps.add(NamedPitch.fromStep(step));
                        alterations.add(table[step]);
                    }
                }
                key.setAccidentals(keyAlterTokens(steps, alterations, staff, clef));
            }
        }

        List<TopLevel> elements = new ArrayList<>(measure.getElements());
        if (!elements.isEmpty() && elements.get(0) instanceof Attributes
                && elements.get(0).getDelta().compareTo(Fraction.ZERO) == 0)
            ((Attributes) elements.get(0)).merge(firstLiner);
        else
            elements.add(0, firstLiner);
        measure.setElements(elements);
    }

    private Measure visitMeasure(Element measure) {
        List<TopLevel> elements = new ArrayList<>(preparseMeasure(measure));
        Barline leftBarline = null;
        Barline rightBarline = null;

        for (Element child : children(measure)) {
            switch (child.getTagName()) {
                case "note":
                    TopLevel note = visitNote(child);
                    if (note != null)
                        elements.add(note);
                    break;
                case "backup":
                    backupOrForward(false, child);
                    break;
                case "forward":
                    backupOrForward(true, child);
                    break;
                case "direction":
                    Direction direction = visitDirection(child);
                    if (direction != null)
                        elements.add(direction);
                    break;
                case "barline":
                    Barline barline = visitBarline(child);
                    if (barline == null)
                        break;
                    TimeSignature signature = state.getAttributes().getTimesig(1);
                    if (barline.getDelta().compareTo(Fraction.ZERO) == 0)
                        leftBarline = barline;
                    else if (signature != null && barline.getDelta().compareTo(signature.getTimeValue()) == 0)
                        rightBarline = barline;
                    else
                        elements.add(barline);
                    break;
                default:
                    break;
            }
        }
        return new Measure(elements, leftBarline, rightBarline, state.getNstaves(), UNKNOWN_ID, UNKNOWN_ID,
                state.getDuration());
    }

    /**
     * First pass over a measure: follow the clock and record every attribute change
     * @return the attribute changes of the measure
     */
    private List<Attributes> preparseMeasure(Element measure) {
        for (Element child : children(measure)) {
            switch (child.getTagName()) {
                case "note":
                    preparseNote(child);
                    break;
                case "backup":
                    backupOrForward(false, child);
                    break;
                case "forward":
                    backupOrForward(true, child);
                    break;
                case "attributes":
                    visitAttributes(child);
                    break;
                default:
                    break;
            }
        }
        state.changeTime(Fraction.ZERO);

        // the measure gets its own maps, the recorded changes must not see what is merged into it later
        List<Attributes> output = new ArrayList<>();
        for (Attributes attributes : state.getAttributeList())
            output.add(attributes.copy());
        return output;
    }

    private void preparseNote(Element note) {
        Element duration = child(note, "duration");
        if (child(note, "chord") != null || duration == null)
            return;
        state.setBuffer(visitDuration(duration));
        state.moveBuffer();
    }

    private void backupOrForward(boolean forward, Element element) {
        int value = parseInt(requireText(child(element, "duration"), element.getTagName() + " duration"),
                element.getTagName() + " duration");
        Fraction increment = Fraction.getFraction(value, state.getDivisions());
        state.incrementTime(forward ? increment : increment.negate());
    }

    /**
     * @return a rest or the outermost note group if the note starts one, null if the note joins existing elements or
     * is not drawn
     */
    private TopLevel visitNote(Element note) {
        boolean cue = false;
        boolean grace = false;
        boolean rest = false;
        boolean chord = false;
        int staff = 1;
        List<Token> accidentals = new ArrayList<>();
        List<Element> beamElements = new ArrayList<>();
        List<Element> notationElements = new ArrayList<>();
        List<Token> dots = new ArrayList<>();
        Fraction duration = Fraction.ZERO;
        NoteType type = null;
        NoteType implicitType = null;
        NotePitch pitch = null;
        Fraction timeModification = null;
        Token stem = null;
        Token notehead = null;
        boolean visible = !"no".equals(attribute(note, "print-object", "yes"));

        for (Element child : children(note)) {
            switch (child.getTagName()) {
                case "grace":
                    grace = true;
                    break;
                case "cue":
                    cue = true;
                    break;
                case "pitch":
                    pitch = visitPitch(child);
                    break;
                case "unpitched":
                    pitch = visitUnpitched(child);
                    break;
                case "rest":
                    rest = true;
                    break;
                case "chord":
                    chord = true;
                    break;
                case "duration":
                    duration = visitDuration(child);
                    break;
                case "type":
                    type = MusicXmlVocabulary.noteType(requireText(child, "note type"));
                    break;
                case "dot":
                    dots.add(token(TokenType.DOT));
                    break;
                case "accidental":
                    accidentals = visitAccidental(child);
                    break;
                case "stem":
                    stem = visitStem(child);
                    break;
                case "notehead":
                    if ("none".equals(text(child)))
                        visible = false;
                    else
                        notehead = visitNotehead(child);
                    break;
                case "staff":
                    staff = parseInt(requireText(child, "staff"), "staff");
                    break;
                case "beam":
                    beamElements.add(child);
                    break;
                case "notations":
                    notationElements.add(child);
                    break;
                case "time-modification":
                    timeModification = visitTimeModification(child);
                    implicitType = visitNormalType(child);
                    break;
                default:
                    break;
            }
        }

        if (type == null) {
            type = implicitType != null ? implicitType : inferNoteType(duration, dots.size(), stem != null, grace,
                    notehead, beamElements.size(), timeModification);
        }

        // a new chord starts once the previous one is complete, and the clef may change right then
        if (!chord)
            state.moveBuffer();
        StaffPosition position = positionFromPitch(staff, pitch);

        List<NoteModifier> notations = new ArrayList<>();
        for (Element element : notationElements)
            notations.addAll(visitNotations(element, position, timeModification));
        notations.sort(NOTATION_ORDER);

        if (rest) {
            state.setBuffer(duration);
            Token restToken = new Token(TokenType.REST, typeModifier(type), new StaffPosition(staff, null),
                    symbolTable.giveIdentifier());
            Rest output = new Rest(state.getCurrentTime(), restToken, dots, notations);
            state.moveBuffer();
            return visible ? output : null;
        }

        if (notehead != null) {
            notehead.setPosition(position);
            if (cue)
                notehead.getModifiers().put("cue", true);
            if (grace)
                notehead.getModifiers().put("grace", true);
        } else {
            notehead = inferNotehead(type, position, grace, cue);
        }
        Note currentNote = new Note(notehead, dots, accidentals, notations);

        if (chord) {
            if (!visible)
                return null;
            Chord open = currentChord.get(grace);
            if (open == null)
                throw new MalformedInputException("chord note without a note to join at " + state.getCurrentTime());
            open.addNote(currentNote);
            return null;
        }

        state.setBuffer(duration);
        if (!visible && beamElements.isEmpty() && notations.isEmpty() && stem == null)
            return null;

        Chord newChord = new Chord(state.getCurrentTime(), stem, Collections.singletonList(currentNote));
        currentChord.put(grace, newChord);

        if (!beamElements.isEmpty()) {
            boolean opensGroup = groupStack.bottom(grace) == null;
            List<BeamMark> beams = processBeams(beamElements);
            for (BeamMark beam : beams) {
                if (beam.opensLevel())
                    groupStack.newLevel(grace);
            }
            NoteGroup base = groupStack.bottom(grace);
            NoteGroup top = groupStack.top(grace);
            if (top == null)
                throw new MalformedInputException("beam continues at " + state.getCurrentTime()
                        + " but none was started");
            top.getChildren().add(newChord);
            for (BeamMark beam : beams) {
                if (beam.closesLevel())
                    groupStack.pop(grace);
            }
            return opensGroup ? base : null;
        }

        // a lone chord, drawn with flags instead of beams
        return new NoteGroup(state.getCurrentTime(), Collections.singletonList(newChord), flags(type));
    }

    private StaffPosition positionFromPitch(int staff, NotePitch pitch) {
        Clef clef = state.getAttributes().getClef(staff);
        if (clef == null)
            throw new InvariantViolationException(MusicXmlTranslator.class, "has no clef on staff " + staff);
        if (pitch == null)
            return new StaffPosition(staff, null);
        return new StaffPosition(staff, clef.pitch2pos(pitch));
    }

    private List<Token> flags(NoteType type) {
        List<Token> output = new ArrayList<>();
        Integer beams = type.getBeams();
        for (int i = 0; beams != null && i < beams; i++)
            output.add(token(TokenType.FLAG));
        return output;
    }

    /**
     * Beams of a stem in the order levels are opened, by number if every beam has one
     */
    private List<BeamMark> processBeams(List<Element> beamElements) {
        List<BeamMark> output = new ArrayList<>();
        boolean numbered = true;
        for (Element beam : beamElements) {
            BeamMark mark = new BeamMark(requireText(beam, "beam"), intAttribute(beam, "number"));
            numbered &= mark.number != null;
            output.add(mark);
        }
        if (numbered)
            output.sort(Comparator.comparing(mark -> mark.number));
        else
            output.sort(Comparator.comparing(mark -> mark.precedence));
        return output;
    }

    /**
     * Guess the note type of a note that does not state it. Beams win over the notehead, the notehead over the
     * duration
     */
    private NoteType inferNoteType(Fraction duration, int dots, boolean stem, boolean grace, Token notehead,
                                   int beams, Fraction timeModification) {
        if (beams > 0) {
            if (beams > 8)
                throw new UnsupportedElementException("beam count", Integer.toString(beams));
            return NoteType.fromBeams(beams);
        }
        if (notehead != null && notehead.getModifier("type") == NoteheadType.WHITE)
            return stem ? NoteType.HALF : NoteType.WHOLE;
        if (duration.compareTo(Fraction.ZERO) > 0) {
            // durations are in quarters, note types in whole notes
            Fraction written = duration.divideBy(Fraction.getFraction(4, 1));
            if (timeModification != null)
                written = written.multiplyBy(timeModification);
            if (dots > 0)
                written = written.divideBy(Fraction.getFraction(2, 1).subtract(Fraction.getFraction(1, 1 << dots)));
            return NoteType.fromDuration(written);
        }
        return grace ? NoteType.EIGHTH : NoteType.QUARTER;
    }

    private Token inferNotehead(NoteType type, StaffPosition position, boolean grace, boolean cue) {
        Map<String, Object> modifiers = new LinkedHashMap<>();
        modifiers.put("type", NoteheadType.fromNoteType(type));
        if (grace)
            modifiers.put("grace", true);
        if (cue)
            modifiers.put("cue", true);
        return new Token(TokenType.NOTEHEAD, modifiers, position, symbolTable.giveIdentifier());
    }

    /**
     * @return notes that are played per notes that would normally take the same time
     */
    private Fraction visitTimeModification(Element timeModification) {
        int actual = parseInt(requireText(child(timeModification, "actual-notes"), "actual-notes"), "actual-notes");
        int normal = parseInt(requireText(child(timeModification, "normal-notes"), "normal-notes"), "normal-notes");
        if (actual <= 0 || normal <= 0)
            throw new MalformedInputException("time modification of " + actual + " in the time of " + normal);
        return Fraction.getFraction(actual, normal);
    }

    private NoteType visitNormalType(Element timeModification) {
        String normalType = text(child(timeModification, "normal-type"));
        return normalType == null ? null : MusicXmlVocabulary.noteType(normalType);
    }

    /**
     * @param position where the note sits, used to match ties. The tokens themselves carry no position
     */
    private List<NoteModifier> visitNotations(Element notations, StaffPosition position, Fraction timeModification) {
        List<NoteModifier> output = new ArrayList<>();
        for (Element child : children(notations)) {
            switch (child.getTagName()) {
                case "tied":
                    addIfPresent(output, visitTied(child, position));
                    break;
                case "slur":
                case "glissando":
                case "slide":
                    addIfPresent(output, visitPointToPoint(child));
                    break;
                case "tuplet":
                    addIfPresent(output, visitTuplet(child, timeModification));
                    break;
                case "arpeggiate":
                    int arpeggio = symbolTable.identifyArpeggios(state.getCurrentTime(), intAttribute(child, "number"));
                    output.add(new Token(TokenType.ARPEGGIATE, new HashMap<>(), StaffPosition.UNSET, arpeggio));
                    break;
                case "fermata":
                    output.add(token(TokenType.FERMATA));
                    break;
                case "ornaments":
                    output.addAll(visitOrnaments(child));
                    break;
                case "articulations":
                    output.addAll(visitArticulations(child));
                    break;
                case "dynamics":
                    output.addAll(visitDynamics(child));
                    break;
                default:
                    break;
            }
        }
        return output;
    }

    private Tuplet visitTuplet(Element tuplet, Fraction timeModification) {
        StartStop type = MusicXmlVocabulary.startStop(requiredAttribute(tuplet, "type"));
        boolean showNumber = !"none".equals(attribute(tuplet, "show-number", "none"));
        boolean showBracket = !"no".equals(attribute(tuplet, "bracket", "no"));

        Numeral number = null;
        if (showNumber) {
            String digits;
            if (timeModification == null) {
                Element actual = child(tuplet, "tuplet-actual");
                if (actual == null)
                    throw new MalformedInputException("tuplet without actual number");
                digits = requireText(child(actual, "tuplet-number"), "tuplet number");
            } else {
                digits = Integer.toString(timeModification.getNumerator());
            }
            if (type == StartStop.START)
                number = numeral(digits);
        }
        int identifier = symbolTable.identifyPointToPoint(TokenType.TUPLET, intAttribute(tuplet, "number"));
        Token token = new Token(TokenType.TUPLET, typeModifier(type), StaffPosition.UNSET, identifier);
        if (!showBracket && !showNumber)
            return null;
        return new Tuplet(number, token);
    }

    /**
     * Only the ends of a tie are drawn, continuing ties leave the open one alone
     */
    private Token visitTied(Element tied, StaffPosition position) {
        String type = requiredAttribute(tied, "type");
        if ("continue".equals(type) || "let-ring".equals(type))
            return null;
        StartStop startStop = MusicXmlVocabulary.startStop(type);
        int identifier = symbolTable.identifyTie(position, intAttribute(tied, "number"));
        return new Token(TokenType.TIED, typeModifier(startStop), StaffPosition.UNSET, identifier);
    }

    private Token visitPointToPoint(Element element) {
        String type = requiredAttribute(element, "type");
        if (!"start".equals(type) && !"stop".equals(type))
            return null;
        TokenType tokenType = MusicXmlVocabulary.POINT_TO_POINT.get(element.getTagName());
        if (tokenType == null)
            throw new UnsupportedElementException("point-to-point notation", element.getTagName());
        int identifier = symbolTable.identifyPointToPoint(tokenType, intAttribute(element, "number"));
        return new Token(tokenType, typeModifier(MusicXmlVocabulary.startStop(type)), StaffPosition.UNSET,
                identifier);
    }

    private List<Token> visitOrnaments(Element ornaments) {
        List<Token> output = new ArrayList<>();
        for (Element child : children(ornaments)) {
            String tag = child.getTagName();
            if (MusicXmlVocabulary.POINT_TO_POINT.containsKey(tag))
                addIfPresent(output, visitPointToPoint(child));
            else if (MusicXmlVocabulary.ORNAMENTS.containsKey(tag))
                output.add(token(MusicXmlVocabulary.ORNAMENTS.get(tag)));
            else
                logger.warn("Skipping ornament {}", tag);
        }
        return output;
    }

    private List<Token> visitArticulations(Element articulations) {
        List<Token> output = new ArrayList<>();
        for (Element child : children(articulations)) {
            TokenType type = MusicXmlVocabulary.ARTICULATIONS.get(child.getTagName());
            if (type != null)
                output.add(token(type));
            else
                logger.warn("Skipping articulation {}", child.getTagName());
        }
        return output;
    }

    /**
     * @return the stem or null if the note is drawn without one
     */
    private Token visitStem(Element stem) {
        String value = requireText(stem, "stem");
        if ("none".equals(value))
            return null;
        if ("double".equals(value))
            throw new UnsupportedElementException("stem", value);
        return new Token(TokenType.STEM, typeModifier(MusicXmlVocabulary.stem(value)), StaffPosition.UNSET,
                symbolTable.giveIdentifier());
    }

    /**
     * @return the notehead or null if it is a regular one
     */
    private Token visitNotehead(Element notehead) {
        NoteheadType type = MusicXmlVocabulary.notehead(requireText(notehead, "notehead"));
        if (type == null)
            return null;
        return new Token(TokenType.NOTEHEAD, typeModifier(type), StaffPosition.UNSET, symbolTable.giveIdentifier());
    }

    private NotePitch visitPitch(Element pitch) {
        NamedPitch step = namedPitch(requireText(child(pitch, "step"), "pitch step"));
        int octave = parseInt(requireText(child(pitch, "octave"), "pitch octave"), "pitch octave");
        String alter = text(child(pitch, "alter"));
        // quarter tones are drawn like the semitone next to them
        int semitones = alter == null ? 0 : parseDecimal(alter, "alter").setScale(0, RoundingMode.HALF_UP)
                .intValue();
        return new NotePitch(step, octave, semitones);
    }

    private NotePitch visitUnpitched(Element unpitched) {
        NamedPitch step = namedPitch(requireText(child(unpitched, "display-step"), "display step"));
        int octave = parseInt(requireText(child(unpitched, "display-octave"), "display octave"), "display octave");
        return new NotePitch(step, octave);
    }

    /**
     * @return the duration in quarter notes
     */
    private Fraction visitDuration(Element duration) {
        return Fraction.getFraction(parseInt(requireText(duration, "duration"), "duration"), state.getDivisions());
    }

    private List<Token> visitAccidental(Element accidental) {
        List<Token> output = new ArrayList<>();
        for (AccidentalType type : MusicXmlVocabulary.accidentals(requireText(accidental, "accidental")))
            output.add(token(TokenType.ACCIDENTAL, type));
        return output;
    }

    private Direction visitDirection(Element direction) {
        state.moveBuffer();
        List<Token> tokens = new ArrayList<>();
        for (Element child : children(direction, "direction-type"))
            tokens.addAll(visitDirectionType(child));
        if (tokens.isEmpty())
            return null;
        Direction output = new Direction(state.getCurrentTime(), tokens);
        output.sort();
        return output;
    }

    private List<Token> visitDirectionType(Element directionType) {
        List<Token> output = new ArrayList<>();
        for (Element child : children(directionType)) {
            switch (child.getTagName()) {
                case "segno":
                    output.add(token(TokenType.SEGNO));
                    break;
                case "coda":
                    output.add(token(TokenType.CODA));
                    break;
                case "wedge":
                    addIfPresent(output, visitWedge(child));
                    break;
                case "dynamics":
                    output.addAll(visitDynamics(child));
                    break;
                default:
                    break;
            }
        }
        return output;
    }

    private List<Token> visitDynamics(Element dynamics) {
        List<Token> output = new ArrayList<>();
        for (Element child : children(dynamics)) {
            if ("other-dynamics".equals(child.getTagName())) {
                logger.warn("Skipping other-dynamics [{}]", text(child));
                continue;
            }
            output.add(token(TokenType.DYN, MusicXmlVocabulary.dynamics(child.getTagName())));
        }
        return output;
    }

    /**
     * @return the start or end of a wedge, null for a wedge that goes on
     */
    private Token visitWedge(Element wedge) {
        String type = requiredAttribute(wedge, "type");
        if ("continue".equals(type)) {
            logger.debug("Skipping continuing wedge");
            return null;
        }
        int identifier = symbolTable.identifyPointToPoint(TokenType.WEDGE, intAttribute(wedge, "number"));
        return new Token(TokenType.WEDGE, typeModifier(MusicXmlVocabulary.wedge(type)), StaffPosition.UNSET,
                identifier);
    }

    /**
     * Record the clef, key and time signature changes of an attributes element at the current time
     */
    private void visitAttributes(Element attributes) {
        state.moveBuffer();
        List<Element> keyElements = new ArrayList<>();
        List<Element> timeElements = new ArrayList<>();
        List<Element> clefElements = new ArrayList<>();

        for (Element child : children(attributes)) {
            switch (child.getTagName()) {
                case "divisions":
                    state.setDivisions(parseInt(requireText(child, "divisions"), "divisions"));
                    break;
                case "staves":
                    state.changeStaves(parseInt(requireText(child, "staves"), "staves"));
                    break;
                case "key":
                    keyElements.add(child);
                    break;
                case "time":
                    timeElements.add(child);
                    break;
                case "clef":
                    clefElements.add(child);
                    break;
                default:
                    break;
            }
        }

        Attributes output = Attributes.makeEmpty(state.getNstaves(), state.getCurrentTime(), false);
        for (Element element : clefElements) {
            Clef clef = visitClef(element);
            output.setClef(clef.getPosition().getStaff(), clef);
        }

        for (Element element : timeElements) {
            TimeSignature signature = visitTime(element);
            Integer staff = intAttribute(element, "number");
            if (staff != null) {
                output.setTimesig(staff, signature);
                continue;
            }
            output.setTimesig(1, signature);
            for (int other = 2; other <= state.getNstaves(); other++)
                output.setTimesig(other, duplicate(signature));
        }

        // key accidentals are placed under the clef that is in force once these attributes apply
        for (Element element : keyElements) {
            for (Map.Entry<Integer, Key> entry : visitKey(element, output).entrySet())
                output.setKey(entry.getKey(), entry.getValue());
        }
        state.setAttributes(output);
    }

    private Map<Integer, Key> visitKey(Element key, Attributes pending) {
        List<Element> content = children(key);
        if (content.isEmpty())
            throw new MalformedInputException("key without content");
        Integer staff = intAttribute(key, "number");
        Map<Integer, Clef> clefs = new LinkedHashMap<>();
        for (int s = staff == null ? 1 : staff; s <= (staff == null ? state.getNstaves() : staff); s++) {
            Clef clef = pending.getClef(s);
            clefs.put(s, clef != null ? clef : state.getAttributes().getClef(s));
        }

        String first = content.get(0).getTagName();
        if ("cancel".equals(first) || "fifths".equals(first))
            return keyFifths(key, clefs);
        return keyAlters(key, clefs);
    }

    /**
     * A key given as a position on the circle of fifths, possibly cancelling the previous one
     */
    private Map<Integer, Key> keyFifths(Element key, Map<Integer, Clef> clefs) {
        AccidentalType[] alterations = new AccidentalType[7];
        Integer fifths = null;
        Map<Integer, List<Token>> accidentals = new HashMap<>();
        Map<Integer, List<Token>> naturals = new HashMap<>();

        for (Element child : children(key)) {
            String value = text(child);
            if (value == null)
                continue;
            if ("cancel".equals(child.getTagName())) {
                int cancel = parseInt(value, "key cancel");
                for (Map.Entry<Integer, Clef> entry : clefs.entrySet())
                    naturals.put(entry.getKey(), keyAccidentalTokens(cancel, AccidentalType.NATURAL, entry.getKey(),
                            entry.getValue()));
            } else if ("fifths".equals(child.getTagName())) {
                fifths = parseInt(value, "key fifths");
                AccidentalType accidental = fifths > 0 ? AccidentalType.SHARP : AccidentalType.FLAT;
                for (Map.Entry<Integer, Clef> entry : clefs.entrySet())
                    accidentals.put(entry.getKey(), keyAccidentalTokens(fifths, accidental, entry.getKey(),
                            entry.getValue()));
                alterations = MusicalKey.fifthsAlterations(fifths);
            }
        }

        Map<Integer, Key> output = new LinkedHashMap<>();
        for (int staff : clefs.keySet())
            output.put(staff, new Key(accidentals.getOrDefault(staff, new ArrayList<>()),
                    naturals.getOrDefault(staff, new ArrayList<>()), alterations, fifths));
        return output;
    }

    private List<Token> keyAccidentalTokens(int fifths, AccidentalType accidental, int staff, Clef clef) {
        List<Token> output = new ArrayList<>();
        for (int position : MusicalKey.accidentalPositions(fifths, clef.getSign(), clef.getOctave(),
                clef.getPosition().getPosition())) {
            output.add(new Token(TokenType.ACCIDENTAL, typeModifier(accidental), new StaffPosition(staff, position),
                    symbolTable.giveIdentifier()));
        }
        return output;
    }

    /**
     * A key given as an explicit list of altered steps
     */
    private Map<Integer, Key> keyAlters(Element key, Map<Integer, Clef> clefs) {
        List<NamedPitch> steps = new ArrayList<>();
        List<AccidentalType> symbols = new ArrayList<>();
        for (Element child : children(key)) {
            switch (child.getTagName()) {
                case "key-step":
                    steps.add(namedPitch(requireText(child, "key-step")));
                    break;
                case "key-alter":
                    int sign = parseDecimal(requireText(child, "key-alter"), "key-alter").signum();
                    symbols.add(sign > 0 ? AccidentalType.SHARP : sign < 0 ? AccidentalType.FLAT
                            : AccidentalType.NATURAL);
                    break;
                case "key-accidental":
                    String value = text(child);
                    if (value == null)
                        break;
                    List<AccidentalType> accidental = MusicXmlVocabulary.accidentals(value);
                    if (accidental.size() != 1)
                        throw new UnsupportedElementException("key accidental", value);
                    if (symbols.isEmpty())
                        throw new MalformedInputException("key-accidental before any key-alter");
                    symbols.set(symbols.size() - 1, accidental.get(0));
                    break;
                default:
                    break;
            }
        }
        if (steps.size() != symbols.size())
            throw new MalformedInputException("key with " + steps.size() + " steps but " + symbols.size()
                    + " alterations");

        AccidentalType[] alterations = new AccidentalType[7];
        for (int i = 0; i < steps.size(); i++)
            alterations[steps.get(i).getStep()] = symbols.get(i);

        Map<Integer, Key> output = new LinkedHashMap<>();
        for (Map.Entry<Integer, Clef> entry : clefs.entrySet())
            output.put(entry.getKey(), new Key(keyAlterTokens(steps, symbols, entry.getKey(), entry.getValue()),
                    new ArrayList<>(), alterations, null));
        return output;
    }

    /**
     * Accidentals of an explicit key, each one drawn an octave above the clef pitch and folded into the staff
     */
    private List<Token> keyAlterTokens(List<NamedPitch> steps, List<AccidentalType> symbols, int staff, Clef clef) {
        List<Token> output = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            int position = MusicalKey.ensureRange(clef.pitch2pos(new NotePitch(steps.get(i), clef.getOctave() + 1)));
            output.add(new Token(TokenType.ACCIDENTAL, typeModifier(symbols.get(i)), new StaffPosition(staff, position),
                    symbolTable.giveIdentifier()));
        }
        return output;
    }

    private Clef visitClef(Element clef) {
        String sign = requireText(child(clef, "sign"), "clef sign");
        if (MusicXmlVocabulary.UNSUPPORTED_CLEFS.contains(sign))
            throw new UnsupportedElementException("clef", sign);
        ClefType type = MusicXmlVocabulary.clef(sign);
        int staff = clef.hasAttribute("number") ? intAttribute(clef, "number") : 1;
        boolean printed = !"none".equals(sign) && !"no".equals(attribute(clef, "print-object", "yes"));

        Map<String, Object> modifiers = new LinkedHashMap<>();
        modifiers.put("type", type);
        int octave = type.getDefaultOctave();
        String octaveChange = text(child(clef, "clef-octave-change"));
        if (octaveChange != null) {
            int change = parseInt(octaveChange, "clef-octave-change");
            octave += change;
            modifiers.put("oct", change);
        }
        String line = text(child(clef, "line"));
        int position = line == null ? type.getDefaultPosition() : 2 * parseInt(line, "clef line");

        StaffPosition anchor = new StaffPosition(staff, position);
        Token token = printed ? new Token(TokenType.CLEF, modifiers, anchor, symbolTable.giveIdentifier()) : null;
        return new Clef(token, type.getSign(), octave, anchor);
    }

    private TimeSignature visitTime(Element time) {
        if (child(time, "senza-misura") != null)
            throw new UnsupportedElementException("time signature", "senza-misura");
        String symbol = attribute(time, "symbol", "normal");
        List<TimesigElement> compound = new ArrayList<>();
        Fraction value = parseTime(beatsOf(time, "beats"), beatsOf(time, "beat-type"), compound);

        if ("no".equals(attribute(time, "print-object", "yes")))
            return new TimeSignature(null, null, value);
        if (MusicXmlVocabulary.UNSUPPORTED_TIME_SYMBOLS.contains(symbol))
            throw new UnsupportedElementException("time symbol", symbol);
        switch (symbol) {
            case "common":
                return new TimeSignature(token(TokenType.TIMESIG, TimeSymbol.COMMON), null, value);
            case "cut":
                return new TimeSignature(token(TokenType.TIMESIG, TimeSymbol.CUT), null, value);
            case "normal":
                Element interchangeable = child(time, "interchangeable");
                if (interchangeable != null) {
                    compound.add(token(TokenType.TIME_RELATION, TimeRelation.EQUALS));
                    parseTime(beatsOf(interchangeable, "beats"), beatsOf(interchangeable, "beat-type"), compound);
                }
                return new TimeSignature(null, compound, value);
            default:
                throw new UnsupportedElementException("time symbol", symbol);
        }
    }

    private static List<String> beatsOf(Element time, String tag) {
        List<String> output = new ArrayList<>();
        for (Element child : children(time, tag)) {
            String text = text(child);
            if (text != null)
                output.add(text);
        }
        return output;
    }

    /**
     * Build the fractions of a (possibly compound) time signature
     * @param output receives the fractions and the tokens joining them
     * @return length of a measure in quarter notes
     */
    private Fraction parseTime(List<String> numerators, List<String> denominators, List<TimesigElement> output) {
        if (numerators.size() != denominators.size())
            throw new MalformedInputException("time signature with " + numerators.size() + " beats but "
                    + denominators.size() + " beat types");
        Fraction total = Fraction.ZERO;
        for (int i = 0; i < numerators.size(); i++) {
            if (i != 0)
                output.add(token(TokenType.PLUS));
            List<NumeratorElement> numerator = new ArrayList<>();
            int numeratorValue = 0;
            String[] terms = StringUtils.deleteWhitespace(numerators.get(i)).split("\\+");
            for (int j = 0; j < terms.length; j++) {
                if (j != 0)
                    numerator.add(token(TokenType.PLUS));
                numeratorValue += parseInt(terms[j], "beats");
                numerator.add(numeral(terms[j]));
            }
            String denominator = StringUtils.deleteWhitespace(denominators.get(i));
            int denominatorValue = parseInt(denominator, "beat-type");
            output.add(new TimesigFraction(new Numerator(numerator), new Denominator(numeral(denominator))));
            total = total.add(Fraction.getFraction(numeratorValue * 4, denominatorValue));
        }
        return total.reduce();
    }

    private Numeral numeral(String digits) {
        List<Token> tokens = new ArrayList<>();
        for (char digit : digits.toCharArray()) {
            if (!Character.isDigit(digit))
                throw new MalformedInputException("invalid number [" + digits + "]");
            tokens.add(token(TokenType.NUMBER, Digits.fromDigit(Character.digit(digit, 10))));
        }
        return new Numeral(tokens);
    }

    /**
     * @return the barline or null if it is not drawn
     */
    private Barline visitBarline(Element barline) {
        state.moveBuffer();
        String style = "regular";
        List<Token> modifiers = new ArrayList<>();
        for (Element child : children(barline)) {
            switch (child.getTagName()) {
                case "bar-style":
                    style = requireText(child, "bar-style");
                    if ("none".equals(style))
                        return null;
                    break;
                case "segno":
                    modifiers.add(token(TokenType.SEGNO));
                    break;
                case "coda":
                    modifiers.add(token(TokenType.CODA));
                    break;
                case "fermata":
                    modifiers.add(token(TokenType.FERMATA));
                    break;
                case "repeat":
                    modifiers.add(token(TokenType.REPEAT,
                            MusicXmlVocabulary.repeatDirection(attribute(child, "direction", "forward"))));
                    break;
                default:
                    break;
            }
        }

        List<Token> barlines = new ArrayList<>();
        for (BarlineType type : MusicXmlVocabulary.barStyle(style))
            barlines.add(token(TokenType.BARLINE, type));

        String location = attribute(barline, "location", null);
        TimeSignature signature = state.getAttributes().getTimesig(1);
        Fraction time;
        if ("left".equals(location))
            time = Fraction.ZERO;
        else if ("right".equals(location) && signature != null)
            time = signature.getTimeValue();
        else
            time = state.getCurrentTime();
        return new Barline(time, barlines, modifiers);
    }

    private Barline regularBarline(Fraction delta) {
        return new Barline(delta, Collections.singletonList(token(TokenType.BARLINE, BarlineType.REGULAR)),
                new ArrayList<>());
    }

    @SuppressWarnings("unchecked")
    private <N extends SyntaxNode> N duplicate(N node) {
        return (N) node.accept(new VisitorDuplicate(symbolTable::giveIdentifier));
    }

    private Token token(TokenType type) {
        return new Token(type, new HashMap<>(), StaffPosition.UNSET, symbolTable.giveIdentifier());
    }

    private Token token(TokenType type, Object typeValue) {
        return new Token(type, typeModifier(typeValue), StaffPosition.UNSET, symbolTable.giveIdentifier());
    }

    private static Map<String, Object> typeModifier(Object value) {
        Map<String, Object> modifiers = new LinkedHashMap<>();
        modifiers.put("type", value);
        return modifiers;
    }

    private static <T> void addIfPresent(List<? super T> list, T value) {
        if (value != null)
            list.add(value);
    }

    private static String requiredAttribute(Element element, String name) {
        String value = attribute(element, name, null);
        if (value == null)
            throw new MalformedInputException(element.getTagName() + " without attribute " + name);
        return value;
    }

    private static NamedPitch namedPitch(String step) {
        try {
            return NamedPitch.valueOf(step);
        } catch (IllegalArgumentException e) {
            throw new MalformedInputException("invalid step [" + step + "]", e);
        }
    }

    /**
     * One beam element of a stem
     */
    private static final class BeamMark {
        private final String value;
        private final Integer number;
        private final int precedence;

        private BeamMark(String value, Integer number) {
            this.value = value;
            this.number = number;
            this.precedence = MusicXmlVocabulary.beamPrecedence(value);
        }

        private boolean opensLevel() {
            return "begin".equals(value) || value.endsWith("hook");
        }

        private boolean closesLevel() {
            return "end".equals(value) || value.endsWith("hook");
        }
    }
}
