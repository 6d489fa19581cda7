package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.ast.*;
import net.scoreworks.mtn.exceptions.InvariantViolationException;
import net.scoreworks.mtn.exceptions.MalformedInputException;
import net.scoreworks.mtn.exceptions.UnsupportedElementException;
import net.scoreworks.mtn.semantics.*;
import net.scoreworks.mtn.visitors.VisitorGetTokens;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.InputStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class MusicXmlTranslatorTest {
    MusicXmlTranslator translator;

    @BeforeEach
    public void createTranslator() {
        translator = new MusicXmlTranslator();
    }

    static Element load(String name) throws Exception {
        try (InputStream stream = MusicXmlTranslatorTest.class.getResourceAsStream("/mxml/" + name)) {
            Assertions.assertNotNull(stream, name);
            return DocumentBuilderFactory.newInstance().newDocumentBuilder().parse(stream).getDocumentElement();
        }
    }

    static Element parse(String xml) throws Exception {
        Document document = DocumentBuilderFactory.newInstance().newDocumentBuilder()
                .parse(new InputSource(new StringReader(xml)));
        return document.getDocumentElement();
    }

    private Score translate(String name, MeasureId... firstLine) throws Exception {
        Set<MeasureId> lineStarts = new HashSet<>(Arrays.asList(firstLine));
        return translator.translate(load(name), name, lineStarts);
    }

    private static List<Integer> positions(List<Token> tokens) {
        List<Integer> output = new ArrayList<>();
        for (Token token : tokens)
            output.add(token.getPosition().getPosition());
        return output;
    }

    private static Note onlyNote(TopLevel element) {
        NoteGroup group = (NoteGroup) element;
        Assertions.assertEquals(1, group.getChildren().size());
        Chord chord = (Chord) group.getChildren().get(0);
        Assertions.assertEquals(1, chord.getNotes().size());
        return chord.getNotes().get(0);
    }

    @Test
    public void singleNote() throws Exception {
        Score score = translate("single_note.xml");
        Assertions.assertEquals("single_note.xml", score.getScoreId());
        Assertions.assertEquals(1, score.getMeasures().size());

        Measure measure = score.getMeasures().get(0);
        Assertions.assertEquals("P1", measure.getPartId());
        Assertions.assertEquals("1", measure.getMeasureId());
        Assertions.assertEquals(Fraction.getFraction(4, 1), measure.getDuration());
        Assertions.assertEquals(2, measure.getElements().size());
        Assertions.assertTrue(measure.getElements().get(0) instanceof Attributes);

        NoteGroup group = (NoteGroup) measure.getElements().get(1);
        Assertions.assertEquals(0, group.getDelta().compareTo(Fraction.ZERO));
        Assertions.assertTrue(group.getAppendages().isEmpty());
        Note note = onlyNote(group);
        Assertions.assertEquals(new StaffPosition(1, 0), note.getPosition());
        // no type given, a note of four quarters is a whole note
        Assertions.assertEquals(NoteheadType.WHITE, note.getNotehead().getModifier("type"));
        Assertions.assertNull(((Chord) group.getChildren().get(0)).getStem());

        Assertions.assertNull(measure.getLeftBarline());
        Barline right = measure.getRightBarline();
        Assertions.assertEquals(0, right.getDelta().compareTo(Fraction.getFraction(4, 1)));
        Assertions.assertEquals(BarlineType.REGULAR, right.getBarlines().get(0).getModifier("type"));
    }

    @Test
    public void attributesOfTheFirstMeasure() throws Exception {
        Measure measure = translate("two_measures.xml").getMeasures().get(0);
        Attributes attributes = (Attributes) measure.getElements().get(0);

        Clef clef = attributes.getClef(1);
        Assertions.assertEquals(NamedPitch.G, clef.getSign());
        Assertions.assertEquals(new StaffPosition(1, 4), clef.getPosition());
        Assertions.assertEquals(ClefType.G, clef.getClefToken().getModifier("type"));

        Key key = attributes.getKey(1);
        Assertions.assertEquals(2, key.getFifths());
        Assertions.assertEquals(Arrays.asList(7, 10), sortedPositions(key.getAccidentals()));
        for (Token accidental : key.getAccidentals())
            Assertions.assertEquals(AccidentalType.SHARP, accidental.getModifier("type"));
        Assertions.assertEquals(AccidentalType.SHARP, key.getAlterations()[NamedPitch.F.getStep()]);

        TimeSignature time = attributes.getTimesig(1);
        Assertions.assertEquals(Fraction.getFraction(2, 1), time.getTimeValue());
        Assertions.assertNull(time.getTimeSymbol());
        TimesigFraction fraction = (TimesigFraction) time.getCompoundTimeSignature().get(0);
        Assertions.assertEquals(2, fraction.getNumerator().getValue());
        Assertions.assertEquals(4, fraction.getDenominator().getValue());
    }

    private static List<Integer> sortedPositions(List<Token> tokens) {
        List<Integer> output = positions(tokens);
        Collections.sort(output);
        return output;
    }

    @Test
    public void beamedEighthsFormOneGroup() throws Exception {
        Measure measure = translate("two_measures.xml").getMeasures().get(0);
        Assertions.assertEquals(3, measure.getElements().size());

        NoteGroup beamed = (NoteGroup) measure.getElements().get(1);
        Assertions.assertEquals(2, beamed.getChildren().size());
        Assertions.assertEquals(1, beamed.getAppendages().size());
        Assertions.assertEquals(TokenType.BEAM, beamed.getAppendages().get(0).getTokenType());

        Chord first = (Chord) beamed.getChildren().get(0);
        Chord second = (Chord) beamed.getChildren().get(1);
        Assertions.assertEquals(0, first.getDelta().compareTo(Fraction.ZERO));
        Assertions.assertEquals(0, second.getDelta().compareTo(Fraction.ONE_HALF));
        Assertions.assertTrue(first.isStemUpwards());
        Assertions.assertEquals(new StaffPosition(1, 1), second.getPosition());
    }

    @Test
    public void chordNotesJoinThePreviousNote() throws Exception {
        Measure measure = translate("two_measures.xml").getMeasures().get(0);
        NoteGroup group = (NoteGroup) measure.getElements().get(2);
        Assertions.assertEquals(0, group.getDelta().compareTo(Fraction.ONE));
        Chord chord = (Chord) group.getChildren().get(0);
        Assertions.assertEquals(2, chord.getNotes().size());
        Assertions.assertEquals(new StaffPosition(1, 2), chord.getNotes().get(0).getPosition());
        Assertions.assertEquals(new StaffPosition(1, 4), chord.getNotes().get(1).getPosition());
    }

    @Test
    public void tiesAreMatchedAcrossBarlines() throws Exception {
        List<Token> ties = new ArrayList<>();
        for (Token token : new VisitorGetTokens().visitAst(translate("two_measures.xml"))) {
            if (token.getTokenType() == TokenType.TIED)
                ties.add(token);
        }
        Assertions.assertEquals(2, ties.size());
        Assertions.assertEquals(StartStop.START, ties.get(0).getModifier("type"));
        Assertions.assertEquals(StartStop.STOP, ties.get(1).getModifier("type"));
        Assertions.assertEquals(ties.get(0).getTokenId(), ties.get(1).getTokenId());
        Assertions.assertTrue(ties.get(0).getPosition().isUnset());
    }

    @Test
    public void backupStartsASecondVoice() throws Exception {
        Measure measure = translate("two_measures.xml").getMeasures().get(1);
        List<TopLevel> elements = measure.getElements();
        Assertions.assertEquals(3, elements.size());

        Assertions.assertEquals(new StaffPosition(1, 2), onlyNote(elements.get(0)).getPosition());
        Assertions.assertEquals(new StaffPosition(1, 7), onlyNote(elements.get(1)).getPosition());
        Assertions.assertEquals(0, elements.get(1).getDelta().compareTo(Fraction.ZERO));

        Rest rest = (Rest) elements.get(2);
        Assertions.assertEquals(0, rest.getDelta().compareTo(Fraction.ONE));
        Assertions.assertEquals(NoteType.QUARTER, rest.getRestType());
        Assertions.assertEquals(new StaffPosition(1, null), rest.getPosition());
    }

    @Test
    public void barlinesAreStitched() throws Exception {
        Score score = translate("two_measures.xml");
        Measure first = score.getMeasures().get(0);
        Measure second = score.getMeasures().get(1);

        Assertions.assertNull(first.getLeftBarline());
        Assertions.assertEquals(0, first.getRightBarline().getDelta().compareTo(Fraction.getFraction(2, 1)));
        Barline left = second.getLeftBarline();
        Assertions.assertEquals(0, left.getDelta().compareTo(Fraction.ZERO));
        Assertions.assertTrue(left.getBarlines().get(0).compare(first.getRightBarline().getBarlines().get(0)));
        Assertions.assertNotEquals(left.getBarlines().get(0).getTokenId(),
                first.getRightBarline().getBarlines().get(0).getTokenId());

        Barline closing = second.getRightBarline();
        Assertions.assertEquals(0, closing.getDelta().compareTo(Fraction.getFraction(2, 1)));
        Assertions.assertEquals(2, closing.getBarlines().size());
        Assertions.assertEquals(BarlineType.REGULAR, closing.getBarlines().get(0).getModifier("type"));
        Assertions.assertEquals(BarlineType.HEAVY, closing.getBarlines().get(1).getModifier("type"));
    }

    @Test
    public void lineStartsRepeatClefAndKey() throws Exception {
        Score score = translate("two_measures.xml", new MeasureId("P1", "2"));
        Measure first = score.getMeasures().get(0);
        Measure second = score.getMeasures().get(1);
        Assertions.assertEquals(4, second.getElements().size());

        Attributes repeated = (Attributes) second.getElements().get(0);
        Assertions.assertEquals(0, repeated.getDelta().compareTo(Fraction.ZERO));
        Assertions.assertNull(repeated.getTimesig(1));
        Assertions.assertNotNull(repeated.getClef(1).getClefToken());
        Assertions.assertEquals(Arrays.asList(7, 10), sortedPositions(repeated.getKey(1).getAccidentals()));

        Attributes original = (Attributes) first.getElements().get(0);
        Assertions.assertTrue(original.getClef(1).compare(repeated.getClef(1)));
        Assertions.assertNotEquals(original.getClef(1).getClefToken().getTokenId(),
                repeated.getClef(1).getClefToken().getTokenId());
        // the first measure keeps its own tokens
        Assertions.assertNotNull(original.getTimesig(1));
    }

    @Test
    public void notationsAndDirections() throws Exception {
        Measure measure = translate("notations.xml").getMeasures().get(0);
        List<TopLevel> elements = measure.getElements();
        Assertions.assertEquals(5, elements.size());
        Assertions.assertTrue(elements.get(0) instanceof Attributes);
        Assertions.assertTrue(elements.get(1) instanceof Direction);
        Assertions.assertTrue(elements.get(2) instanceof NoteGroup);
        Assertions.assertTrue(elements.get(3) instanceof Direction);
        Assertions.assertTrue(elements.get(4) instanceof NoteGroup);

        Attributes attributes = (Attributes) elements.get(0);
        Token flat = attributes.getKey(1).getAccidentals().get(0);
        Assertions.assertEquals(AccidentalType.FLAT, flat.getModifier("type"));
        Assertions.assertEquals(new StaffPosition(1, 4), flat.getPosition());

        List<Token> start = ((Direction) elements.get(1)).getDirectives();
        Assertions.assertEquals(2, start.size());
        Assertions.assertEquals(DynamicsType.F, start.get(0).getModifier("type"));
        Assertions.assertEquals(WedgeType.CRESCENDO, start.get(1).getModifier("type"));
        Direction stop = (Direction) elements.get(3);
        Assertions.assertEquals(0, stop.getDelta().compareTo(Fraction.ONE));
        Assertions.assertEquals(start.get(1).getTokenId(), stop.getDirectives().get(0).getTokenId());
    }

    @Test
    public void tupletsSlursAndArticulations() throws Exception {
        Measure measure = translate("notations.xml").getMeasures().get(0);
        NoteGroup triplet = (NoteGroup) measure.getElements().get(2);
        Assertions.assertEquals(3, triplet.getChildren().size());

        List<Note> notes = new ArrayList<>();
        for (GroupElement child : triplet.getChildren())
            notes.add(((Chord) child).getNotes().get(0));
        Assertions.assertEquals(new StaffPosition(1, 5), notes.get(0).getPosition());
        Assertions.assertEquals(new StaffPosition(1, 7), notes.get(2).getPosition());
        Assertions.assertEquals(0, ((Chord) triplet.getChildren().get(1)).getDelta()
                .compareTo(Fraction.getFraction(1, 3)));

        List<NoteModifier> first = notes.get(0).getModifiers();
        Assertions.assertEquals(2, first.size());
        Tuplet tupletStart = (Tuplet) first.get(0);
        Assertions.assertNull(tupletStart.getNumber());
        Token slurStart = (Token) first.get(1);
        Assertions.assertEquals(TokenType.SLUR, slurStart.getTokenType());

        Token staccato = (Token) notes.get(1).getModifiers().get(0);
        Assertions.assertEquals(TokenType.STACCATO, staccato.getTokenType());

        List<NoteModifier> last = notes.get(2).getModifiers();
        Tuplet tupletStop = (Tuplet) last.get(0);
        Token slurStop = (Token) last.get(1);
        Assertions.assertEquals(StartStop.STOP, tupletStop.getTuplet().getModifier("type"));
        Assertions.assertEquals(tupletStart.getTuplet().getTokenId(), tupletStop.getTuplet().getTokenId());
        Assertions.assertEquals(slurStart.getTokenId(), slurStop.getTokenId());
        // the type of the last note follows from its beam
        Assertions.assertEquals(NoteheadType.BLACK, notes.get(2).getNotehead().getModifier("type"));
    }

    @Test
    public void accidentalsAndFermata() throws Exception {
        Measure measure = translate("notations.xml").getMeasures().get(0);
        Note note = onlyNote(measure.getElements().get(4));
        Assertions.assertEquals(new StaffPosition(1, 4), note.getPosition());
        Assertions.assertEquals(1, note.getAccidentals().size());
        Assertions.assertEquals(AccidentalType.NATURAL, note.getAccidentals().get(0).getModifier("type"));
        Assertions.assertEquals(TokenType.FERMATA, ((Token) note.getModifiers().get(0)).getTokenType());
    }

    @Test
    public void translationIsRepeatable() throws Exception {
        Score first = translate("notations.xml");
        translator.reset();
        Score second = translate("notations.xml");
        Assertions.assertTrue(first.compare(second));
        second.compareRaise(first);
    }

    @Test
    public void unsupportedClef() {
        Assertions.assertThrows(UnsupportedElementException.class, () -> translate("tab_clef.xml"));
    }

    @Test
    public void onlyPartwiseScores() throws Exception {
        Element timewise = parse("<score-timewise version=\"4.0\"/>");
        Assertions.assertThrows(UnsupportedElementException.class,
                () -> translator.translate(timewise, "timewise", Collections.emptySet()));
    }

    @Test
    public void chordWithoutNote() throws Exception {
        Element score = parse("<score-partwise><part id=\"P1\"><measure number=\"1\">"
                + "<attributes><divisions>1</divisions></attributes>"
                + "<note><chord/><pitch><step>C</step><octave>4</octave></pitch><duration>1</duration>"
                + "<type>quarter</type></note>"
                + "</measure></part></score-partwise>");
        Assertions.assertThrows(MalformedInputException.class,
                () -> translator.translate(score, "broken", Collections.emptySet()));
    }

    @Test
    public void measureWithoutNumber() throws Exception {
        Element score = parse("<score-partwise><part id=\"P1\"><measure/></part></score-partwise>");
        Assertions.assertThrows(MalformedInputException.class,
                () -> translator.translate(score, "broken", Collections.emptySet()));
    }

    private Score translateInline(String measureContent) throws Exception {
        Element score = parse("<score-partwise><part id=\"P1\"><measure number=\"1\">" + measureContent
                + "</measure></part></score-partwise>");
        return translator.translate(score, "inline", Collections.emptySet());
    }

    private static List<NoteGroup> noteGroups(Measure measure) {
        List<NoteGroup> output = new ArrayList<>();
        for (TopLevel element : measure.getElements()) {
            if (element instanceof NoteGroup)
                output.add((NoteGroup) element);
        }
        return output;
    }

    @Test
    public void tupletWithoutActualNumber() {
        Assertions.assertThrows(MalformedInputException.class, () -> translateInline(
                "<attributes><divisions>1</divisions></attributes>"
                + "<note><pitch><step>C</step><octave>4</octave></pitch><duration>1</duration><type>quarter</type>"
                + "<notations><tuplet type=\"start\" show-number=\"actual\"/></notations></note>"));
    }

    @Test
    public void timeModificationWithoutNormalNotes() {
        Assertions.assertThrows(MalformedInputException.class, () -> translateInline(
                "<attributes><divisions>1</divisions></attributes>"
                + "<note><pitch><step>C</step><octave>4</octave></pitch><duration>1</duration><type>quarter</type>"
                + "<time-modification><actual-notes>3</actual-notes><normal-notes>0</normal-notes>"
                + "</time-modification></note>"));
    }

    @Test
    public void quarterNoteWithoutType() throws Exception {
        Measure measure = translate("quarter_note.xml").getMeasures().get(0);
        List<NoteGroup> groups = noteGroups(measure);
        Assertions.assertEquals(1, groups.size());

        NoteGroup group = groups.get(0);
        Assertions.assertEquals(0, group.getDelta().compareTo(Fraction.ZERO));
        Assertions.assertTrue(group.getAppendages().isEmpty());
        Chord chord = (Chord) group.getChildren().get(0);
        Assertions.assertEquals(0, chord.getDelta().compareTo(Fraction.ZERO));
        Note note = onlyNote(group);
        Assertions.assertEquals(new StaffPosition(1, 0), note.getPosition());
        Assertions.assertEquals(NoteheadType.BLACK, note.getNotehead().getModifier("type"));
        Assertions.assertTrue(note.getDots().isEmpty());
    }

    @Test
    public void clefChangeAppliesAfterBackup() throws Exception {
        Measure measure = translate("clef_change.xml").getMeasures().get(0);
        List<String> placed = new ArrayList<>();
        for (NoteGroup group : noteGroups(measure)) {
            Note note = onlyNote(group);
            placed.add(group.getDelta().intValue() + ":" + note.getPosition().getPosition() + ":"
                    + note.getNotehead().getModifier("type"));
        }
        Collections.sort(placed);
        // the whole note of the second voice starts before the change and stays under the treble clef
        Assertions.assertEquals(Arrays.asList("0:0:" + NoteheadType.BLACK, "0:0:" + NoteheadType.WHITE,
                "1:0:" + NoteheadType.BLACK, "2:12:" + NoteheadType.BLACK, "3:12:" + NoteheadType.BLACK), placed);

        Attributes change = null;
        for (TopLevel element : measure.getElements()) {
            if (element instanceof Attributes && element.getDelta().compareTo(Fraction.getFraction(2, 1)) == 0)
                change = (Attributes) element;
        }
        Assertions.assertNotNull(change);
        Assertions.assertEquals(NamedPitch.F, change.getClef(1).getSign());
        Assertions.assertEquals(new StaffPosition(1, 8), change.getClef(1).getPosition());
        Assertions.assertNotNull(change.getClef(1).getClefToken());
    }

    @Test
    public void notesOnTwoStaves() throws Exception {
        Measure measure = translate("two_staves.xml").getMeasures().get(0);
        Assertions.assertEquals(2, measure.getStaves());

        List<StaffPosition> placed = new ArrayList<>();
        for (NoteGroup group : noteGroups(measure))
            placed.add(onlyNote(group).getPosition());
        Assertions.assertEquals(2, placed.size());
        Assertions.assertTrue(placed.contains(new StaffPosition(1, 7)));
        Assertions.assertTrue(placed.contains(new StaffPosition(2, 5)));

        Attributes attributes = (Attributes) measure.getElements().get(0);
        Assertions.assertEquals(NamedPitch.G, attributes.getClef(1).getSign());
        Assertions.assertEquals(NamedPitch.F, attributes.getClef(2).getSign());
        TimeSignature upper = attributes.getTimesig(1);
        TimeSignature lower = attributes.getTimesig(2);
        Assertions.assertNotNull(lower);
        Assertions.assertNotSame(upper, lower);
        Assertions.assertTrue(upper.compare(lower));
    }

    @Test
    public void noteOnAMissingStaff() {
        Assertions.assertThrows(InvariantViolationException.class, () -> translateInline(
                "<attributes><divisions>1</divisions><staves>2</staves></attributes>"
                + "<note><pitch><step>C</step><octave>4</octave></pitch><duration>1</duration><type>quarter</type>"
                + "<staff>3</staff></note>"));
    }

    @Test
    public void stavesChangeMidMeasure() {
        Assertions.assertThrows(InvariantViolationException.class, () -> translateInline(
                "<attributes><divisions>1</divisions></attributes>"
                + "<note><pitch><step>C</step><octave>4</octave></pitch><duration>1</duration><type>quarter</type>"
                + "</note><attributes><staves>2</staves></attributes>"));
    }

    @Test
    public void invisibleNotesStillTakeTime() throws Exception {
        Measure measure = translate("invisible.xml").getMeasures().get(0);
        List<TopLevel> drawn = new ArrayList<>();
        for (TopLevel element : measure.getElements()) {
            if (!(element instanceof Attributes))
                drawn.add(element);
        }
        Assertions.assertEquals(1, drawn.size());
        Assertions.assertEquals(0, drawn.get(0).getDelta().compareTo(Fraction.getFraction(3, 1)));
        Assertions.assertEquals(new StaffPosition(1, 1), onlyNote(drawn.get(0)).getPosition());
    }

    @Test
    public void graceNotesFormTheirOwnGroup() throws Exception {
        Measure measure = translate("grace.xml").getMeasures().get(0);
        List<NoteGroup> groups = noteGroups(measure);
        Assertions.assertEquals(2, groups.size());

        NoteGroup graces = groups.get(0).getChildren().size() == 2 ? groups.get(0) : groups.get(1);
        NoteGroup main = graces == groups.get(0) ? groups.get(1) : groups.get(0);
        Assertions.assertEquals(2, graces.getChildren().size());
        Assertions.assertEquals(TokenType.BEAM, graces.getAppendages().get(0).getTokenType());
        // grace notes take no time
        Assertions.assertEquals(0, graces.getDelta().compareTo(Fraction.ZERO));
        Assertions.assertEquals(0, main.getDelta().compareTo(Fraction.ZERO));
        for (GroupElement child : graces.getChildren()) {
            Token notehead = ((Chord) child).getNotes().get(0).getNotehead();
            Assertions.assertEquals(true, notehead.getModifier("grace"));
            Assertions.assertEquals(0, ((Chord) child).getDelta().compareTo(Fraction.ZERO));
        }

        Note note = onlyNote(main);
        Assertions.assertEquals(new StaffPosition(1, 7), note.getPosition());
        Assertions.assertNull(note.getNotehead().getModifier("grace"));
    }

    @Test
    public void nestedBeamsAndHooks() throws Exception {
        Measure measure = translate("nested_beams.xml").getMeasures().get(0);
        List<NoteGroup> groups = noteGroups(measure);
        Assertions.assertEquals(1, groups.size());

        NoteGroup outer = groups.get(0);
        List<GroupElement> children = outer.getChildren();
        Assertions.assertEquals(3, children.size());
        NoteGroup sixteenths = (NoteGroup) children.get(0);
        Assertions.assertEquals(2, sixteenths.getChildren().size());
        Assertions.assertTrue(children.get(1) instanceof Chord);
        Assertions.assertEquals(0, ((Chord) children.get(1)).getDelta().compareTo(Fraction.ONE_HALF));
        NoteGroup hook = (NoteGroup) children.get(2);
        Assertions.assertEquals(1, hook.getChildren().size());
        Assertions.assertEquals(0, ((Chord) hook.getChildren().get(0)).getDelta().compareTo(Fraction.ONE));

        Set<Integer> beams = new HashSet<>();
        for (NoteGroup group : Arrays.asList(outer, sixteenths, hook)) {
            Assertions.assertEquals(1, group.getAppendages().size());
            Assertions.assertEquals(TokenType.BEAM, group.getAppendages().get(0).getTokenType());
            beams.add(group.getAppendages().get(0).getTokenId());
        }
        Assertions.assertEquals(3, beams.size());
    }

    @Test
    public void typeFollowsFromTupletDuration() throws Exception {
        Measure measure = translateInline("<attributes><divisions>3</divisions></attributes>"
                + "<note><pitch><step>C</step><octave>4</octave></pitch><duration>1</duration>"
                + "<time-modification><actual-notes>3</actual-notes><normal-notes>2</normal-notes>"
                + "</time-modification></note>").getMeasures().get(0);
        NoteGroup group = noteGroups(measure).get(0);
        Assertions.assertEquals(NoteheadType.BLACK, onlyNote(group).getNotehead().getModifier("type"));
        Assertions.assertEquals(1, group.getAppendages().size());
        Assertions.assertEquals(TokenType.FLAG, group.getAppendages().get(0).getTokenType());
    }

    @Test
    public void typeFollowsFromDottedDuration() throws Exception {
        Measure measure = translateInline("<attributes><divisions>2</divisions></attributes>"
                + "<note><pitch><step>C</step><octave>4</octave></pitch><duration>3</duration><dot/></note>")
                .getMeasures().get(0);
        NoteGroup group = noteGroups(measure).get(0);
        Note note = onlyNote(group);
        Assertions.assertEquals(NoteheadType.BLACK, note.getNotehead().getModifier("type"));
        Assertions.assertEquals(1, note.getDots().size());
        Assertions.assertTrue(group.getAppendages().isEmpty());
    }
}
