package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.exceptions.NodeMismatchException;
import net.scoreworks.mtn.semantics.AccidentalType;
import net.scoreworks.mtn.semantics.NoteType;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.StemDirection;
import net.scoreworks.mtn.semantics.TokenType;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;

import static net.scoreworks.mtn.ast.AstFixtures.chord;
import static net.scoreworks.mtn.ast.AstFixtures.group;
import static net.scoreworks.mtn.ast.AstFixtures.note;

public class CompareTest {

    @Test
    public void identifiersAreIgnored() {
        Token a = AstFixtures.token(TokenType.ACCIDENTAL, AccidentalType.SHARP, new StaffPosition(1, 3));
        Token b = AstFixtures.token(TokenType.ACCIDENTAL, AccidentalType.SHARP, new StaffPosition(1, 3));
        Assertions.assertNotEquals(a.getTokenId(), b.getTokenId());
        Assertions.assertTrue(a.compare(b));
        a.compareRaise(b);
    }

    @Test
    public void equalTreesCompareEqual() {
        NoteGroup a = group(Fraction.ZERO, chord(Fraction.ZERO, StemDirection.UP, note(1, 2, NoteType.QUARTER)));
        NoteGroup b = group(Fraction.getFraction(2, 2).subtract(Fraction.ONE),
                chord(Fraction.ZERO, StemDirection.UP, note(1, 2, NoteType.QUARTER)));
        Assertions.assertTrue(a.compare(b));
        a.compareRaise(b);
    }

    @Test
    public void differencesAreNamed() {
        NoteGroup a = group(Fraction.ZERO, chord(Fraction.ZERO, StemDirection.UP, note(1, 2, NoteType.QUARTER)));
        NoteGroup b = group(Fraction.ZERO, chord(Fraction.ZERO, StemDirection.UP, note(1, 3, NoteType.QUARTER)));
        Assertions.assertFalse(a.compare(b));
        NodeMismatchException e = Assertions.assertThrows(NodeMismatchException.class, () -> a.compareRaise(b));
        Assertions.assertTrue(e.getMessage().contains("position"), e.getMessage());
    }

    @Test
    public void differentKindsDoNotMatch() {
        NoteGroup a = group(Fraction.ZERO, chord(Fraction.ZERO, null, note(1, 2, NoteType.QUARTER)));
        Direction b = new Direction(Fraction.ZERO, new ArrayList<>());
        Assertions.assertFalse(a.compare(b));
        Assertions.assertThrows(NodeMismatchException.class, () -> a.compareRaise(b));
    }

    @Test
    public void missingStemIsADifference() {
        Chord a = chord(Fraction.ZERO, null, note(1, 2, NoteType.QUARTER));
        Chord b = chord(Fraction.ZERO, StemDirection.DOWN, note(1, 2, NoteType.QUARTER));
        Assertions.assertFalse(a.compare(b));
        Assertions.assertThrows(NodeMismatchException.class, () -> a.compareRaise(b));
    }
}
