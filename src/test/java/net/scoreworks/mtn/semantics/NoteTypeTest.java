package net.scoreworks.mtn.semantics;

import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class NoteTypeTest {

    @Test
    public void exactDurations() {
        Assertions.assertEquals(NoteType.QUARTER, NoteType.fromDuration(Fraction.ONE_QUARTER));
        Assertions.assertEquals(NoteType.EIGHTH, NoteType.fromDuration(Fraction.getFraction(2, 16)));
        Assertions.assertEquals(NoteType.BREVE, NoteType.fromDuration(Fraction.getFraction(2, 1)));
    }

    @Test
    public void inexactDurationsRoundUp() {
        Assertions.assertEquals(NoteType.QUARTER, NoteType.fromDuration(Fraction.getFraction(3, 16)));
        Assertions.assertEquals(NoteType.HALF, NoteType.fromDuration(Fraction.getFraction(1, 3)));
    }

    @Test
    public void outOfRangeBecomesWhole() {
        Assertions.assertEquals(NoteType.WHOLE, NoteType.fromDuration(Fraction.getFraction(16, 1)));
        Assertions.assertEquals(NoteType.WHOLE, NoteType.fromDuration(Fraction.getFraction(1, 4096)));
    }

    @Test
    public void beams() {
        Assertions.assertEquals(NoteType.QUARTER, NoteType.fromBeams(0));
        Assertions.assertEquals(NoteType.N16TH, NoteType.fromBeams(2));
        Assertions.assertEquals(NoteType.N1024TH, NoteType.fromBeams(8));
        Assertions.assertEquals(1, NoteType.EIGHTH.getBeams());
        Assertions.assertNull(NoteType.HALF.getBeams());
        Assertions.assertThrows(IllegalArgumentException.class, () -> NoteType.fromBeams(9));
    }

    @Test
    public void musicXmlNames() {
        Assertions.assertEquals(NoteType.N16TH, Vocabulary.fromValue(NoteType.class, "16th"));
        Assertions.assertNull(Vocabulary.fromValue(NoteType.class, "sixteenth"));
    }
}
