package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.NamedPitch;
import net.scoreworks.mtn.semantics.NotePitch;
import net.scoreworks.mtn.semantics.StaffPosition;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ClefTest {

    @Test
    public void trebleClef() {
        Clef clef = Clef.defaultClef(1);
        Assertions.assertEquals(0, clef.pitch2pos(new NotePitch(NamedPitch.C, 4)));
        Assertions.assertEquals(4, clef.pitch2pos(new NotePitch(NamedPitch.G, 4)));
        Assertions.assertEquals(-1, clef.pitch2pos(new NotePitch(NamedPitch.B, 3)));
        Assertions.assertEquals(7, clef.pitch2pos(new NotePitch(NamedPitch.C, 5)));
    }

    @Test
    public void staffLinesHaveEvenPositions() {
        Clef clef = Clef.defaultClef(1);
        // bottom line to top line, middle C sits on the first ledger line below
        Assertions.assertEquals(2, clef.pitch2pos(new NotePitch(NamedPitch.E, 4)));
        Assertions.assertEquals(10, clef.pitch2pos(new NotePitch(NamedPitch.F, 5)));
        Assertions.assertEquals(0, clef.pitch2pos(new NotePitch(NamedPitch.C, 4)));
        Assertions.assertEquals(new StaffPosition(1, 4), clef.getPosition());
    }

    @Test
    public void bassClef() {
        Clef clef = new Clef(null, NamedPitch.F, 3, new StaffPosition(1, 8));
        Assertions.assertEquals(5, clef.pitch2pos(new NotePitch(NamedPitch.C, 3)));
        Assertions.assertEquals(9, clef.pitch2pos(new NotePitch(NamedPitch.G, 3)));
        Assertions.assertEquals(4, clef.pitch2pos(new NotePitch(NamedPitch.B, 2)));
        Assertions.assertEquals(12, clef.pitch2pos(new NotePitch(NamedPitch.C, 4)));
    }

    @Test
    public void sopranoClef() {
        Clef clef = new Clef(null, NamedPitch.C, 4, new StaffPosition(1, 2));
        Assertions.assertEquals(2, clef.pitch2pos(new NotePitch(NamedPitch.C, 4)));
        Assertions.assertEquals(6, clef.pitch2pos(new NotePitch(NamedPitch.G, 4)));
        Assertions.assertEquals(1, clef.pitch2pos(new NotePitch(NamedPitch.B, 3)));
        Assertions.assertEquals(9, clef.pitch2pos(new NotePitch(NamedPitch.C, 5)));
    }

    @Test
    public void alterationDoesNotMoveTheNote() {
        Clef clef = Clef.defaultClef(1);
        Assertions.assertEquals(clef.pitch2pos(new NotePitch(NamedPitch.F, 4)),
                clef.pitch2pos(new NotePitch(NamedPitch.F, 4, 1)));
    }
}
