package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.exceptions.InvariantViolationException;
import net.scoreworks.mtn.semantics.ClefType;
import net.scoreworks.mtn.semantics.NamedPitch;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.TokenType;
import org.apache.commons.lang3.math.Fraction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class AttributesTest {

    @Test
    public void emptyAttributesHoldNothing() {
        Attributes attributes = Attributes.makeEmpty(2, Fraction.ZERO, false);
        Assertions.assertTrue(attributes.isEmpty());
        Assertions.assertEquals(2, attributes.getClefs().size());
        Assertions.assertNull(attributes.getClef(2));
        Assertions.assertNull(attributes.getFirstTimeSignature());
    }

    @Test
    public void defaultsAreFilledIn() {
        Attributes attributes = Attributes.makeEmpty(2, Fraction.ZERO, true);
        Assertions.assertFalse(attributes.isEmpty());
        Assertions.assertEquals(NamedPitch.G, attributes.getClef(2).getSign());
        Assertions.assertEquals(Fraction.getFraction(4, 1), attributes.getFirstTimeSignature().getTimeValue());
    }

    @Test
    public void mergeKeepsWhatIsNotChanged() {
        Attributes base = Attributes.makeEmpty(2, Fraction.ZERO, true);
        Attributes change = Attributes.makeEmpty(2, Fraction.ONE, false);
        Clef bass = new Clef(AstFixtures.token(TokenType.CLEF, ClefType.F, new StaffPosition(2, 6)), NamedPitch.F, 3,
                new StaffPosition(2, 6));
        change.setClef(2, bass);

        base.merge(change);
        Assertions.assertSame(bass, base.getClef(2));
        Assertions.assertEquals(NamedPitch.G, base.getClef(1).getSign());
        Assertions.assertNotNull(base.getKey(1));
        Assertions.assertEquals(0, base.getDelta().compareTo(Fraction.ONE));
    }

    @Test
    public void copyDoesNotShareMaps() {
        Attributes base = Attributes.makeEmpty(1, Fraction.ZERO, true);
        Attributes copy = base.copy();
        copy.setClef(1, null);
        Assertions.assertNotNull(base.getClef(1));
    }

    @Test
    public void staffCountMustAgree() {
        Attributes one = Attributes.makeEmpty(1, Fraction.ZERO, true);
        Attributes two = Attributes.makeEmpty(2, Fraction.ZERO, true);
        Assertions.assertThrows(InvariantViolationException.class, () -> one.merge(two));
        Assertions.assertThrows(InvariantViolationException.class, () -> one.getClef(2));
    }

    @Test
    public void stavesCanGrowAndShrink() {
        Attributes attributes = Attributes.makeEmpty(1, Fraction.ZERO, true);
        attributes.changeStaves(3, true);
        Assertions.assertEquals(3, attributes.getNstaves());
        Assertions.assertNotNull(attributes.getClef(3));
        attributes.changeStaves(1, true);
        Assertions.assertEquals(1, attributes.getKeys().size());
    }
}
