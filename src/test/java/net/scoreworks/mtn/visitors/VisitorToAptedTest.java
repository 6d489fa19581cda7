package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.Clef;
import net.scoreworks.mtn.ast.Score;
import net.scoreworks.mtn.ast.Token;
import net.scoreworks.mtn.semantics.NoteheadType;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.TokenType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

public class VisitorToAptedTest {

    @Test
    public void measureInBracketNotation() throws Exception {
        Score score = TranslatedScores.translate("single_note.xml");
        String expected = "{measure"
                + "{attributes{clef{clef_G}}"
                + "{time_signature{fraction{numerator{number{number_4}}}{denominator{number{number_4}}}}}}"
                + "{group{chord{note{notehead_white}}}}"
                + "{barline{barline_tok_regular}}}";
        VisitorToApted visitor = new VisitorToApted();
        Assertions.assertEquals(expected, visitor.visitMeasure(score.getMeasures().get(0)));
        Assertions.assertEquals("(P1, 1): " + expected, visitor.visitScore(score));
    }

    @Test
    public void oneLinePerMeasure() throws Exception {
        String text = new VisitorToApted().visitScore(TranslatedScores.translate("two_measures.xml"));
        String[] lines = text.split("\n");
        Assertions.assertEquals(2, lines.length);
        Assertions.assertTrue(lines[0].startsWith("(P1, 1): {measure{attributes{key{accidental_sharp}"));
        Assertions.assertTrue(lines[1].startsWith("(P1, 2): {measure{barline{barline_tok_regular}}"));
    }

    @Test
    public void modifiersInOrderOfTheirNames() {
        Map<String, Object> modifiers = new LinkedHashMap<>();
        modifiers.put("type", NoteheadType.BLACK);
        modifiers.put("grace", true);
        Token notehead = new Token(TokenType.NOTEHEAD, modifiers, new StaffPosition(1, 3), 1);
        Assertions.assertEquals("{notehead_grace_black}", new VisitorToApted().visitToken(notehead));
    }

    @Test
    public void hiddenClef() {
        Assertions.assertEquals("", new VisitorToApted().visitClef(Clef.defaultClef(1)));
    }
}
