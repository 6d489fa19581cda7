package net.scoreworks.mtn.visitors;

import net.scoreworks.mtn.ast.Score;
import net.scoreworks.mtn.ast.Token;
import net.scoreworks.mtn.semantics.TokenType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class VisitorGetTokensTest {

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> output = new ArrayList<>();
        for (Token token : tokens)
            output.add(token.getTokenType());
        return output;
    }

    @Test
    public void tokensInScoreOrder() throws Exception {
        Score score = TranslatedScores.translate("single_note.xml");
        List<Token> tokens = new VisitorGetTokens().visitScore(score);
        Assertions.assertEquals(Arrays.asList(TokenType.CLEF, TokenType.NUMBER, TokenType.NUMBER, TokenType.NOTEHEAD,
                TokenType.BARLINE), types(tokens));
    }

    @Test
    public void beamsFollowTheNotes() throws Exception {
        Score score = TranslatedScores.translate("two_measures.xml");
        List<TokenType> types = types(new VisitorGetTokens().visitScore(score));
        int beam = types.indexOf(TokenType.BEAM);
        Assertions.assertEquals(Arrays.asList(TokenType.STEM, TokenType.NOTEHEAD, TokenType.STEM, TokenType.NOTEHEAD,
                TokenType.BEAM), types.subList(beam - 4, beam + 1));
    }
}
