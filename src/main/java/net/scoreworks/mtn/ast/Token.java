/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.TokenType;
import net.scoreworks.mtn.semantics.Vocabulary;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A single symbol of the score. Tokens that belong together (both ends of a slur, all levels of a beam) share the
 * same identifier
 */
public class Token implements NoteModifier, TimesigElement, NumeratorElement {
    private final TokenType tokenType;
    /** further properties like {@code "type" -> sharp}. Values are vocabulary constants, booleans or integers */
    private final Map<String, Object> modifiers;
    private StaffPosition position;
    private final int tokenId;

    public Token(TokenType tokenType, Map<String, Object> modifiers, StaffPosition position, int tokenId) {
        this.tokenType = tokenType;
        this.modifiers = new LinkedHashMap<>(modifiers);
        this.position = position;
        this.tokenId = tokenId;
    }

    public TokenType getTokenType() {
        return tokenType;
    }

    public Map<String, Object> getModifiers() {
        return modifiers;
    }

    public Object getModifier(String name) {
        return modifiers.get(name);
    }

    public StaffPosition getPosition() {
        return position;
    }

    public void setPosition(StaffPosition position) {
        this.position = position;
    }

    public int getTokenId() {
        return tokenId;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitToken(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Token))
            return false;
        Token token = (Token) other;
        return tokenType == token.tokenType
                && Objects.equals(position, token.position)
                && modifiers.equals(token.modifiers);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Token token = NodeComparison.sameKind(Token.class, other);
        NodeComparison.fieldRaise("Token", "type", tokenType, token.tokenType);
        NodeComparison.fieldRaise("Token " + tokenType.getValue(), "position", position, token.position);
        NodeComparison.fieldRaise("Token " + tokenType.getValue(), "modifiers", modifiers, token.modifiers);
    }

    /**
     * Type followed by the modifiers in key order, like {@code accidental_sharp}. Modifiers without a textual value
     * are written by their key
     */
    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder(tokenType.getValue());
        for (Map.Entry<String, Object> entry : new TreeMap<>(modifiers).entrySet()) {
            builder.append('_');
            if (entry.getValue() instanceof Vocabulary)
                builder.append(((Vocabulary) entry.getValue()).getValue());
            else
                builder.append(entry.getKey());
        }
        return builder.toString();
    }
}
