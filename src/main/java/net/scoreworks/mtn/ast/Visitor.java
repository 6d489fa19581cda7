/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

/**
 * Operation over the music tree with one method per node kind. Implementations choose how (and whether) to descend
 * into children by calling {@link SyntaxNode#accept(Visitor)} on them
 * @param <T> result of visiting a node
 */
public interface Visitor<T> {

    default T visitAst(SyntaxNode root) {
        return root.accept(this);
    }

    T visitScore(Score score);

    T visitMeasure(Measure measure);

    T visitToken(Token token);

    T visitNote(Note note);

    T visitChord(Chord chord);

    T visitRest(Rest rest);

    T visitNoteGroup(NoteGroup noteGroup);

    T visitTuplet(Tuplet tuplet);

    T visitAttributes(Attributes attributes);

    T visitTimeSignature(TimeSignature timeSignature);

    T visitTimesigFraction(TimesigFraction timesigFraction);

    T visitNumerator(Numerator numerator);

    T visitDenominator(Denominator denominator);

    T visitNumeral(Numeral numeral);

    T visitKey(Key key);

    T visitClef(Clef clef);

    T visitDirection(Direction direction);

    T visitBarline(Barline barline);
}
