package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.semantics.NoteType;
import net.scoreworks.mtn.semantics.NoteheadType;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.StemDirection;
import net.scoreworks.mtn.semantics.TokenType;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Small hand-built trees for the tests
 */
public final class AstFixtures {
    private static int nextId = 1000;

    private AstFixtures() {}

    public static Token token(TokenType type, Object typeModifier, StaffPosition position) {
        Map<String, Object> modifiers = new HashMap<>();
        if (typeModifier != null)
            modifiers.put("type", typeModifier);
        return new Token(type, modifiers, position, nextId++);
    }

    public static Note note(int staff, int position, NoteType type) {
        return new Note(token(TokenType.NOTEHEAD, NoteheadType.fromNoteType(type), new StaffPosition(staff, position)),
                new ArrayList<>(), new ArrayList<>(), new ArrayList<>());
    }

    public static Chord chord(Fraction delta, StemDirection stem, Note... notes) {
        Token stemToken = stem == null ? null : token(TokenType.STEM, stem, StaffPosition.UNSET);
        List<Note> list = new ArrayList<>();
        Collections.addAll(list, notes);
        return new Chord(delta, stemToken, list);
    }

    public static NoteGroup group(Fraction delta, GroupElement... children) {
        List<GroupElement> list = new ArrayList<>();
        Collections.addAll(list, children);
        return new NoteGroup(delta, list, new ArrayList<>());
    }
}
