/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.ast.NoteGroup;
import net.scoreworks.mtn.ast.Token;
import net.scoreworks.mtn.collection.HashStack;
import net.scoreworks.mtn.exceptions.InvariantViolationException;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.TokenType;

import java.util.Collections;
import java.util.HashMap;

/**
 * Open beam levels, one stack for grace notes and one for the others. Every level is a {@link NoteGroup} nested in
 * the level below it, so the bottom of a stack is the group that ends up in the measure
 */
public class GroupStack {
    private final MusicState state;
    private final SymbolTable symbolTable;
    private final HashStack<Boolean, NoteGroup> stack = new HashStack<>();

    public GroupStack(MusicState state, SymbolTable symbolTable) {
        this.state = state;
        this.symbolTable = symbolTable;
    }

    /**
     * Open a beam level at the current time
     */
    public NoteGroup newLevel(boolean grace) {
        Token beam = new Token(TokenType.BEAM, new HashMap<>(), StaffPosition.UNSET, symbolTable.giveIdentifier());
        NoteGroup group = new NoteGroup(state.getCurrentTime(), Collections.emptyList(),
                Collections.singletonList(beam));
        push(grace, group);
        return group;
    }

    public void push(boolean grace, NoteGroup group) {
        NoteGroup top = stack.getStackTop(grace);
        if (top != null)
            top.getChildren().add(group);
        stack.pushValue(grace, group);
    }

    public NoteGroup pop(boolean grace) {
        NoteGroup group = stack.popValue(grace);
        if (group == null)
            throw new InvariantViolationException(GroupStack.class, "has no open beam level to close");
        return group;
    }

    public NoteGroup top(boolean grace) {
        return stack.getStackTop(grace);
    }

    public NoteGroup bottom(boolean grace) {
        return stack.getStackBottom(grace);
    }

    public int length(boolean grace) {
        return stack.getStackSize(grace);
    }

    public void reset() {
        stack.clear();
    }

    public void resetGrace(boolean grace) {
        stack.clearStack(grace);
    }
}
