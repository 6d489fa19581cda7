/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.collection.HashStack;
import net.scoreworks.mtn.semantics.StaffPosition;
import net.scoreworks.mtn.semantics.TokenType;
import org.apache.commons.collections4.keyvalue.MultiKey;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out token identifiers. Symbols that are written as two separate markers (start and stop of a slur, a tie or
 * a tuplet) are matched up by a key, so that both markers get the same identifier in whatever order they show up.
 * Each key holds at most one open marker: the first call opens it, the second one closes it
 */
public class SymbolTable {
    private final HashStack<MultiKey<Boolean>, Integer> beamStacks = new HashStack<>();
    /** open arpeggios by (time, number) */
    private final Map<MultiKey<Object>, Integer> arpeggios = new HashMap<>();
    /** open slurs, tuplets, wedges and the like by (token type, number) */
    private final Map<MultiKey<Object>, Integer> pointToPoint = new HashMap<>();
    /** open ties by (position of the note, number) */
    private final Map<MultiKey<Object>, Integer> ties = new HashMap<>();
    private int nextId = 1;

    /**
     * Arpeggios never span measures
     */
    public void newMeasure() {
        arpeggios.clear();
    }

    /**
     * Forget every open symbol and start counting identifiers from 1 again
     */
    public void reset() {
        beamStacks.clear();
        arpeggios.clear();
        pointToPoint.clear();
        ties.clear();
        nextId = 1;
    }

    /**
     * Identifiers of the beam levels of a stem. Levels that continue keep their identifier, levels that are added get
     * a new one and levels that are gone are dropped
     * @param beams number of beams on the stem, not counting hooks
     */
    public List<Integer> identifyBeams(boolean cue, boolean grace, int beams) {
        MultiKey<Boolean> key = new MultiKey<>(cue, grace);
        while (beamStacks.getStackSize(key) < beams)
            beamStacks.pushValue(key, giveIdentifier());
        while (beamStacks.getStackSize(key) > beams)
            beamStacks.popValue(key);
        ArrayList<Integer> stack = beamStacks.get(key);
        return stack == null ? new ArrayList<>() : new ArrayList<>(stack);
    }

    /**
     * All notes of an arpeggiated chord get the same identifier
     */
    public int identifyArpeggios(Fraction delta, Integer number) {
        return arpeggios.computeIfAbsent(new MultiKey<>(delta.reduce(), number), k -> giveIdentifier());
    }

    public int identifyPointToPoint(TokenType type, Integer number) {
        return giveOrConsume(pointToPoint, new MultiKey<>(type, number));
    }

    /**
     * Ties only join notes of the same pitch, so they are matched by the position of the note
     */
    public int identifyTie(StaffPosition pitch, Integer number) {
        return giveOrConsume(ties, new MultiKey<>(pitch, number));
    }

    /**
     * @return a new identifier that is not registered anywhere
     */
    public int giveIdentifier() {
        return nextId++;
    }

    public boolean hasOpenSymbols() {
        return !pointToPoint.isEmpty() || !ties.isEmpty();
    }

    //=====PRIVATE METHODS==============================================================================================

    private int giveOrConsume(Map<MultiKey<Object>, Integer> table, MultiKey<Object> key) {
        Integer open = table.remove(key);
        if (open != null)
            return open;
        int identifier = giveIdentifier();
        table.put(key, identifier);
        return identifier;
    }
}
