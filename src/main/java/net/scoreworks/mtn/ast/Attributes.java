/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import net.scoreworks.mtn.exceptions.InvariantViolationException;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Clef, key and time signature of every staff, valid from {@link #delta} on. Every map holds exactly the staves
 * 1..nstaves; a null entry means the value does not change on that staff
 */
public class Attributes extends TopLevel {
    private int nstaves;
    private final TreeMap<Integer, Key> key;
    private final TreeMap<Integer, Clef> clef;
    private final TreeMap<Integer, TimeSignature> timesig;

    public Attributes(Fraction delta, int nstaves, Map<Integer, Key> key, Map<Integer, Clef> clef,
                      Map<Integer, TimeSignature> timesig) {
        super(delta);
        this.nstaves = nstaves;
        this.key = new TreeMap<>(key);
        this.clef = new TreeMap<>(clef);
        this.timesig = new TreeMap<>(timesig);
        checkStaves(this.key);
        checkStaves(this.clef);
        checkStaves(this.timesig);
    }

    /**
     * Attributes for the given number of staves that change nothing, or that hold the default clef, key and time
     * signature on every staff
     */
    public static Attributes makeEmpty(int nstaves, Fraction delta, boolean initDefault) {
        Attributes output = new Attributes(delta, 0, new TreeMap<>(), new TreeMap<>(), new TreeMap<>());
        output.changeStaves(nstaves, initDefault);
        return output;
    }

    /**
     * Copy that shares the nodes but not the maps
     */
    public Attributes copy() {
        return new Attributes(delta, nstaves, key, clef, timesig);
    }

    /**
     * Fold later attributes into these ones. Values set in the other attributes win, the others are kept
     */
    public Attributes merge(Attributes other) {
        if (nstaves != other.nstaves)
            throw new InvariantViolationException(Attributes.class, "cannot merge " + other.nstaves + " staves into "
                    + nstaves);
        delta = other.delta;
        for (int staff = 1; staff <= nstaves; staff++) {
            key.put(staff, ObjectUtils.firstNonNull(other.key.get(staff), key.get(staff)));
            clef.put(staff, ObjectUtils.firstNonNull(other.clef.get(staff), clef.get(staff)));
            timesig.put(staff, ObjectUtils.firstNonNull(other.timesig.get(staff), timesig.get(staff)));
        }
        return this;
    }

    /**
     * Grow or shrink every map to the given number of staves
     * @param initDefault whether new staves get the default clef, key and time signature
     */
    public void changeStaves(int staves, boolean initDefault) {
        for (int staff = nstaves + 1; staff <= staves; staff++) {
            key.put(staff, initDefault ? Key.defaultKey() : null);
            clef.put(staff, initDefault ? Clef.defaultClef(staff) : null);
            timesig.put(staff, initDefault ? TimeSignature.defaultTimeSignature() : null);
        }
        for (int staff = nstaves; staff > staves; staff--) {
            key.remove(staff);
            clef.remove(staff);
            timesig.remove(staff);
        }
        nstaves = staves;
    }

    public int getNstaves() {
        return nstaves;
    }

    public Clef getClef(int staff) {
        checkStaff(staff);
        return clef.get(staff);
    }

    public void setClef(int staff, Clef value) {
        checkStaff(staff);
        clef.put(staff, value);
    }

    public Key getKey(int staff) {
        checkStaff(staff);
        return key.get(staff);
    }

    public void setKey(int staff, Key value) {
        checkStaff(staff);
        key.put(staff, value);
    }

    public TimeSignature getTimesig(int staff) {
        checkStaff(staff);
        return timesig.get(staff);
    }

    public void setTimesig(int staff, TimeSignature value) {
        checkStaff(staff);
        timesig.put(staff, value);
    }

    /** Per-staff views in staff order. Entries may be null */
    public Map<Integer, Key> getKeys() {
        return key;
    }

    public Map<Integer, Clef> getClefs() {
        return clef;
    }

    public Map<Integer, TimeSignature> getTimesigs() {
        return timesig;
    }

    /**
     * @return the time signature of the lowest staff that has one, or null
     */
    public TimeSignature getFirstTimeSignature() {
        for (TimeSignature signature : timesig.values()) {
            if (signature != null)
                return signature;
        }
        return null;
    }

    public boolean isEmpty() {
        return nonNull(key).isEmpty() && nonNull(clef).isEmpty() && nonNull(timesig).isEmpty();
    }

    @Override
    protected int getPrecedence() {
        return 2;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitAttributes(this);
    }

    /**
     * Only set values take part. Keys without any accidental or natural are all alike
     */
    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Attributes))
            return false;
        Attributes attributes = (Attributes) other;
        if (!compareDelta(attributes) || nstaves != attributes.nstaves)
            return false;
        List<Key> keys = nonNull(key);
        List<Key> otherKeys = nonNull(attributes.key);
        boolean keysMatch = NodeComparison.lists(keys, otherKeys) || allKeysEmpty(keys) && allKeysEmpty(otherKeys);
        return keysMatch
                && NodeComparison.lists(nonNull(clef), nonNull(attributes.clef))
                && NodeComparison.lists(nonNull(timesig), nonNull(attributes.timesig));
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Attributes attributes = NodeComparison.sameKind(Attributes.class, other);
        compareDeltaRaise(attributes);
        NodeComparison.fieldRaise("Attributes", "staves", nstaves, attributes.nstaves);
        List<Key> keys = nonNull(key);
        List<Key> otherKeys = nonNull(attributes.key);
        if (!(allKeysEmpty(keys) && allKeysEmpty(otherKeys)))
            NodeComparison.listsRaise("Attributes", "keys", keys, otherKeys);
        NodeComparison.listsRaise("Attributes", "clefs", nonNull(clef), nonNull(attributes.clef));
        NodeComparison.listsRaise("Attributes", "time signatures", nonNull(timesig), nonNull(attributes.timesig));
    }

    @Override
    public String toString() {
        return "Attributes (Delta " + delta + "):\n\t" + key + "\n\t" + clef + "\n\t" + timesig;
    }

    //=====PRIVATE METHODS==============================================================================================

    private void checkStaff(int staff) {
        if (staff < 1 || staff > nstaves)
            throw new InvariantViolationException(Attributes.class, "has no staff " + staff + " (" + nstaves
                    + " staves)");
    }

    private void checkStaves(TreeMap<Integer, ?> map) {
        if (map.size() != nstaves || !map.isEmpty() && (map.firstKey() != 1 || map.lastKey() != nstaves))
            throw new InvariantViolationException(Attributes.class, "needs entries for staves 1.." + nstaves
                    + " but got " + map.keySet());
    }

    private static <V> List<V> nonNull(Map<Integer, V> map) {
        List<V> output = new ArrayList<>();
        for (V value : map.values()) {
            if (value != null)
                output.add(value);
        }
        return output;
    }

    private static boolean allKeysEmpty(List<Key> keys) {
        for (Key k : keys) {
            if (!k.isEmpty())
                return false;
        }
        return true;
    }
}
