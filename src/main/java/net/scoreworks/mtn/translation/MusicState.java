/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.ast.Attributes;
import net.scoreworks.mtn.ast.TimeSignature;
import net.scoreworks.mtn.exceptions.InvariantViolationException;
import org.apache.commons.lang3.math.Fraction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Time and attributes of the part that is being translated. All attribute changes of the current measure are kept
 * by time, so that moving the clock back and forth (as MusicXML does with backup and forward) always yields the
 * clef, key and time signature in force at that instant
 */
public class MusicState {
    private static final Logger logger = LoggerFactory.getLogger(MusicState.class);

    private int nstaves;
    /** ticks per quarter note of the input durations */
    private int divisions;
    private Fraction currentTime;
    /** time that passes once the chord being read is complete */
    private Fraction timeBuffer;
    /** attributes in force when the measure started */
    private Attributes initialAttributes;
    /** attributes in force at {@link #currentTime} */
    private Attributes currentAttributes;
    /** every attribute change of the measure by time */
    private final TreeMap<Fraction, Attributes> stack = new TreeMap<>();

    public MusicState() {
        reset();
    }

    /**
     * Forget everything and start over with a single staff in default attributes
     */
    public void reset() {
        nstaves = 1;
        divisions = 1;
        currentTime = Fraction.ZERO;
        timeBuffer = Fraction.ZERO;
        initialAttributes = Attributes.makeEmpty(nstaves, currentTime, true);
        currentAttributes = initialAttributes.copy();
        stack.clear();
    }

    /**
     * @return attributes in force at the current time
     */
    public Attributes getAttributes() {
        return currentAttributes;
    }

    /**
     * Record an attribute change at the current time. Several changes at the same time add up
     */
    public void setAttributes(Attributes attributes) {
        Attributes atSameTime = stack.get(currentTime);
        if (atSameTime != null)
            atSameTime.merge(attributes);
        else
            stack.put(currentTime, attributes);
        currentAttributes.merge(attributes);
    }

    /**
     * @return attribute changes of the current measure in time order
     */
    public List<Attributes> getAttributeList() {
        return new ArrayList<>(stack.values());
    }

    public void incrementTime(Fraction increment) {
        moveBuffer();
        changeTime(currentTime.add(increment));
    }

    /**
     * Move the clock. Going back rebuilds the attributes from the start of the measure, going forward applies the
     * changes passed on the way. A change at exactly the target time is in force at that time
     */
    public void changeTime(Fraction time) {
        if (time.compareTo(currentTime) < 0) {
            currentAttributes = initialAttributes.copy();
            for (Attributes change : stack.headMap(time, true).values())
                currentAttributes.merge(change);
        } else {
            for (Attributes change : stack.subMap(currentTime, false, time, true).values())
                currentAttributes.merge(change);
        }
        logger.trace("time {} -> {}", currentTime, time);
        currentTime = time.reduce();
        timeBuffer = Fraction.ZERO;
    }

    public void setBuffer(Fraction buffer) {
        moveBuffer();
        timeBuffer = buffer;
    }

    /**
     * Let the pending time pass
     */
    public void moveBuffer() {
        if (timeBuffer.compareTo(Fraction.ZERO) != 0)
            changeTime(currentTime.add(timeBuffer));
    }

    public void changeStaves(int staves) {
        if (currentTime.compareTo(Fraction.ZERO) != 0 || !stack.isEmpty())
            throw new InvariantViolationException(MusicState.class, "cannot change the number of staves mid-measure");
        initialAttributes.changeStaves(staves, true);
        currentAttributes = initialAttributes.copy();
        nstaves = staves;
    }

    /**
     * Start the next measure with the attributes in force at the end of this one
     */
    public void newMeasure() {
        if (!stack.isEmpty()) {
            changeTime(stack.firstKey());
            changeTime(stack.lastKey());
        }
        initialAttributes = currentAttributes;
        initialAttributes.setDelta(Fraction.ZERO);
        currentAttributes = initialAttributes.copy();
        stack.clear();
        currentTime = Fraction.ZERO;
        timeBuffer = Fraction.ZERO;
    }

    /**
     * Attributes in force at the very start of the measure, including changes made right there
     * @param removeTimesig whether to leave out the time signatures
     */
    public Attributes startAttributes(boolean removeTimesig) {
        Attributes initial = initialAttributes.copy();
        Attributes atStart = stack.get(Fraction.ZERO);
        if (atStart != null)
            initial.merge(atStart);
        if (removeTimesig) {
            for (Map.Entry<Integer, TimeSignature> entry : initial.getTimesigs().entrySet())
                entry.setValue(null);
        }
        return initial;
    }

    /**
     * @return length of a measure under the current time signature, in quarter notes
     */
    public Fraction getDuration() {
        TimeSignature signature = currentAttributes.getFirstTimeSignature();
        if (signature == null)
            throw new InvariantViolationException(MusicState.class, "has no time signature to take the duration from");
        return signature.getTimeValue();
    }

    public int getNstaves() {
        return nstaves;
    }

    public int getDivisions() {
        return divisions;
    }

    public void setDivisions(int divisions) {
        this.divisions = divisions;
    }

    public Fraction getCurrentTime() {
        return currentTime;
    }

    public Fraction getTimeBuffer() {
        return timeBuffer;
    }

    @Override
    public String toString() {
        return "State: " + nstaves + " staves, " + divisions + " divisions, time " + currentTime + " (+" + timeBuffer
                + "), " + stack.size() + " attribute changes";
    }
}
