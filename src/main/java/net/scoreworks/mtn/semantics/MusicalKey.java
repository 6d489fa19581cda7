/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

import org.apache.commons.collections4.keyvalue.MultiKey;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Placement rules of circle-of-fifths key signatures
 */
public final class MusicalKey {
    private static final int LOWEST_KEY_POSITION = 1;
    private static final int HIGHEST_KEY_POSITION = 11;

    /** Staff positions of key accidentals for the usual clef placements, in the order they are written */
    private static final Map<MultiKey<Object>, int[]> SHARP_POSITIONS = new HashMap<>();
    private static final Map<MultiKey<Object>, int[]> FLAT_POSITIONS = new HashMap<>();

    /** Steps altered by successive fifths: F C G D A E B F C G D A E B */
    private static final int[] MODIFICATION_SEQUENCE = new int[14];

    static {
        SHARP_POSITIONS.put(new MultiKey<>(NamedPitch.G, 4), new int[]{10, 7, 11, 8, 5, 9, 6});
        SHARP_POSITIONS.put(new MultiKey<>(NamedPitch.F, 8), new int[]{8, 5, 9, 6, 3, 7, 4});
        SHARP_POSITIONS.put(new MultiKey<>(NamedPitch.C, 2), new int[]{5, 9, 6, 10, 7, 11, 8});
        SHARP_POSITIONS.put(new MultiKey<>(NamedPitch.C, 6), new int[]{9, 6, 10, 7, 4, 8, 5});
        SHARP_POSITIONS.put(new MultiKey<>(NamedPitch.C, 8), new int[]{4, 8, 5, 9, 6, 10, 7});

        FLAT_POSITIONS.put(new MultiKey<>(NamedPitch.G, 4), new int[]{6, 9, 5, 8, 4, 7, 3});
        FLAT_POSITIONS.put(new MultiKey<>(NamedPitch.F, 8), new int[]{4, 7, 3, 6, 2, 5, 1});
        FLAT_POSITIONS.put(new MultiKey<>(NamedPitch.C, 2), new int[]{7, 10, 6, 9, 5, 8, 4});
        FLAT_POSITIONS.put(new MultiKey<>(NamedPitch.C, 6), new int[]{5, 8, 4, 7, 3, 6, 2});
        FLAT_POSITIONS.put(new MultiKey<>(NamedPitch.C, 8), new int[]{7, 10, 6, 9, 5, 8, 4});

        for (int x = 0; x < MODIFICATION_SEQUENCE.length; x++)
            MODIFICATION_SEQUENCE[x] = (x * 4 + 3) % 7;
    }

    private MusicalKey() {}

    /**
     * Staff positions of the accidentals of a key signature, in writing order
     * @param fifths positive for sharps, negative for flats
     * @param sign pitch the clef stands for
     * @param clefOctave octave of that pitch
     * @param clefPosition staff position the clef sign is anchored to
     */
    public static List<Integer> accidentalPositions(int fifths, NamedPitch sign, int clefOctave, int clefPosition) {
        int count = Math.min(Math.abs(fifths), 7);
        List<Integer> output = new ArrayList<>(count);
        if (count == 0)
            return output;
        Map<MultiKey<Object>, int[]> table = fifths > 0 ? SHARP_POSITIONS : FLAT_POSITIONS;
        int[] known = table.get(new MultiKey<>(sign, clefPosition));
        if (known != null) {
            for (int i = 0; i < count; i++)
                output.add(known[i]);
            return output;
        }
        // sharps go up a fifth from F, flats down a fifth from B
        int step = fifths > 0 ? NamedPitch.F.getStep() : NamedPitch.B.getStep();
        int stride = fifths > 0 ? 4 : 3;
        for (int i = 0; i < count; i++) {
            NotePitch pitch = new NotePitch(NamedPitch.fromStep(step), clefOctave + 1);
            output.add(ensureRange(pitch.projectOnto(sign, clefOctave, clefPosition)));
            step = (step + stride) % 7;
        }
        return output;
    }

    /**
     * Alteration of every diatonic step (indexed by {@link NamedPitch#getStep()}) in a circle-of-fifths key.
     * Unaltered steps are null
     */
    public static AccidentalType[] fifthsAlterations(int fifths) {
        AccidentalType[] output = new AccidentalType[7];
        int origin = 7;
        int target = 7 + Math.max(-7, Math.min(7, fifths));
        if (target < origin) {
            int swap = origin;
            origin = target;
            target = swap;
        }
        AccidentalType alteration = fifths > 0 ? AccidentalType.SHARP : AccidentalType.FLAT;
        for (int step : Arrays.copyOfRange(MODIFICATION_SEQUENCE, origin, target))
            output[step] = alteration;
        return output;
    }

    /**
     * Fold a staff position into the band key accidentals are drawn in, moving it by whole octaves
     */
    public static int ensureRange(int position) {
        if (position > HIGHEST_KEY_POSITION)
            position -= 7 * ceilDiv(position - HIGHEST_KEY_POSITION, 7);
        else if (position < LOWEST_KEY_POSITION)
            position += 7 * ceilDiv(LOWEST_KEY_POSITION - position, 7);
        return position;
    }

    private static int ceilDiv(int dividend, int divisor) {
        return (dividend + divisor - 1) / divisor;
    }
}
