/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

/**
 * Diatonic steps, numbered from C upwards
 */
public enum NamedPitch {
    C, D, E, F, G, A, B;

    public int getStep() {
        return ordinal();
    }

    public static NamedPitch fromStep(int step) {
        return values()[Math.floorMod(step, 7)];
    }
}
