/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

import java.util.Objects;

/**
 * A diatonic pitch. Alterations are carried along but play no role in where the note is drawn
 */
public final class NotePitch {
    private final NamedPitch step;
    private final int octave;
    private final int alter;

    public NotePitch(NamedPitch step, int octave) {
        this(step, octave, 0);
    }

    public NotePitch(NamedPitch step, int octave, int alter) {
        this.step = step;
        this.octave = octave;
        this.alter = alter;
    }

    public NamedPitch getStep() {
        return step;
    }

    public int getOctave() {
        return octave;
    }

    public int getAlter() {
        return alter;
    }

    /**
     * Number of diatonic steps above C0
     */
    public int getAbsoluteStep() {
        return step.getStep() + 7 * octave;
    }

    /**
     * Project the pitch onto a staff whose reference position carries the given pitch, as a clef does
     * @param sign pitch the reference position stands for
     * @param signOctave octave of that pitch
     * @param referencePosition staff position of the reference
     */
    public int projectOnto(NamedPitch sign, int signOctave, int referencePosition) {
        int offset = signOctave * 7 + sign.getStep() - referencePosition;
        return getAbsoluteStep() - offset;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof NotePitch)) {
            return false;
        }
        NotePitch other = (NotePitch) o;
        return step == other.step && octave == other.octave && alter == other.alter;
    }

    @Override
    public int hashCode() {
        return Objects.hash(step, octave, alter);
    }

    @Override
    public String toString() {
        return step.name() + octave + (alter > 0 ? "#".repeat(alter) : "b".repeat(-alter));
    }
}
