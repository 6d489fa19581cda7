/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import java.util.Objects;

/**
 * A measure within a score, identified by its part and its number
 */
public final class MeasureId {
    private final String partId;
    private final String measureId;

    public MeasureId(String partId, String measureId) {
        this.partId = partId;
        this.measureId = measureId;
    }

    public String getPartId() {
        return partId;
    }

    public String getMeasureId() {
        return measureId;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof MeasureId)) {
            return false;
        }
        MeasureId other = (MeasureId) o;
        return Objects.equals(partId, other.partId) && Objects.equals(measureId, other.measureId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(partId, measureId);
    }

    @Override
    public String toString() {
        return "(" + partId + ", " + measureId + ")";
    }
}
