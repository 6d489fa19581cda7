/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.semantics;

import org.jetbrains.annotations.NotNull;

import java.util.Comparator;
import java.util.Objects;

/**
 * Vertical location of a glyph: the staff it belongs to (counted from 1) and the line or space on that staff. Every
 * line and space is one step, 2 is the bottom line, 3 the space above it and 0 the first ledger line below the staff.
 * Either part may be unset, which means the glyph is not bound to it
 */
public final class StaffPosition implements Comparable<StaffPosition> {
    public static final StaffPosition UNSET = new StaffPosition(null, null);

    private static final Comparator<Integer> UNSET_LAST = Comparator.nullsLast(Comparator.naturalOrder());

    private final Integer staff;
    private final Integer position;

    public StaffPosition(Integer staff, Integer position) {
        this.staff = staff;
        this.position = position;
    }

    public Integer getStaff() {
        return staff;
    }

    public Integer getPosition() {
        return position;
    }

    public boolean isUnset() {
        return staff == null && position == null;
    }

    /**
     * Wildcard comparison: an unset field on either side matches any value
     */
    public boolean matches(StaffPosition other) {
        return (staff == null || other.staff == null || staff.equals(other.staff))
                && (position == null || other.position == null || position.equals(other.position));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof StaffPosition)) {
            return false;
        }
        StaffPosition other = (StaffPosition) o;
        return Objects.equals(staff, other.staff) && Objects.equals(position, other.position);
    }

    @Override
    public int hashCode() {
        return Objects.hash(staff, position);
    }

    @Override
    public int compareTo(@NotNull StaffPosition other) {
        int byStaff = UNSET_LAST.compare(staff, other.staff);
        if (byStaff != 0)
            return byStaff;
        return UNSET_LAST.compare(position, other.position);
    }

    @Override
    public String toString() {
        return "s:" + (staff == null ? "ANY" : staff.toString())
                + "/p:" + (position == null ? "ANY" : String.format("%02d", position));
    }
}
