/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import org.apache.commons.lang3.math.Fraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Contents of one measure of one part. Barlines at the very start and end are kept apart from the elements
 */
public class Measure implements SyntaxNode {
    private final List<TopLevel> elements;
    private Barline leftBarline;
    private Barline rightBarline;
    private final int staves;
    private String measureId;
    private String partId;
    /** length in quarter notes */
    private final Fraction duration;

    public Measure(List<TopLevel> elements, Barline leftBarline, Barline rightBarline, int staves, String measureId,
                   String partId, Fraction duration) {
        this.elements = new ArrayList<>(elements);
        this.leftBarline = leftBarline;
        this.rightBarline = rightBarline;
        this.staves = staves;
        this.measureId = measureId;
        this.partId = partId;
        this.duration = duration;
        sort();
    }

    /**
     * Put the elements in canonical order. Sorting is stable, so equal elements keep their order
     */
    public void sort() {
        Collections.sort(elements);
    }

    /**
     * @return the elements in canonical order, read only. Use {@link #setElements} to change them
     */
    public List<TopLevel> getElements() {
        return Collections.unmodifiableList(elements);
    }

    /**
     * Replace the elements and sort them
     */
    public void setElements(List<TopLevel> elements) {
        this.elements.clear();
        this.elements.addAll(elements);
        sort();
    }

    public Barline getLeftBarline() {
        return leftBarline;
    }

    public void setLeftBarline(Barline leftBarline) {
        this.leftBarline = leftBarline;
    }

    public Barline getRightBarline() {
        return rightBarline;
    }

    public void setRightBarline(Barline rightBarline) {
        this.rightBarline = rightBarline;
    }

    public int getStaves() {
        return staves;
    }

    public String getMeasureId() {
        return measureId;
    }

    public void setMeasureId(String measureId) {
        this.measureId = measureId;
    }

    public String getPartId() {
        return partId;
    }

    public void setPartId(String partId) {
        this.partId = partId;
    }

    public Fraction getDuration() {
        return duration;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitMeasure(this);
    }

    @Override
    public boolean compare(SyntaxNode other) {
        if (!(other instanceof Measure))
            return false;
        Measure measure = (Measure) other;
        return Objects.equals(measureId, measure.measureId)
                && Objects.equals(partId, measure.partId)
                && staves == measure.staves
                && NodeComparison.lists(elements, measure.elements)
                && NodeComparison.maybe(leftBarline, measure.leftBarline)
                && NodeComparison.maybe(rightBarline, measure.rightBarline);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Measure measure = NodeComparison.sameKind(Measure.class, other);
        NodeComparison.listsRaise("Measure", "elements", elements, measure.elements);
        NodeComparison.maybeRaise("Measure", "left barline", leftBarline, measure.leftBarline);
        NodeComparison.maybeRaise("Measure", "right barline", rightBarline, measure.rightBarline);
        NodeComparison.fieldRaise("Measure", "measure id", measureId, measure.measureId);
        NodeComparison.fieldRaise("Measure", "part id", partId, measure.partId);
        NodeComparison.fieldRaise("Measure", "staves", staves, measure.staves);
    }

    @Override
    public String toString() {
        return "Measure " + partId + "/" + measureId + " (" + elements.size() + " elements)";
    }
}
