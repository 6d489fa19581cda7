/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.ast;

import java.util.List;

/**
 * Measures of all parts, part after part
 */
public class Score implements SyntaxNode {
    private final List<Measure> measures;
    private final String scoreId;

    public Score(List<Measure> measures, String scoreId) {
        this.measures = measures;
        this.scoreId = scoreId;
    }

    public List<Measure> getMeasures() {
        return measures;
    }

    public String getScoreId() {
        return scoreId;
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitScore(this);
    }

    /**
     * Scores with the same measures are equal whatever their id
     */
    @Override
    public boolean compare(SyntaxNode other) {
        return other instanceof Score && NodeComparison.lists(measures, ((Score) other).measures);
    }

    @Override
    public void compareRaise(SyntaxNode other) {
        Score score = NodeComparison.sameKind(Score.class, other);
        NodeComparison.listsRaise("Score", "measures", measures, score.measures);
    }

    @Override
    public String toString() {
        return "Score " + scoreId + " (" + measures.size() + " measures)";
    }
}
