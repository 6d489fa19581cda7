/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.mtn.translation;

import net.scoreworks.mtn.ast.Score;

import java.util.Set;

/**
 * Converts a score from some source representation into the music tree. Implementations are stateful while a score
 * is translated and have to be reset (or thrown away) before reuse
 * @param <S> source representation
 */
public interface Translator<S> {

    /**
     * @param source root of the score to translate
     * @param scoreId identifier of the resulting score
     * @param firstLine measures that begin a system and therefore repeat clef and key
     */
    Score translate(S source, String scoreId, Set<MeasureId> firstLine);

    /**
     * Drop all state left over from previous translations
     */
    void reset();
}
