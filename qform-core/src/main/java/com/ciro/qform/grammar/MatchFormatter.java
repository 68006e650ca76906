package com.ciro.qform.grammar;

import java.util.regex.MatchResult;

/**
 * Deriva el valor de un terminal a partir de los grupos capturados por su regex.
 */
@FunctionalInterface
public interface MatchFormatter {

    String format(MatchResult match);

    static MatchFormatter group(int group) {
        return m -> m.group(group);
    }
}
