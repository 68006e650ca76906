package com.ciro.qform.error;

import java.util.List;

/**
 * La regla raíz encajó pero dejó texto sin consumir. El offset apunta al primer carácter sobrante.
 */
public class TrailingInputException extends ParseFailureException {

    public TrailingInputException(String rootRule, int offset, int line, int column, List<String> expected) {
        super(describe("Unexpected input after rule '" + rootRule + "'", offset, line, column, expected),
              rootRule, offset, line, column, expected);
    }
}
