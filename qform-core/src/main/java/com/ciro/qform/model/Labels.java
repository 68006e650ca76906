package com.ciro.qform.model;

import java.util.Locale;

public final class Labels {

    private Labels() {}

    /**
     * Mayúscula en el primer code point, el resto intacto. "" se queda en "".
     */
    public static String capitalize(String input) {
        if (input == null || input.isEmpty()) return input;
        int first = input.codePointAt(0);
        int width = Character.charCount(first);
        return new String(Character.toChars(first)).toUpperCase(Locale.ROOT) + input.substring(width);
    }
}
