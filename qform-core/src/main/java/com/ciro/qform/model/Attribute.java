package com.ciro.qform.model;

import java.util.Objects;

/** Par nombre/valor. Un atributo "desnudo" ({@code - required}) vale su propio nombre. */
public record Attribute(String name, String value) {

    public Attribute {
        Objects.requireNonNull(name, "name must not be null");
        if (value == null) value = name;
    }

    public static Attribute flag(String name) {
        return new Attribute(name, name);
    }
}
