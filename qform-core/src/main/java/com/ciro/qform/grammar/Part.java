package com.ciro.qform.grammar;

import java.util.AbstractList;
import java.util.List;

/**
 * Nodo del árbol de match. Es solo un puntero (arena + índice), así que crearlos es gratis.
 * Los terminales llevan valor; los compuestos llevan hijos y su valor es {@code null}.
 */
public final class Part {

    private final PartArena arena;
    private final int index;

    Part(PartArena arena, int index) {
        this.arena = arena;
        this.index = index;
    }

    public String name() {
        return arena.nameAt(index);
    }

    public String value() {
        return arena.valueAt(index);
    }

    public int size() {
        return arena.childrenAt(index).length;
    }

    public Part child(int i) {
        int[] kids = arena.childrenAt(index);
        if (i < 0 || i >= kids.length) {
            throw new IndexOutOfBoundsException("Part '" + name() + "' has " + kids.length + " children, asked for " + i);
        }
        return new Part(arena, kids[i]);
    }

    public List<Part> children() {
        return new AbstractList<>() {
            @Override public Part get(int i) { return child(i); }
            @Override public int size() { return Part.this.size(); }
        };
    }

    /** Valor del hijo {@code i} si existe, si no {@code fallback}. */
    public String childValue(int i, String fallback) {
        return i < size() ? child(i).value() : fallback;
    }

    public boolean is(String ruleName) {
        return name().equals(ruleName);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Part p && p.arena == arena && p.index == index;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(arena) * 31 + index;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        write(sb);
        return sb.toString();
    }

    private void write(StringBuilder sb) {
        sb.append(name());
        if (value() != null) {
            sb.append('"').append(value().replace("\n", "\\n")).append('"');
        }
        if (size() > 0) {
            sb.append('(');
            for (int i = 0; i < size(); i++) {
                if (i > 0) sb.append(", ");
                child(i).write(sb);
            }
            sb.append(')');
        }
    }
}
