package com.ciro.qform.grammar;

import java.util.ArrayList;
import java.util.List;

/**
 * Almacén de nodos de un único parse. Los hijos se referencian por índice,
 * y un {@link #rollback(int)} descarta lo construido por una alternativa fallida.
 */
public final class PartArena {

    static final int[] NO_CHILDREN = new int[0];

    private final List<String> names = new ArrayList<>();
    private final List<String> values = new ArrayList<>();
    private final List<int[]> children = new ArrayList<>();

    int add(String name, String value, int[] childIndexes) {
        names.add(name);
        values.add(value);
        children.add(childIndexes);
        return names.size() - 1;
    }

    int mark() {
        return names.size();
    }

    void rollback(int mark) {
        for (int i = names.size() - 1; i >= mark; i--) {
            names.remove(i);
            values.remove(i);
            children.remove(i);
        }
    }

    public int size() {
        return names.size();
    }

    public Part part(int index) {
        if (index < 0 || index >= names.size()) {
            throw new IndexOutOfBoundsException("No part at index " + index + " (size " + names.size() + ")");
        }
        return new Part(this, index);
    }

    String nameAt(int index) { return names.get(index); }

    String valueAt(int index) { return values.get(index); }

    int[] childrenAt(int index) { return children.get(index); }
}
