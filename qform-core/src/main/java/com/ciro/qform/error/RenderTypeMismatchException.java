package com.ciro.qform.error;

public class RenderTypeMismatchException extends QFormException {

    public RenderTypeMismatchException(String dialect, Class<?> expected, Object actual) {
        super(dialect + " error: expected a model of type " + expected.getName() + " but got "
                + (actual == null ? "null" : actual.getClass().getName()));
    }
}
