package com.blogsmith.core.state;

/**
 * Thrown when a partial update names a field that is not part of {@link PipelineState#SCHEMA}.
 * This is a programming error, never a data error.
 */
public class UnknownStateFieldException extends IllegalArgumentException {

    private final String field;

    public UnknownStateFieldException(String field) {
        super("Unknown pipeline state field: '" + field + "'");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
