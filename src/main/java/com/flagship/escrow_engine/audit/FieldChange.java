package com.flagship.escrow_engine.audit;

import java.util.Objects;

/**
 * One before/after pair in an audit entry.
 */
public record FieldChange(String field, String before, String after) {

    public static FieldChange of(String field, Object before, Object after) {
        return new FieldChange(field, Objects.toString(before, null), Objects.toString(after, null));
    }
}
