package com.scoutintel.transferroom.output;

import java.sql.Types;
import java.util.function.Function;

/**
 * One writable column of an upsert: its name (also used as the named parameter),
 * its JDBC type, and how to read the value off the record.
 *
 * JSON columns are bound as text and cast to JSONB on PostgreSQL.
 */
record ColumnBinding<T>(String column, int sqlType, boolean json, Function<T, Object> accessor) {

    static <T> ColumnBinding<T> of(String column, int sqlType, Function<T, Object> accessor) {
        return new ColumnBinding<>(column, sqlType, false, accessor);
    }

    static <T> ColumnBinding<T> json(String column, Function<T, Object> accessor) {
        return new ColumnBinding<>(column, Types.VARCHAR, true, accessor);
    }
}
