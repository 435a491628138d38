package com.scoutintel.transferroom.output;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a single-statement, last-write-wins upsert keyed on one natural-key column.
 *
 * PostgreSQL: INSERT ... ON CONFLICT (key) DO UPDATE SET col = EXCLUDED.col.
 * H2:         MERGE INTO ... KEY (key) VALUES (...).
 *
 * The touch columns (updated_at, last_synced_at) are set to CURRENT_TIMESTAMP on both
 * insert and update.
 */
final class UpsertStatement<T> {

    private final String sql;
    private final List<ColumnBinding<T>> columns;

    private UpsertStatement(String sql, List<ColumnBinding<T>> columns) {
        this.sql = sql;
        this.columns = columns;
    }

    static <T> UpsertStatement<T> build(DatabaseDialect dialect,
                                        String table,
                                        String keyColumn,
                                        List<ColumnBinding<T>> columns,
                                        List<String> touchColumns) {
        List<String> names = Stream.concat(
                        columns.stream().map(ColumnBinding::column),
                        touchColumns.stream())
                .toList();

        String values = Stream.concat(
                        columns.stream().map(c -> placeholder(dialect, c)),
                        touchColumns.stream().map(c -> "CURRENT_TIMESTAMP"))
                .collect(Collectors.joining(", "));

        String sql = switch (dialect) {
            case POSTGRESQL -> {
                String updates = names.stream()
                        .filter(name -> !name.equals(keyColumn))
                        .map(name -> touchColumns.contains(name)
                                ? name + " = CURRENT_TIMESTAMP"
                                : name + " = EXCLUDED." + name)
                        .collect(Collectors.joining(",\n    "));
                yield "INSERT INTO " + table + " (" + String.join(", ", names) + ")\n"
                        + "VALUES (" + values + ")\n"
                        + "ON CONFLICT (" + keyColumn + ") DO UPDATE SET\n    " + updates;
            }
            case H2 -> "MERGE INTO " + table + " (" + String.join(", ", names) + ")\n"
                    + "KEY (" + keyColumn + ")\n"
                    + "VALUES (" + values + ")";
        };
        return new UpsertStatement<>(sql, columns);
    }

    String sql() {
        return sql;
    }

    MapSqlParameterSource parameters(T record) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        for (ColumnBinding<T> column : columns) {
            params.addValue(column.column(), column.accessor().apply(record), column.sqlType());
        }
        return params;
    }

    private static String placeholder(DatabaseDialect dialect, ColumnBinding<?> column) {
        String param = ":" + column.column();
        return column.json() && dialect == DatabaseDialect.POSTGRESQL
                ? "CAST(" + param + " AS JSONB)"
                : param;
    }
}
