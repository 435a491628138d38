package com.scoutintel.transferroom.output;

import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.util.Locale;

/**
 * SQL flavours the stores can write. PostgreSQL in production, H2 for tests.
 */
@Slf4j
public enum DatabaseDialect {

    POSTGRESQL("postgresql"),
    H2("h2");

    private final String scriptSuffix;

    DatabaseDialect(String scriptSuffix) {
        this.scriptSuffix = scriptSuffix;
    }

    public String schemaScript() {
        return "db/schema-" + scriptSuffix + ".sql";
    }

    public static DatabaseDialect detect(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String url = metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return H2;
            }
            String productName = metaData.getDatabaseProductName();
            if (productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres")) {
                return POSTGRESQL;
            }
            log.warn("Unrecognised database '{}', assuming PostgreSQL syntax", productName);
            return POSTGRESQL;
        } catch (Exception e) {
            throw new IllegalStateException("Unable to detect database product", e);
        }
    }
}
