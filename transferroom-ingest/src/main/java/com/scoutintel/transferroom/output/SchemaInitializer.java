package com.scoutintel.transferroom.output;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

/**
 * Creates the ingest tables if they are missing. Every statement in the scripts is
 * IF NOT EXISTS, so running it against an existing database is a no-op.
 */
@Component
@Slf4j
public class SchemaInitializer {

    private final DataSource dataSource;
    private final DatabaseDialect dialect;

    public SchemaInitializer(DataSource dataSource) {
        this.dataSource = dataSource;
        this.dialect = DatabaseDialect.detect(dataSource);
    }

    public void ensureSchema() {
        log.info("Ensuring {} schema exists...", dialect);
        ResourceDatabasePopulator populator =
                new ResourceDatabasePopulator(new ClassPathResource(dialect.schemaScript()));
        populator.execute(dataSource);
        log.info("Schema ready.");
    }
}
