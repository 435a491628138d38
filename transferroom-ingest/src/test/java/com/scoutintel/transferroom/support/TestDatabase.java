package com.scoutintel.transferroom.support;

import com.scoutintel.transferroom.output.SchemaInitializer;
import org.h2.jdbcx.JdbcDataSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import javax.sql.DataSource;
import java.util.UUID;

/**
 * Fresh in-memory H2 database with the ingest schema applied.
 */
public final class TestDatabase {

    private final JdbcDataSource dataSource;
    private final NamedParameterJdbcTemplate jdbc;

    private TestDatabase() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:ingest-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        jdbc = new NamedParameterJdbcTemplate(dataSource);
    }

    public static TestDatabase create() {
        TestDatabase db = new TestDatabase();
        new SchemaInitializer(db.dataSource).ensureSchema();
        return db;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public NamedParameterJdbcTemplate jdbc() {
        return jdbc;
    }

    public DataSourceTransactionManager transactionManager() {
        return new DataSourceTransactionManager(dataSource);
    }

    public int count(String table) {
        Integer count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }
}
