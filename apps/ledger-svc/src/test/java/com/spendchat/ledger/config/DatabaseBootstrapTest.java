package com.spendchat.ledger.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DatabaseBootstrapTest {

    private JdbcDataSource dataSource;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:bootstrap_" + System.nanoTime() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
    }

    @Test
    void appliesSchemaOnceWhenTableIsMissing() throws Exception {
        DatabaseBootstrap bootstrap = new DatabaseBootstrap(dataSource, true);

        assertThat(bootstrap.bootstrap()).isEqualTo(4);
        assertThat(bootstrap.bootstrap()).isZero();

        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement()) {
            st.execute("insert into expenses (description, amount, expense_date, recorded_at) "
                    + "values ('Uber to airport 800', 800.00, DATE '2024-03-15', CURRENT_TIMESTAMP)");
            st.execute("insert into expense_categories (expense_id, category) "
                    + "select id, 'travel' from expenses");
            try (ResultSet rs = st.executeQuery("select count(*) from expense_categories where category = 'travel'")) {
                assertThat(rs.next()).isTrue();
                assertThat(rs.getInt(1)).isEqualTo(1);
            }
        }
    }

    @Test
    void disabledBootstrapLeavesDatabaseUntouched() throws Exception {
        new DatabaseBootstrap(dataSource, false).maybeBootstrap();

        try (Connection conn = dataSource.getConnection(); Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(
                     "select count(*) from information_schema.tables where lower(table_name) = 'expenses'")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getInt(1)).isZero();
        }
    }
}
