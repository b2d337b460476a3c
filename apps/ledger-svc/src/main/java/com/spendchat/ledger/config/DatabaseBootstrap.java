package com.spendchat.ledger.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Applies {@code db/bootstrap/schema.sql} when the {@code expenses} table is missing and
 * {@code spendchat.db.bootstrap-enabled=true}. Every statement in the script is idempotent.
 */
@Component
public class DatabaseBootstrap {
    private static final Logger log = LoggerFactory.getLogger(DatabaseBootstrap.class);
    static final String SCHEMA_RESOURCE = "db/bootstrap/schema.sql";

    private final DataSource dataSource;
    private final boolean enabled;

    public DatabaseBootstrap(DataSource dataSource,
                             @Value("${spendchat.db.bootstrap-enabled:false}") boolean enabled) {
        this.dataSource = dataSource;
        this.enabled = enabled;
    }

    @PostConstruct
    void maybeBootstrap() {
        if (!enabled) {
            log.info("DB bootstrap disabled (spendchat.db.bootstrap-enabled=false)");
            return;
        }
        try {
            int applied = bootstrap();
            if (applied > 0) {
                log.info("DB bootstrap completed: {} statements applied", applied);
            }
        } catch (SQLException | IOException e) {
            // startup continues; operators inspect the log
            log.error("DB bootstrap failed (application will continue to start)", e);
        }
    }

    /**
     * @return number of statements executed, 0 when the schema already exists
     */
    int bootstrap() throws SQLException, IOException {
        try (Connection conn = dataSource.getConnection()) {
            if (expensesTableExists(conn)) {
                log.info("DB bootstrap skipped: schema already present (expenses table exists)");
                return 0;
            }
            log.warn("DB bootstrap starting: applying expense schema");
            int applied = 0;
            for (String stmt : splitStatements(loadSchemaSql())) {
                String trimmed = stmt.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                try (Statement s = conn.createStatement()) {
                    s.execute(trimmed);
                    applied++;
                } catch (SQLException ex) {
                    log.error("Failed executing bootstrap statement: {}", trimmed, ex);
                    throw ex;
                }
            }
            return applied;
        }
    }

    private boolean expensesTableExists(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement(
                "select 1 from information_schema.tables where lower(table_name) = 'expenses' and lower(table_schema) = 'public'")) {
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.warn("Could not check for existing tables: {}", e.getMessage());
            return false;
        }
    }

    private String loadSchemaSql() throws IOException {
        ClassPathResource res = new ClassPathResource(SCHEMA_RESOURCE);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(res.getInputStream(), StandardCharsets.UTF_8))) {
            return br.lines()
                    .filter(line -> !line.trim().startsWith("--"))
                    .collect(Collectors.joining("\n"));
        }
    }

    private List<String> splitStatements(String sql) {
        // schema.sql has no procedural blocks, a plain split is enough
        return Arrays.asList(sql.split(";"));
    }
}
