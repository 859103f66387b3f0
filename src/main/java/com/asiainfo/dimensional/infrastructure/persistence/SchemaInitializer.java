package com.asiainfo.dimensional.infrastructure.persistence;

import com.asiainfo.dimensional.common.config.MetricsConfig;
import com.asiainfo.dimensional.common.exception.StoreUnavailableException;
import io.agroal.api.AgroalDataSource;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 启动时按需建表
 * 只执行 CREATE ... IF NOT EXISTS，不做迁移
 */
@ApplicationScoped
public class SchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);

    static final String SCHEMA_RESOURCE = "db/schema.sql";

    @Inject
    AgroalDataSource dataSource;

    @Inject
    MetricsConfig metricsConfig;

    void onStart(@Observes StartupEvent ev) {
        if (!metricsConfig.isSchemaAutoCreate()) {
            log.info("[Schema] auto-create disabled, skipping {}", SCHEMA_RESOURCE);
            return;
        }
        List<String> statements = statements(loadSchema());
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            log.info("[Schema] applied {} statements from {}", statements.size(), SCHEMA_RESOURCE);
        } catch (SQLException e) {
            throw new StoreUnavailableException("schema initialization failed: " + e.getMessage(), e);
        }
    }

    static List<String> statements(String script) {
        String withoutComments = script.lines()
                .filter(line -> !line.trim().startsWith("--"))
                .collect(Collectors.joining("\n"));
        List<String> statements = new ArrayList<>();
        for (String part : withoutComments.split(";")) {
            if (!part.isBlank()) {
                statements.add(part.trim());
            }
        }
        return statements;
    }

    private String loadSchema() {
        try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("schema resource not found: " + SCHEMA_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read " + SCHEMA_RESOURCE, e);
        }
    }
}
