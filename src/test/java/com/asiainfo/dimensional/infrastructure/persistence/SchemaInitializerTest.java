package com.asiainfo.dimensional.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SchemaInitializerTest {

    @Test
    void splitsStatementsAndDropsComments() {
        String script = """
                -- header
                CREATE TABLE a (id BIGINT);

                -- second
                CREATE INDEX ix_a ON a (id);
                """;
        List<String> statements = SchemaInitializer.statements(script);
        assertEquals(List.of("CREATE TABLE a (id BIGINT)", "CREATE INDEX ix_a ON a (id)"), statements);
    }
}
