package com.lensql.repositories.postgres;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.Operator;
import com.lensql.core.where.QueryMode;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PostgresDialectTest {
    private final PostgresDialect dialect = new PostgresDialect();

    @Test
    public void jsonParametersAreCast() {
        assertEquals("?::jsonb", dialect.placeholder(ScalarType.JSON));
        assertEquals("?", dialect.placeholder(ScalarType.I64));
    }

    @Test
    public void insensitiveMatchUsesIlike() {
        SqlFragment fragment = dialect.match("t0.\"name\"", Operator.STARTS_WITH, "a_b", QueryMode.INSENSITIVE);

        assertEquals("t0.\"name\" ILIKE ? ESCAPE '\\'", fragment.sql());
        assertEquals("a\\_b%", fragment.params().get(0).value());
    }

    @Test
    public void pathsBindAsTextArrays() {
        assertEquals("{\"tags\",\"0\"}", PostgresDialect.textArray(List.of("tags", "0")));

        SqlFragment fragment = dialect.json("c", Operator.JSON_ARRAY_CONTAINS, List.of("tags"),
                JsonNodeFactory.instance.textNode("sql"));

        assertEquals("(jsonb_typeof((c #> ?::text[])) = 'array' AND (c #> ?::text[]) @> ?::jsonb)", fragment.sql());
        assertEquals(3, fragment.params().size());
        assertEquals("[\"sql\"]", fragment.params().get(2).value().toString());
    }

    @Test
    public void objectContainsAvoidsTheQuestionMarkOperator() {
        SqlFragment fragment = dialect.json("c", Operator.JSON_OBJECT_CONTAINS, List.of(), "city");

        assertEquals("(jsonb_typeof(c) = 'object' AND jsonb_exists(c, ?))", fragment.sql());
    }

    @Test
    public void insertsReturnTheWrittenRow() {
        assertTrue(dialect.supportsReturning());
        assertEquals("ALL", dialect.unlimited());
    }
}
