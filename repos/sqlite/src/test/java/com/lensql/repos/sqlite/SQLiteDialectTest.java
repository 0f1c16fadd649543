package com.lensql.repos.sqlite;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.lensql.core.where.JsonNullFilter;
import com.lensql.core.where.Operator;
import com.lensql.core.where.QueryMode;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SQLiteDialectTest {
    private final SQLiteDialect dialect = new SQLiteDialect();

    @Test
    public void globPatternsEscapeWildcards() {
        assertEquals("*a[*]b[?]c[[]d*", SQLiteDialect.globPattern(Operator.CONTAINS, "a*b?c[d"));
        assertEquals("ab*", SQLiteDialect.globPattern(Operator.STARTS_WITH, "ab"));
        assertEquals("*ab", SQLiteDialect.globPattern(Operator.JSON_STRING_ENDS_WITH, "ab"));
    }

    @Test
    public void insensitiveMatchUsesLike() {
        SqlFragment fragment = dialect.match("t0.\"name\"", Operator.CONTAINS, "50%", QueryMode.INSENSITIVE);

        assertEquals("LOWER(t0.\"name\") LIKE LOWER(?) ESCAPE '\\'", fragment.sql());
        assertEquals("%50\\%%", fragment.params().get(0).value());
    }

    @Test
    public void pathsQuoteKeysAndIndexArrays() {
        assertEquals("$", SQLiteDialect.path(List.of()));
        assertEquals("$.\"tags\"[0]", SQLiteDialect.path(List.of("tags", "0")));
    }

    @Test
    public void jsonEqualityBindsScalarsNatively() {
        SqlFragment fragment = dialect.json("c", Operator.EQUALS, List.of("n"), JsonNodeFactory.instance.numberNode(3));

        assertEquals("json_extract(c, ?) = ?", fragment.sql());
        assertEquals(3L, fragment.params().get(1).value());
    }

    @Test
    public void anyNullCoversBothKindsOfNull() {
        SqlFragment fragment = dialect.json("c", Operator.JSON_NULL, List.of(), JsonNullFilter.ANY_NULL);

        assertEquals("(c IS NULL OR json_type(c, ?) = 'null')", fragment.sql());
    }

    @Test
    public void offsetWithoutLimitUsesMinusOne() {
        assertEquals("-1", dialect.unlimited());
        assertFalse(dialect.supportsReturning());
    }
}
