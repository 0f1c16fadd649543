package com.lensql.repositories.rdbms.sql;

import com.lensql.core.ContractViolationException;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.where.Condition;
import com.lensql.core.where.NullsOrder;
import com.lensql.core.where.Operator;
import com.lensql.core.where.OrderBy;
import com.lensql.core.where.QueryMode;
import com.lensql.core.where.SortOrder;
import com.lensql.repositories.rdbms.ColumnCodec;
import com.lensql.repositories.rdbms.Dialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SqlRendererTest {
    private static final FieldMetadata ID = new FieldMetadata("id", "id", ScalarType.I64, "i64", false, false, true);
    private static final FieldMetadata NAME = new FieldMetadata("name", "full_name", ScalarType.STRING, "String", false, false, false);
    private static final FieldMetadata AGE = new FieldMetadata("age", "age", ScalarType.I32, "i32", true, false, false);
    private static final EntityMetadata USER = new EntityMetadata("User", "users", List.of(ID, NAME, AGE), List.of());

    private SqlRenderer renderer;

    @BeforeEach
    public void setUp() {
        Dialect dialect = new PlainDialect();
        renderer = new SqlRenderer(dialect, new ColumnCodec(dialect, Map.of()));
    }

    private static Condition compare(FieldMetadata field, Operator op, Object operand) {
        return new Condition.Comparison(field, op, operand, QueryMode.DEFAULT, List.of());
    }

    @Test
    public void comparisonsUseColumnNamesAndConvertOperands() {
        SqlFragment fragment = renderer.render(compare(AGE, Operator.GTE, 21L), "t0");

        assertEquals("t0.\"age\" >= ?", fragment.sql());
        assertEquals(new SqlParam(21, ScalarType.I32), fragment.params().get(0));
        assertEquals("\"full_name\" = ?", renderer.render(compare(NAME, Operator.EQUALS, "Ann"), null).sql());
    }

    @Test
    public void equalsNullBecomesIsNull() {
        assertEquals("t0.\"age\" IS NULL", renderer.render(compare(AGE, Operator.EQUALS, null), "t0").sql());
        assertEquals("t0.\"age\" IS NOT NULL", renderer.render(compare(AGE, Operator.NOT_EQUALS, null), "t0").sql());
    }

    @Test
    public void insensitiveEqualityLowersBothSides() {
        Condition condition = new Condition.Comparison(NAME, Operator.EQUALS, "ann", QueryMode.INSENSITIVE, List.of());

        assertEquals("LOWER(t0.\"full_name\") = LOWER(?)", renderer.render(condition, "t0").sql());
    }

    @Test
    public void emptyListsAreConstants() {
        assertEquals("1=0", renderer.render(compare(ID, Operator.IN, List.of()), "t0").sql());
        assertEquals("1=1", renderer.render(compare(ID, Operator.NOT_IN, List.of()), "t0").sql());

        SqlFragment in = renderer.render(compare(ID, Operator.IN, List.of(1, 2)), "t0");
        assertEquals("t0.\"id\" IN (?, ?)", in.sql());
        assertEquals(2L, in.params().get(1).value());
    }

    @Test
    public void emptyConjunctionsAndDisjunctions() {
        assertEquals("1=1", renderer.render(new Condition.All(List.of()), "t0").sql());
        assertEquals("1=0", renderer.render(new Condition.Any(List.of()), "t0").sql());
    }

    @Test
    public void logicalOperatorsParenthesiseChildren() {
        Condition condition = new Condition.Not(new Condition.Any(List.of(
                compare(AGE, Operator.LT, 18),
                compare(AGE, Operator.IS_NULL, null))));

        assertEquals("NOT ((t0.\"age\" < ?) OR (t0.\"age\" IS NULL))", renderer.render(condition, "t0").sql());
    }

    @Test
    public void existsCorrelatesOnTheRelationColumns() {
        FieldMetadata published = new FieldMetadata("published", "published", ScalarType.BOOL, "bool", false, false, false);
        String outer = renderer.nextAlias();
        Condition condition = new Condition.Exists("posts", "author_id", "id",
                new Condition.Not(compare(published, Operator.EQUALS, true)), true);

        SqlFragment fragment = renderer.render(condition, outer);

        assertEquals("NOT EXISTS (SELECT 1 FROM \"posts\" t1 WHERE t1.\"author_id\" = t0.\"id\" "
                + "AND (NOT (t1.\"published\" = ?)))", fragment.sql());
        assertEquals(Boolean.TRUE, fragment.params().get(0).value());
    }

    @Test
    public void listOperatorsRequireLists() {
        assertThrows(ContractViolationException.class, () -> renderer.render(compare(ID, Operator.IN, 3), "t0"));
    }

    @Test
    public void orderByHonoursNullsPlacement() {
        String order = renderer.orderBy(USER, List.of(
                new OrderBy("age", SortOrder.DESC, NullsOrder.LAST),
                new OrderBy("id", SortOrder.ASC, NullsOrder.DEFAULT)), "t0");

        assertEquals("t0.\"age\" DESC NULLS LAST, t0.\"id\" ASC", order);
    }

    private static class PlainDialect extends Dialect {
        PlainDialect() {
            super("plain");
        }

        @Override
        public String unlimited() {
            return "ALL";
        }

        @Override
        public boolean supportsReturning() {
            return false;
        }

        @Override
        public SqlFragment match(String column, Operator op, String value, QueryMode mode) {
            return SqlFragment.of(column + " LIKE ?", new SqlParam(likePattern(op, value), ScalarType.STRING));
        }

        @Override
        public SqlFragment json(String column, Operator op, List<String> path, Object operand) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void bind(PreparedStatement stmt, int index, SqlParam param) {
            throw new UnsupportedOperationException();
        }

        @Override
        public Object read(ResultSet rs, int index, ScalarType type) {
            throw new UnsupportedOperationException();
        }
    }
}
