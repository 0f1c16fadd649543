package com.lensql.core.where;

import com.lensql.core.ContractViolationException;
import com.lensql.core.Fixtures;
import com.lensql.core.meta.TypeClass;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConditionResolverTest {
    private final ConditionResolver resolver = new ConditionResolver(Fixtures.REGISTRY);

    @Test
    void appliesModeToEveryPredicateOnTheFieldWhereverItAppears() {
        Condition condition = resolver.resolve(Fixtures.USER, List.of(
                Where.field("name").contains("al"),
                Where.field("email").endsWith(".com"),
                Where.field("name").mode(QueryMode.INSENSITIVE)));

        Condition.All all = assertInstanceOf(Condition.All.class, condition);
        assertEquals(2, all.conditions().size());
        Condition.Comparison name = (Condition.Comparison) all.conditions().get(0);
        Condition.Comparison email = (Condition.Comparison) all.conditions().get(1);
        assertEquals(QueryMode.INSENSITIVE, name.mode());
        assertEquals(QueryMode.DEFAULT, email.mode());
    }

    @Test
    void attachesJsonPathToJsonPredicates() {
        Condition condition = resolver.resolve(Fixtures.USER, List.of(
                Where.field("profile").stringContains("rust"),
                Where.field("profile").path("bio", "text")));

        Condition.Comparison comparison = assertInstanceOf(Condition.Comparison.class, condition);
        assertEquals(List.of("bio", "text"), comparison.path());
        assertEquals(Operator.JSON_STRING_CONTAINS, comparison.op());
    }

    @Test
    void rejectsOperatorsOutsideTheTypeClass() {
        assertThrows(ContractViolationException.class,
                () -> resolver.resolve(Fixtures.POST, List.of(Where.field("published").gt(true))));
        assertThrows(ContractViolationException.class,
                () -> resolver.resolve(Fixtures.POST, List.of(Where.field("views").contains("1"))));
        assertThrows(ContractViolationException.class,
                () -> resolver.resolve(Fixtures.POST, List.of(Where.field("views").mode(QueryMode.INSENSITIVE))));
    }

    @Test
    void rejectsNullChecksOnRequiredFields() {
        assertThrows(ContractViolationException.class,
                () -> resolver.resolve(Fixtures.POST, List.of(Where.field("title").isNull())));
        assertDoesNotThrow(() -> resolver.resolve(Fixtures.USER, List.of(Where.field("age").isNull())));
    }

    @Test
    void rejectsUnknownFieldsAndRelations() {
        assertThrows(ContractViolationException.class,
                () -> resolver.resolve(Fixtures.POST, List.of(Where.field("nope").eq(1))));
        assertThrows(ContractViolationException.class,
                () -> resolver.resolve(Fixtures.POST, List.of(Where.relation("nope").some())));
    }

    @Test
    void logicalNodesNest() {
        Condition condition = resolver.resolve(Fixtures.POST, List.of(
                Where.or(Where.field("views").gt(10), Where.field("title").eq("x")),
                Where.not(Where.field("published").eq(true))));

        Condition.All all = assertInstanceOf(Condition.All.class, condition);
        Condition.Any any = assertInstanceOf(Condition.Any.class, all.conditions().get(0));
        assertEquals(2, any.conditions().size());
        assertInstanceOf(Condition.Not.class, all.conditions().get(1));
    }

    @Test
    void conjunctionInsideDisjunctionStaysGrouped() {
        Condition condition = resolver.resolve(Fixtures.USER, List.of(
                Where.or(Where.and(Where.field("name").eq("a"), Where.field("age").gt(3)))));

        Condition.Any any = assertInstanceOf(Condition.Any.class, condition);
        assertEquals(1, any.conditions().size());
        Condition.All all = assertInstanceOf(Condition.All.class, any.conditions().get(0));
        assertEquals(2, all.conditions().size());
    }

    @Test
    void negatedDisjunctionKeepsEveryBranch() {
        Condition condition = resolver.resolve(Fixtures.USER, List.of(
                Where.not(Where.or(
                        Where.and(Where.field("name").eq("a"), Where.field("age").gt(3)),
                        Where.field("email").eq("b@example.com")))));

        Condition.Not not = assertInstanceOf(Condition.Not.class, condition);
        Condition.Any any = assertInstanceOf(Condition.Any.class, not.condition());
        assertEquals(2, any.conditions().size());
        assertInstanceOf(Condition.All.class, any.conditions().get(0));
        assertInstanceOf(Condition.Comparison.class, any.conditions().get(1));
    }

    @Test
    void modesInsideDisjunctionApplyToSiblingBranches() {
        Condition condition = resolver.resolve(Fixtures.USER, List.of(
                Where.or(Where.field("name").contains("al"), Where.field("name").mode(QueryMode.INSENSITIVE))));

        Condition.Any any = assertInstanceOf(Condition.Any.class, condition);
        assertEquals(1, any.conditions().size());
        assertEquals(QueryMode.INSENSITIVE, ((Condition.Comparison) any.conditions().get(0)).mode());
    }

    @Test
    void hasManyQuantifiersJoinOnTheTargetForeignKey() {
        Condition some = resolver.resolve(Fixtures.USER, List.of(Where.relation("posts").some(Where.field("views").gt(5))));
        Condition every = resolver.resolve(Fixtures.USER, List.of(Where.relation("posts").every(Where.field("views").gt(5))));
        Condition none = resolver.resolve(Fixtures.USER, List.of(Where.relation("posts").none(Where.field("views").gt(5))));

        Condition.Exists someExists = assertInstanceOf(Condition.Exists.class, some);
        assertEquals("posts", someExists.targetTable());
        assertEquals("author_id", someExists.innerColumn());
        assertEquals("id", someExists.outerColumn());
        assertFalse(someExists.negated());

        Condition.Exists everyExists = assertInstanceOf(Condition.Exists.class, every);
        assertTrue(everyExists.negated());
        assertInstanceOf(Condition.Not.class, everyExists.filter());

        Condition.Exists noneExists = assertInstanceOf(Condition.Exists.class, none);
        assertTrue(noneExists.negated());
        assertInstanceOf(Condition.Comparison.class, noneExists.filter());
    }

    @Test
    void belongsToQuantifiersJoinOnTheLocalForeignKey() {
        Condition condition = resolver.resolve(Fixtures.POST, List.of(Where.relation("author").some(Where.field("name").eq("Ann"))));

        Condition.Exists exists = assertInstanceOf(Condition.Exists.class, condition);
        assertEquals("users", exists.targetTable());
        assertEquals("id", exists.innerColumn());
        assertEquals("author_id", exists.outerColumn());
    }

    @Test
    void uniqueSelectorsMustTargetIdentifyingFields() {
        assertDoesNotThrow(() -> resolver.unique(Fixtures.USER, UniqueWhere.of("email", "a@b.c")));
        assertThrows(ContractViolationException.class, () -> resolver.unique(Fixtures.USER, UniqueWhere.of("name", "Ann")));
    }

    @Test
    void typeClassTableDrivesArithmeticAndModes() {
        assertTrue(TypeClass.NUMERIC.supportsArithmetic());
        assertFalse(TypeClass.STRING.supportsArithmetic());
        assertTrue(TypeClass.STRING.supportsModes());
        assertTrue(TypeClass.JSON.allows(Operator.JSON_NULL));
        assertFalse(TypeClass.BOOLEAN.allows(Operator.GT));
    }
}
