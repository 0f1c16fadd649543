package com.lensql.core.meta;

import com.lensql.core.ContractViolationException;
import com.lensql.core.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntityRegistryTest {

    @Test
    void resolvesNamespacedAndCaseVariedNames() {
        EntityRegistry registry = Fixtures.REGISTRY;
        for (String name : List.of("Post", "post", "POST", "blog::Post", "blog.post", "blog::posT")) {
            assertEquals("Post", registry.lookup(name).map(EntityMetadata::name).orElse(null), name);
        }
    }

    @Test
    void resolvesSnakeCaseToPascalCase() {
        EntityMetadata blogPost = new EntityMetadata("BlogPost", "blog_posts",
                List.of(new FieldMetadata("id", "id", ScalarType.I64, "i64", false, false, true)), List.of());
        EntityRegistry registry = new EntityRegistry(List.of(blogPost));

        assertTrue(registry.lookup("blog_post").isPresent());
        assertTrue(registry.lookup("BLOG_POST").isPresent());
    }

    @Test
    void unknownEntityIsAContractViolation() {
        assertTrue(Fixtures.REGISTRY.lookup("Comment").isEmpty());
        assertThrows(ContractViolationException.class, () -> Fixtures.REGISTRY.require("Comment"));
    }

    @Test
    void reportsKeyTypes() {
        assertEquals(ScalarType.I64, Fixtures.REGISTRY.primaryKeyType("user").orElseThrow());
        assertEquals(ScalarType.I64, Fixtures.REGISTRY.foreignKeyType("Post", "author_id").orElseThrow());
        assertTrue(Fixtures.REGISTRY.primaryKeyType("Comment").isEmpty());
    }

    @Test
    void metadataRequiresExactlyOnePrimaryKey() {
        FieldMetadata plain = new FieldMetadata("name", null, ScalarType.STRING, "String", false, false, false);
        assertThrows(IllegalArgumentException.class,
                () -> new EntityMetadata("Broken", "broken", List.of(plain), List.of()));
        assertEquals("name", plain.columnName());
    }

    @Test
    void onlyBelongsToRelationsContributeForeignKeys() {
        assertEquals(List.of("author_id"), Fixtures.POST.foreignKeyFields());
        assertEquals(List.of(), Fixtures.USER.foreignKeyFields());
    }
}
