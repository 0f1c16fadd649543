package com.lensql.generator.analyze;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.generator.SchemaException;
import com.lensql.generator.schema.EntityDeclaration;
import com.lensql.generator.schema.FieldDeclaration;
import com.lensql.generator.schema.RelationDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelationResolverTest {
    private final SchemaCompiler compiler = new SchemaCompiler();

    private CompiledSchema blog() {
        return compiler.compile(getClass().getResourceAsStream("/blog-schema.json"));
    }

    @Test
    void backfillsTargetTablesAndForeignKeyTypes() {
        EntityRegistry registry = blog().registry();

        RelationMetadata posts = registry.require("User").requireRelation("posts");
        assertEquals("posts", posts.targetTable());
        assertEquals("author_id", posts.foreignKeyColumn());
        assertEquals("id", posts.referencedColumn());
        assertEquals(ScalarType.I64, posts.foreignKeyType());
        assertFalse(posts.foreignKeyNullable());

        RelationMetadata reviews = registry.require("User").requireRelation("reviews");
        assertTrue(reviews.foreignKeyNullable());

        RelationMetadata author = registry.require("Post").requireRelation("author");
        assertEquals(RelationKind.BELONGS_TO, author.kind());
        assertEquals("users", author.targetTable());
        assertEquals("author_id", author.foreignKeyField());
    }

    @Test
    void forwardReferencesResolve() {
        // User is declared before Post and Post before Comment
        EntityRegistry registry = blog().registry();
        assertEquals("comments", registry.require("Post").requireRelation("comments").targetTable());
        assertEquals(List.of("author_id", "reviewer_id"), registry.require("Post").foreignKeyFields());
    }

    @Test
    void selfReferencesResolve() {
        EntityDeclaration category = new EntityDeclaration("Category", "categories", List.of(
                new FieldDeclaration("id", "i32", true, false, null),
                new FieldDeclaration("parent_id", "Option<i32>", false, false, null)),
                List.of(
                        new RelationDeclaration("parent", "belongs_to", "Entity", "Column::ParentId", "Column::Id"),
                        new RelationDeclaration("children", "has_many", "Entity", "Column::Id", "Column::ParentId")));
        EntityDraft draft = new SchemaAnalyzer().analyze(category);

        EntityMetadata resolved = new RelationResolver().resolve(List.of(draft)).require("Category");
        assertEquals("Category", resolved.requireRelation("parent").targetEntity());
        assertEquals("categories", resolved.requireRelation("children").targetTable());
        assertTrue(resolved.requireRelation("children").foreignKeyNullable());
        assertEquals(ScalarType.I32, resolved.requireRelation("parent").foreignKeyType());
    }

    @Test
    void externalTargetsFallBackToSnakeCaseTables() {
        EntityDraft draft = new SchemaAnalyzer().analyze(new EntityDeclaration("Post", "posts", List.of(
                new FieldDeclaration("id", "i64", true, false, null)),
                List.of(new RelationDeclaration("tags", "has_many", "super::post_tag::Entity", "Column::Id", "Column::PostId"))));

        RelationMetadata tags = new RelationResolver().resolve(List.of(draft)).require("Post").requireRelation("tags");
        assertEquals("PostTag", tags.targetEntity());
        assertEquals("post_tag", tags.targetTable());
        assertNull(tags.foreignKeyType());
    }

    @Test
    void hasManyWithoutForeignKeyOnTargetIsFatal() {
        EntityDraft user = new SchemaAnalyzer().analyze(new EntityDeclaration("User", "users",
                List.of(new FieldDeclaration("id", "i64", true, false, null)),
                List.of(new RelationDeclaration("posts", "has_many", "super::post::Entity", "Column::Id", "super::post::Column::OwnerId"))));
        EntityDraft post = new SchemaAnalyzer().analyze(new EntityDeclaration("Post", "posts",
                List.of(new FieldDeclaration("id", "i64", true, false, null)), List.of()));

        assertThrows(SchemaException.class, () -> new RelationResolver().resolve(List.of(user, post)));
    }

    @Test
    void duplicateEntitiesAreFatal() {
        EntityDraft post = new SchemaAnalyzer().analyze(new EntityDeclaration("Post", "posts",
                List.of(new FieldDeclaration("id", "i64", true, false, null)), List.of()));
        assertThrows(SchemaException.class, () -> new RelationResolver().resolve(List.of(post, post)));
    }
}
