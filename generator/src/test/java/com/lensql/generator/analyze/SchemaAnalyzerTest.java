package com.lensql.generator.analyze;

import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.ScalarType;
import com.lensql.generator.SchemaException;
import com.lensql.generator.schema.EntityDeclaration;
import com.lensql.generator.schema.FieldDeclaration;
import com.lensql.generator.schema.RelationDeclaration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchemaAnalyzerTest {
    private final SchemaAnalyzer analyzer = new SchemaAnalyzer();

    private static FieldDeclaration field(String name, String type) {
        return new FieldDeclaration(name, type, false, false, null);
    }

    private static FieldDeclaration id(String type) {
        return new FieldDeclaration("id", type, true, false, null);
    }

    @Test
    void resolvesFieldTypesAndNullability() {
        EntityDraft draft = analyzer.analyze(new EntityDeclaration("post", "posts", List.of(
                id("Uuid"),
                field("title", "String"),
                field("content", "Option<String>"),
                field("published_at", "Option<chrono::DateTime<chrono::Utc>>"),
                field("metadata", "Optional<JsonNode>"),
                field("money", "Money")), List.of()));

        assertEquals("Post", draft.name());
        assertEquals("posts", draft.tableName());
        FieldMetadata content = draft.findField("content").orElseThrow();
        assertEquals(ScalarType.STRING, content.type());
        assertTrue(content.nullable());
        assertFalse(draft.findField("title").orElseThrow().nullable());
        assertEquals(ScalarType.DATE_TIME, draft.findField("published_at").orElseThrow().type());
        assertEquals(ScalarType.JSON, draft.findField("metadata").orElseThrow().type());

        FieldMetadata money = draft.findField("money").orElseThrow();
        assertEquals(ScalarType.OPAQUE, money.type());
        assertEquals("Money", money.declaredType());
    }

    @Test
    void honoursColumnOverrides() {
        EntityDraft draft = analyzer.analyze(new EntityDeclaration("Post", "posts", List.of(
                id("i64"),
                new FieldDeclaration("customData", "Option<Json>", false, false, "custom_data")), List.of()));

        assertEquals("custom_data", draft.findField("customData").orElseThrow().columnName());
    }

    @Test
    void missingTableNameIsFatal() {
        SchemaException e = assertThrows(SchemaException.class,
                () -> analyzer.analyze(new EntityDeclaration("Post", null, List.of(id("i64")), List.of())));
        assertTrue(e.getMessage().contains("table name"));
    }

    @Test
    void missingPrimaryKeyIsFatal() {
        assertThrows(SchemaException.class,
                () -> analyzer.analyze(new EntityDeclaration("Post", "posts", List.of(field("title", "String")), List.of())));
    }

    @Test
    void duplicatePrimaryKeysAreFatal() {
        assertThrows(SchemaException.class,
                () -> analyzer.analyze(new EntityDeclaration("Post", "posts",
                        List.of(id("i64"), new FieldDeclaration("other", "i64", true, false, null)), List.of())));
    }

    @Test
    void belongsToTakesItsForeignKeyFromTheDeclaringSide() {
        EntityDraft draft = analyzer.analyze(new EntityDeclaration("Post", "posts",
                List.of(id("i64"), field("author_id", "i64")),
                List.of(new RelationDeclaration("author", "belongs_to", "super::user::Entity",
                        "Column::AuthorId", "super::user::Column::Id"))));

        RelationDraft relation = draft.relations().get(0);
        assertEquals(RelationKind.BELONGS_TO, relation.kind());
        assertEquals("User", relation.targetEntity());
        assertEquals("author_id", relation.foreignKeyField());
        assertEquals("id", relation.referencedField());
    }

    @Test
    void hasManyTakesItsForeignKeyFromTheTargetSide() {
        EntityDraft draft = analyzer.analyze(new EntityDeclaration("User", "users",
                List.of(id("i64")),
                List.of(new RelationDeclaration("posts", "has_many", "super::post::Entity",
                        "Column::Id", "super::post::Column::AuthorId"))));

        RelationDraft relation = draft.relations().get(0);
        assertEquals(RelationKind.HAS_MANY, relation.kind());
        assertEquals("Post", relation.targetEntity());
        assertEquals("author_id", relation.foreignKeyField());
        assertEquals("id", relation.referencedField());
    }

    @Test
    void belongsToWithoutALocalForeignKeyIsFatal() {
        assertThrows(SchemaException.class, () -> analyzer.analyze(new EntityDeclaration("Post", "posts",
                List.of(id("i64")),
                List.of(new RelationDeclaration("author", "belongs_to", "super::user::Entity",
                        "Column::AuthorId", "super::user::Column::Id")))));
    }

    @Test
    void unknownRelationKindIsFatal() {
        assertThrows(SchemaException.class, () -> analyzer.analyze(new EntityDeclaration("Post", "posts",
                List.of(id("i64")),
                List.of(new RelationDeclaration("tags", "many_to_many", "Tag", "Column::Id", "Column::PostId")))));
    }

    @Test
    void parsesTargetPaths() {
        assertEquals("User", SchemaAnalyzer.targetEntity("super::user::Entity"));
        assertEquals("BlogPost", SchemaAnalyzer.targetEntity("crate::blog_post::Entity"));
        assertEquals("Tag", SchemaAnalyzer.targetEntity("com.acme.Tag"));
        assertEquals("author_id", SchemaAnalyzer.columnReference("super::post::Column::AuthorId"));
    }
}
