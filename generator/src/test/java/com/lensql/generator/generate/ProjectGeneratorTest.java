package com.lensql.generator.generate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lensql.generator.SchemaException;
import com.lensql.generator.schema.EntityDeclaration;
import com.lensql.generator.schema.FieldDeclaration;
import com.lensql.generator.schema.SchemaDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectGeneratorTest {
    private static final String BASE = "com/example/blog";

    private SchemaDocument schema;

    @BeforeEach
    void setUp() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        InputStream is = getClass().getResourceAsStream("/blog-schema.json");
        schema = mapper.readValue(is, SchemaDocument.class);
    }

    @Test
    void writesOneFilePerEntityPlusTheRegistry(@TempDir Path outputDir) throws Exception {
        List<Path> written = new ProjectGenerator().generate(schema, outputDir);

        assertEquals(4, written.size());
        assertTrue(Files.exists(outputDir.resolve(BASE + "/User.java")));
        assertTrue(Files.exists(outputDir.resolve(BASE + "/Post.java")));
        assertTrue(Files.exists(outputDir.resolve(BASE + "/Comment.java")));
        assertTrue(Files.exists(outputDir.resolve(BASE + "/BlogRegistry.java")));
    }

    @Test
    void entityCarriesItsMetadata(@TempDir Path outputDir) throws Exception {
        new ProjectGenerator().generate(schema, outputDir);
        String post = Files.readString(outputDir.resolve(BASE + "/Post.java"));

        assertTrue(post.contains("package com.example.blog;"));
        assertTrue(post.contains("public final class Post {"));
        assertTrue(post.contains("\"posts\","));
        assertTrue(post.contains("new FieldMetadata(\"content\", \"content\", ScalarType.STRING, \"String\", true, false, false)"));
        assertTrue(post.contains("new RelationMetadata(\"author\", RelationKind.BELONGS_TO, \"User\", \"users\","));
        assertTrue(post.contains("ScalarType.I64, false)"));
    }

    @Test
    void predicateFunctionsFollowTheTypeClass(@TempDir Path outputDir) throws Exception {
        new ProjectGenerator().generate(schema, outputDir);
        String post = Files.readString(outputDir.resolve(BASE + "/Post.java"));

        // string field
        assertTrue(post.contains("public static WhereParam contains(String value)"));
        assertTrue(post.contains("public static WhereParam mode(QueryMode mode)"));
        // numeric field
        assertTrue(post.contains("public static WhereParam gt(Integer value)"));
        assertTrue(post.contains("public static SetParam increment(Integer amount)"));
        // json field
        assertTrue(post.contains("public static WhereParam path(String... segments)"));
        assertTrue(post.contains("public static WhereParam jsonNull(JsonNullFilter filter)"));
        // boolean field gets equality but no ordering comparison
        assertFalse(post.contains("public static WhereParam gt(Boolean value)"));
        // nullable fields get null checks, required ones do not
        int isNull = post.split("public static WhereParam isNull\\(\\)", -1).length - 1;
        assertEquals(4, isNull);
    }

    @Test
    void uniqueAndPrimaryKeyFieldsGetUniqueConstructors(@TempDir Path outputDir) throws Exception {
        new ProjectGenerator().generate(schema, outputDir);
        String user = Files.readString(outputDir.resolve(BASE + "/User.java"));

        assertTrue(user.contains("public static UniqueWhere equals(Key key)"));
        assertTrue(user.contains("public static UniqueWhere equals(String value)"));
    }

    @Test
    void uniqueOpaqueFieldsAreAddressedByKey(@TempDir Path outputDir) throws Exception {
        SchemaDocument opaque = new SchemaDocument("com.example.shop", "shop", List.of(
                new EntityDeclaration("Thing", "things", List.of(
                        new FieldDeclaration("id", "i64", true, false, null),
                        new FieldDeclaration("code", "Money", false, true, null)), List.of())));

        new ProjectGenerator().generate(opaque, outputDir);
        String thing = Files.readString(outputDir.resolve("com/example/shop/Thing.java"));

        assertFalse(thing.contains("equals(Object value)"));
        assertEquals(2, thing.split("public static UniqueWhere equals\\(Key key\\)", -1).length - 1);
    }

    @Test
    void relationNamespacesFollowTheirKind(@TempDir Path outputDir) throws Exception {
        new ProjectGenerator().generate(schema, outputDir);
        String user = Files.readString(outputDir.resolve(BASE + "/User.java"));
        String post = Files.readString(outputDir.resolve(BASE + "/Post.java"));

        assertTrue(user.contains("public static final class Posts {"));
        assertTrue(user.contains("public static SetParam set(List<UniqueWhere> targets)"));
        assertTrue(post.contains("public static SetParam connect(UniqueWhere target)"));
        // only the nullable reviewer relation can be disconnected
        assertEquals(1, post.split("public static SetParam disconnect\\(\\)", -1).length - 1);
    }

    @Test
    void registryListsEveryEntity(@TempDir Path outputDir) throws Exception {
        new ProjectGenerator().generate(schema, outputDir);
        String registry = Files.readString(outputDir.resolve(BASE + "/BlogRegistry.java"));

        assertTrue(registry.contains("User.METADATA,"));
        assertTrue(registry.contains("Post.METADATA,"));
        assertTrue(registry.contains("Comment.METADATA"));
        assertFalse(registry.contains("Comment.METADATA,"));
        assertTrue(registry.contains("public static void registerFetchers(LensClient client)"));
        assertTrue(registry.contains("client.fetchers().register(Post.METADATA.name(), new TableFetcher(client.context(), Post.METADATA));"));
    }

    @Test
    void membersThatShadowGeneratedTypesAreRejected(@TempDir Path outputDir) {
        SchemaDocument clashing = new SchemaDocument("com.example", "clash", List.of(
                new EntityDeclaration("Thing", "things", List.of(
                        new FieldDeclaration("key", "String", true, false, null)), List.of())));

        assertThrows(SchemaException.class, () -> new ProjectGenerator().generate(clashing, outputDir));
    }

    @Test
    void readsSchemaFiles(@TempDir Path outputDir) throws Exception {
        Path schemaFile = outputDir.resolve("schema.json");
        try (InputStream is = getClass().getResourceAsStream("/blog-schema.json")) {
            Files.copy(is, schemaFile);
        }

        List<Path> written = new ProjectGenerator().generate(schemaFile, outputDir.resolve("out"));
        assertEquals(4, written.size());
    }
}
