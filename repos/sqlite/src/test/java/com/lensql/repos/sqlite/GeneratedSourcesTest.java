package com.lensql.repos.sqlite;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.TreeNode;
import com.fasterxml.jackson.databind.JsonNode;
import com.github.jknack.handlebars.Template;
import com.lensql.core.Key;
import com.lensql.core.Row;
import com.lensql.core.config.ClientConfig;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.where.RelationFilter;
import com.lensql.core.where.UniqueWhere;
import com.lensql.core.where.WhereParam;
import com.lensql.generator.analyze.SchemaCompiler;
import com.lensql.generator.generate.ProjectGenerator;
import com.lensql.repositories.rdbms.LensClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;

import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static com.lensql.core.where.SetParam.assign;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Generates sources from schema documents, compiles them against the runtime and drives a SQLite
 * client through the generated classes.
 */
public class GeneratedSourcesTest {
    private static final List<Class<?>> CLASSPATH = List.of(
            Key.class, LensClient.class, JsonNode.class, TreeNode.class, JsonInclude.class, Template.class, Logger.class);

    @TempDir
    Path tempDir;

    private final SQLitePlugin plugin = new SQLitePlugin();

    @AfterEach
    public void tearDown() {
        plugin.cleanUp();
    }

    private URLClassLoader generateAndCompile(String schemaResource) throws IOException {
        Path sources = tempDir.resolve("src");
        Path classes = Files.createDirectories(tempDir.resolve("classes"));
        List<Path> written;
        try (InputStream is = getClass().getResourceAsStream(schemaResource)) {
            written = new ProjectGenerator().generate(SchemaCompiler.read(is), sources);
        }

        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assertNotNull(compiler, "compiling generated sources needs a JDK");
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager files = compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
            List<String> options = List.of("-d", classes.toString(), "-classpath", classpath(), "-proc:none");
            Boolean compiled = compiler.getTask(null, files, diagnostics, options, null,
                    files.getJavaFileObjectsFromPaths(written)).call();
            assertTrue(compiled, () -> diagnostics.getDiagnostics().toString());
        }
        return new URLClassLoader(new URL[]{classes.toUri().toURL()}, getClass().getClassLoader());
    }

    private static String classpath() {
        return CLASSPATH.stream()
                .map(GeneratedSourcesTest::location)
                .distinct()
                .collect(Collectors.joining(File.pathSeparator));
    }

    private static String location(Class<?> type) {
        try {
            return Path.of(type.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Cannot locate " + type.getName(), e);
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        return future.join();
    }

    @Test
    public void everyTypeClassCompiles() throws Exception {
        try (URLClassLoader loader = generateAndCompile("/catalog-schema.json")) {
            EntityRegistry registry = (EntityRegistry) loader.loadClass("com.example.catalog.CatalogRegistry")
                    .getMethod("registry").invoke(null);
            assertEquals(2, registry.entities().size());

            Class<?> code = loader.loadClass("com.example.catalog.Product$Code");
            UniqueWhere byCode = (UniqueWhere) code.getMethod("equals", Key.class).invoke(null, Key.of("EUR-10"));
            assertEquals("code", byCode.field());
            assertThrows(NoSuchMethodException.class, () -> code.getDeclaredMethod("equals", Object.class));

            Class<?> sku = loader.loadClass("com.example.catalog.Product$Sku");
            UniqueWhere bySku = (UniqueWhere) sku.getMethod("equals", String.class).invoke(null, "A-1");
            assertEquals(Key.of("A-1"), bySku.key());

            Class<?> label = loader.loadClass("com.example.catalog.Label$Id");
            assertNotNull(label.getMethod("equals", Key.class));
        }
    }

    @Test
    public void generatedDslDrivesAClient() throws Exception {
        try (URLClassLoader loader = generateAndCompile("/blog-schema.json")) {
            Class<?> blog = loader.loadClass("com.example.blog.BlogRegistry");
            EntityRegistry registry = (EntityRegistry) blog.getMethod("registry").invoke(null);
            LensClient client = plugin.createClient(new SQLiteConfig(tempDir.resolve("generated.db").toString()),
                    registry, ClientConfig.builder().registerTableFetchers(false).build());
            assertFalse(client.fetchers().contains("User"));

            blog.getMethod("registerFetchers", LensClient.class).invoke(null, client);
            assertTrue(client.fetchers().contains("User"));
            assertTrue(client.fetchers().contains("Post"));
            assertTrue(client.fetchers().contains("Comment"));

            for (String statement : SQLiteClientTest.BLOG_TABLES) {
                await(client.executeRaw(statement));
            }
            Row alice = await(client.entity("User").create(assign("email", "alice@x.com"), assign("name", "Alice")).exec());
            await(client.entity("Post").create(assign("title", "Lenses in practice"), assign("views", 3),
                    assign("published", true), assign("author_id", alice.get("id"))).exec());
            await(client.entity("Post").create(assign("title", "Other"), assign("views", 1),
                    assign("published", false), assign("author_id", alice.get("id"))).exec());

            WhereParam titled = (WhereParam) loader.loadClass("com.example.blog.Post$Title")
                    .getMethod("contains", String.class).invoke(null, "Lenses");
            RelationFilter author = (RelationFilter) loader.loadClass("com.example.blog.Post$Author")
                    .getMethod("fetch").invoke(null);

            List<Row> found = await(client.entity("Post").findMany(titled).include(author).exec());

            assertEquals(1, found.size());
            assertEquals("Alice", found.get(0).getRow("author").getString("name"));
        }
    }
}
