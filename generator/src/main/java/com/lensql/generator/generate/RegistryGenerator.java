package com.lensql.generator.generate;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.Naming;
import com.lensql.generator.analyze.CompiledSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Emits the class that assembles every entity's metadata into one registry.
 */
public class RegistryGenerator {
    private final HandlebarsEngine engine;

    public RegistryGenerator(HandlebarsEngine engine) {
        this.engine = engine;
    }

    public static String className(CompiledSchema schema) {
        return Naming.pascalCase(schema.schemaName()) + "Registry";
    }

    public Path generate(CompiledSchema schema, Path outputDir) throws IOException {
        Path javaDir = outputDir.resolve(schema.packageName().replace('.', '/'));
        Files.createDirectories(javaDir);

        List<String> entities = schema.registry().entities().stream().map(EntityMetadata::name).toList();

        Map<String, Object> context = new HashMap<>();
        context.put("packageName", schema.packageName());
        context.put("className", className(schema));
        context.put("entities", entities);

        Path target = javaDir.resolve(className(schema) + ".java");
        Files.writeString(target, engine.render("registry.java", context));
        return target;
    }
}
