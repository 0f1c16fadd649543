package com.lensql.generator.generate;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.generator.analyze.CompiledSchema;
import com.lensql.generator.analyze.SchemaCompiler;
import com.lensql.generator.schema.SchemaDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a schema document and writes the generated sources under {@code outputDir}, one
 * directory per package segment.
 */
public class ProjectGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ProjectGenerator.class);

    private final SchemaCompiler compiler;
    private final EntityGenerator entityGenerator;
    private final RegistryGenerator registryGenerator;

    public ProjectGenerator() {
        HandlebarsEngine engine = new HandlebarsEngine();
        this.compiler = new SchemaCompiler();
        this.entityGenerator = new EntityGenerator(engine);
        this.registryGenerator = new RegistryGenerator(engine);
    }

    public List<Path> generate(Path schemaFile, Path outputDir) throws IOException {
        try (InputStream in = Files.newInputStream(schemaFile)) {
            return generate(SchemaCompiler.read(in), outputDir);
        }
    }

    public List<Path> generate(SchemaDocument document, Path outputDir) throws IOException {
        Files.createDirectories(outputDir);
        CompiledSchema schema = compiler.compile(document);

        logger.info("Generating schema '{}' into package {}", schema.schemaName(), schema.packageName());

        List<Path> written = new ArrayList<>();
        for (EntityMetadata entity : schema.registry().entities()) {
            logger.info("  Generating entity: {} ({} fields, {} relations)",
                    entity.name(), entity.fields().size(), entity.relations().size());
            written.add(entityGenerator.generate(schema, entity, outputDir));
        }

        logger.info("  Generating {}.java", RegistryGenerator.className(schema));
        written.add(registryGenerator.generate(schema, outputDir));

        logger.info("Generation complete: {} entities", schema.registry().entities().size());
        return written;
    }
}
