package com.lensql.generator.analyze;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.generator.SchemaException;
import com.lensql.generator.schema.EntityDeclaration;
import com.lensql.generator.schema.SchemaDocument;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs both analysis passes over a schema document.
 */
public class SchemaCompiler {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final SchemaAnalyzer analyzer = new SchemaAnalyzer();
    private final RelationResolver resolver = new RelationResolver();

    public CompiledSchema compile(SchemaDocument document) {
        if (document.entities() == null || document.entities().isEmpty()) {
            throw new SchemaException("Schema " + document.schemaName() + " declares no entities");
        }
        List<EntityDraft> drafts = new ArrayList<>();
        for (EntityDeclaration entity : document.entities()) {
            drafts.add(analyzer.analyze(entity));
        }
        EntityRegistry registry = resolver.resolve(drafts);
        return new CompiledSchema(document.packageName(), document.schemaName(), registry);
    }

    public CompiledSchema compile(InputStream json) {
        return compile(read(json));
    }

    public static SchemaDocument read(InputStream json) {
        try {
            return OBJECT_MAPPER.readValue(json, SchemaDocument.class);
        } catch (IOException e) {
            throw new SchemaException("Failed to read schema document", e);
        }
    }
}
