package com.lensql.generator.analyze;

import com.lensql.core.meta.EntityRegistry;

public record CompiledSchema(String packageName, String schemaName, EntityRegistry registry) {
}
