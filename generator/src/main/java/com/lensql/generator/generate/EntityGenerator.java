package com.lensql.generator.generate;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.Naming;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.core.meta.ScalarType;
import com.lensql.core.meta.TypeClass;
import com.lensql.core.where.Operator;
import com.lensql.generator.SchemaException;
import com.lensql.generator.analyze.CompiledSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Emits one Java source file per entity: the metadata constant, a nested class per field with the
 * predicate, write and ordering functions its type class admits, and a nested class per relation.
 */
public class EntityGenerator {
    // simple names the generated file refers to; a member class with one of these names would shadow it
    private static final Set<String> RESERVED = Set.of(
            "Key", "EntityMetadata", "FieldMetadata", "RelationKind", "RelationMetadata", "ScalarType",
            "FieldRef", "IncludeBuilder", "JsonNullFilter", "Operator", "OrderBy", "QueryMode", "RelationFilter",
            "RelationRef", "SetParam", "SortOrder", "UniqueWhere", "Where", "WhereParam", "EntityClient",
            "LensClient", "List", "String", "Object", "Byte", "Short", "Integer", "Long", "Float", "Double",
            "Boolean", "SafeVarargs");

    private final HandlebarsEngine engine;

    public EntityGenerator(HandlebarsEngine engine) {
        this.engine = engine;
    }

    public Path generate(CompiledSchema schema, EntityMetadata entity, Path outputDir) throws IOException {
        Path javaDir = outputDir.resolve(schema.packageName().replace('.', '/'));
        Files.createDirectories(javaDir);

        Set<String> classNames = new HashSet<>();
        classNames.add(entity.name());
        List<Map<String, Object>> fields = new ArrayList<>();
        for (FieldMetadata field : entity.fields()) {
            fields.add(fieldContext(entity, field, classNames));
        }
        List<Map<String, Object>> relations = new ArrayList<>();
        for (RelationMetadata relation : entity.relations()) {
            relations.add(relationContext(entity, relation, classNames));
        }

        Map<String, Object> context = new HashMap<>();
        context.put("packageName", schema.packageName());
        context.put("className", entity.name());
        context.put("entityName", entity.name());
        context.put("tableName", entity.tableName());
        context.put("fields", fields);
        context.put("relations", relations);

        Path target = javaDir.resolve(entity.name() + ".java");
        Files.writeString(target, engine.render("entity.java", context));
        return target;
    }

    private Map<String, Object> fieldContext(EntityMetadata entity, FieldMetadata field, Set<String> classNames) {
        String className = claim(entity, Naming.pascalCase(field.name()), classNames);
        TypeClass typeClass = field.type().typeClass();

        Map<String, Object> context = new HashMap<>();
        context.put("className", className);
        context.put("name", field.name());
        context.put("columnName", field.columnName());
        context.put("scalarType", field.type().name());
        context.put("declaredType", field.declaredType());
        context.put("javaType", field.type().javaType());
        context.put("nullable", field.nullable());
        context.put("unique", field.unique());
        context.put("primaryKey", field.primaryKey());
        // equals(Object) would clash with Object.equals, so unique OPAQUE fields take a Key
        boolean opaque = field.type() == ScalarType.OPAQUE;
        context.put("keyConstructor", field.primaryKey() || (field.unique() && opaque));
        context.put("uniqueValue", field.unique() && !field.primaryKey() && !opaque);
        context.put("modes", typeClass.supportsModes());
        context.put("json", typeClass == TypeClass.JSON);
        context.put("arithmetic", typeClass.supportsArithmetic());
        context.put("operators", operators(field));
        return context;
    }

    /**
     * One generated function per operator the field's type class admits; null checks only for
     * nullable fields.
     */
    private List<Map<String, Object>> operators(FieldMetadata field) {
        List<Map<String, Object>> operators = new ArrayList<>();
        for (Operator operator : field.type().typeClass().operators()) {
            if (operator.isNullCheck() && !field.nullable()) {
                continue;
            }
            Map<String, Object> op = new HashMap<>();
            op.put("method", operator.methodName());
            op.put("operator", operator.name());
            switch (operator.shape()) {
                case VALUE -> {
                    boolean text = operator == Operator.CONTAINS || operator == Operator.STARTS_WITH
                            || operator == Operator.ENDS_WITH;
                    op.put("params", (text ? "String" : field.type().javaType()) + " value");
                    op.put("argument", "value");
                }
                case LIST -> {
                    op.put("params", "List<" + field.type().javaType() + "> values");
                    op.put("argument", "List.copyOf(values)");
                }
                case NONE -> {
                    op.put("params", "");
                    op.put("argument", "null");
                }
                case TEXT -> {
                    op.put("params", "String value");
                    op.put("argument", "value");
                }
                case JSON -> {
                    op.put("params", ScalarType.JSON.javaType() + " value");
                    op.put("argument", "value");
                }
                case JSON_NULL -> {
                    op.put("params", "JsonNullFilter filter");
                    op.put("argument", "filter");
                }
            }
            operators.add(op);
        }
        return operators;
    }

    private Map<String, Object> relationContext(EntityMetadata entity, RelationMetadata relation, Set<String> classNames) {
        Map<String, Object> context = new HashMap<>();
        context.put("className", claim(entity, Naming.pascalCase(relation.name()), classNames));
        context.put("name", relation.name());
        context.put("kind", relation.kind().name());
        context.put("targetEntity", relation.targetEntity());
        context.put("targetTable", relation.targetTable());
        context.put("foreignKeyField", relation.foreignKeyField());
        context.put("foreignKeyColumn", relation.foreignKeyColumn());
        context.put("referencedField", relation.referencedField());
        context.put("referencedColumn", relation.referencedColumn());
        context.put("foreignKeyType", relation.foreignKeyType() == null ? "null" : "ScalarType." + relation.foreignKeyType().name());
        context.put("foreignKeyNullable", relation.foreignKeyNullable());
        context.put("belongsTo", relation.kind() == RelationKind.BELONGS_TO);
        context.put("many", relation.kind() == RelationKind.HAS_MANY);
        context.put("creates", relation.kind() != RelationKind.BELONGS_TO);
        return context;
    }

    private String claim(EntityMetadata entity, String className, Set<String> classNames) {
        if (RESERVED.contains(className)) {
            throw new SchemaException("Entity " + entity.name() + " has a member named " + className
                    + ", which clashes with a type the generated class uses");
        }
        if (!classNames.add(className)) {
            throw new SchemaException("Entity " + entity.name() + " has two members named " + className);
        }
        return className;
    }
}
