package com.lensql.generator.analyze;

import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.Naming;
import com.lensql.core.meta.RelationKind;
import com.lensql.generator.SchemaException;
import com.lensql.generator.schema.EntityDeclaration;
import com.lensql.generator.schema.FieldDeclaration;
import com.lensql.generator.schema.RelationDeclaration;

import java.util.ArrayList;
import java.util.List;

/**
 * First pass: turns one entity declaration into a draft with resolved field types and relation
 * endpoints. Cross-entity facts are left to {@link RelationResolver}.
 */
public class SchemaAnalyzer {

    public EntityDraft analyze(EntityDeclaration declaration) {
        String name = declaration.name();
        if (name == null || name.isBlank()) {
            throw new SchemaException("Entity declaration without a name");
        }
        if (declaration.tableName() == null || declaration.tableName().isBlank()) {
            throw new SchemaException("Entity " + name + " is missing a table name");
        }

        List<FieldMetadata> fields = new ArrayList<>();
        for (FieldDeclaration field : declaration.fields() == null ? List.<FieldDeclaration>of() : declaration.fields()) {
            fields.add(field(name, field));
        }
        long keys = fields.stream().filter(FieldMetadata::primaryKey).count();
        if (keys == 0) {
            throw new SchemaException("Entity " + name + " has no primary key");
        }
        if (keys > 1) {
            throw new SchemaException("Entity " + name + " declares " + keys + " primary keys");
        }

        EntityDraft draft = new EntityDraft(Naming.pascalCase(name), declaration.tableName(), List.copyOf(fields), List.of());
        List<RelationDraft> relations = new ArrayList<>();
        for (RelationDeclaration relation : declaration.relations() == null ? List.<RelationDeclaration>of() : declaration.relations()) {
            relations.add(relation(draft, relation));
        }
        return new EntityDraft(draft.name(), draft.tableName(), draft.fields(), List.copyOf(relations));
    }

    private FieldMetadata field(String entity, FieldDeclaration field) {
        if (field.name() == null || field.name().isBlank()) {
            throw new SchemaException("Entity " + entity + " has a field without a name");
        }
        if (field.type() == null || field.type().isBlank()) {
            throw new SchemaException("Field " + entity + "." + field.name() + " has no type");
        }
        TypeNames.ResolvedType type = TypeNames.resolve(field.type());
        return new FieldMetadata(
                field.name(),
                field.column(),
                type.type(),
                type.declaredType(),
                type.nullable() && !field.primaryKey(),
                field.unique(),
                field.primaryKey());
    }

    private RelationDraft relation(EntityDraft entity, RelationDeclaration relation) {
        String where = "Relation " + entity.name() + "." + relation.name();
        if (relation.name() == null || relation.name().isBlank()) {
            throw new SchemaException("Entity " + entity.name() + " has a relation without a name");
        }
        RelationKind kind = kind(where, relation.kind());
        if (relation.target() == null || relation.target().isBlank()) {
            throw new SchemaException(where + " has no target");
        }
        if (relation.from() == null || relation.to() == null) {
            throw new SchemaException(where + " must declare both 'from' and 'to' columns");
        }

        String from = columnReference(relation.from());
        String to = columnReference(relation.to());
        String target = relation.target().equals("Entity") ? entity.name() : targetEntity(relation.target());
        if (kind == RelationKind.BELONGS_TO) {
            FieldMetadata foreignKey = entity.findField(from).orElseThrow(() ->
                    new SchemaException(where + " references unknown foreign key column '" + from + "'"));
            return new RelationDraft(relation.name(), kind, target, foreignKey.name(), to);
        }
        FieldMetadata referenced = entity.findField(from).orElseThrow(() ->
                new SchemaException(where + " references unknown column '" + from + "'"));
        return new RelationDraft(relation.name(), kind, target, to, referenced.name());
    }

    static RelationKind kind(String where, String keyword) {
        if (keyword == null) {
            throw new SchemaException(where + " has no kind");
        }
        return switch (keyword) {
            case "belongs_to", "belongsTo" -> RelationKind.BELONGS_TO;
            case "has_many", "hasMany" -> RelationKind.HAS_MANY;
            case "has_one", "hasOne" -> RelationKind.HAS_ONE;
            default -> throw new SchemaException(where + " has unknown kind '" + keyword + "'");
        };
    }

    /**
     * {@code super::user::Entity} names the {@code User} entity; a path without the trailing
     * {@code Entity} segment names its last segment. A bare {@code Entity} is a self reference and
     * is handled by the caller.
     */
    static String targetEntity(String target) {
        String[] segments = target.split("::|\\.");
        String last = segments[segments.length - 1];
        if (last.equals("Entity") && segments.length > 1) {
            last = segments[segments.length - 2];
        }
        return Naming.pascalCase(last);
    }

    /**
     * {@code super::post::Column::AuthorId} refers to the {@code author_id} column.
     */
    static String columnReference(String reference) {
        return Naming.snakeCase(Naming.lastSegment(reference));
    }
}
