package com.lensql.generator.analyze;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.Naming;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.generator.SchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Second pass: with every draft in hand, fills in target tables and foreign-key details that the
 * first pass could not see. Forward and self references are fine.
 *
 * <p>Targets outside the compilation unit are tolerated: their table falls back to the snake_case
 * entity name and the foreign-key type stays unknown.
 */
public class RelationResolver {
    private static final Logger logger = LoggerFactory.getLogger(RelationResolver.class);

    public EntityRegistry resolve(List<EntityDraft> drafts) {
        Map<String, EntityDraft> byName = new LinkedHashMap<>();
        for (EntityDraft draft : drafts) {
            if (byName.put(draft.name(), draft) != null) {
                throw new SchemaException("Entity " + draft.name() + " is declared twice");
            }
        }

        List<EntityMetadata> entities = new ArrayList<>();
        for (EntityDraft draft : drafts) {
            List<RelationMetadata> relations = new ArrayList<>();
            for (RelationDraft relation : draft.relations()) {
                relations.add(resolve(draft, relation, find(byName, relation.targetEntity())));
            }
            entities.add(new EntityMetadata(draft.name(), draft.tableName(), draft.fields(), relations));
        }
        return new EntityRegistry(entities);
    }

    private Optional<EntityDraft> find(Map<String, EntityDraft> byName, String name) {
        EntityDraft exact = byName.get(name);
        if (exact != null) {
            return Optional.of(exact);
        }
        return byName.values().stream().filter(d -> d.name().equalsIgnoreCase(name)).findFirst();
    }

    private RelationMetadata resolve(EntityDraft owner, RelationDraft relation, Optional<EntityDraft> target) {
        String where = "Relation " + owner.name() + "." + relation.name();
        if (target.isEmpty()) {
            logger.warn("{} targets {} which is not part of this schema", where, relation.targetEntity());
            return external(owner, relation);
        }

        EntityDraft other = target.get();
        if (relation.kind().ownsForeignKey()) {
            FieldMetadata foreignKey = owner.findField(relation.foreignKeyField()).orElseThrow();
            FieldMetadata referenced = other.findField(relation.referencedField()).orElseThrow(() ->
                    new SchemaException(where + " references unknown column '" + relation.referencedField()
                            + "' on " + other.name()));
            return new RelationMetadata(relation.name(), relation.kind(), other.name(), other.tableName(),
                    foreignKey.name(), foreignKey.columnName(), referenced.name(), referenced.columnName(),
                    foreignKey.type(), foreignKey.nullable());
        }

        FieldMetadata foreignKey = other.findField(relation.foreignKeyField()).orElseThrow(() ->
                new SchemaException(where + " references unknown foreign key column '" + relation.foreignKeyField()
                        + "' on " + other.name()));
        FieldMetadata referenced = owner.findField(relation.referencedField()).orElseThrow();
        return new RelationMetadata(relation.name(), relation.kind(), other.name(), other.tableName(),
                foreignKey.name(), foreignKey.columnName(), referenced.name(), referenced.columnName(),
                foreignKey.type(), foreignKey.nullable());
    }

    private RelationMetadata external(EntityDraft owner, RelationDraft relation) {
        String table = Naming.snakeCase(relation.targetEntity());
        if (relation.kind().ownsForeignKey()) {
            FieldMetadata foreignKey = owner.findField(relation.foreignKeyField()).orElseThrow();
            return new RelationMetadata(relation.name(), relation.kind(), relation.targetEntity(), table,
                    foreignKey.name(), foreignKey.columnName(), relation.referencedField(), relation.referencedField(),
                    foreignKey.type(), foreignKey.nullable());
        }
        FieldMetadata referenced = owner.findField(relation.referencedField()).orElseThrow();
        return new RelationMetadata(relation.name(), relation.kind(), relation.targetEntity(), table,
                relation.foreignKeyField(), relation.foreignKeyField(), referenced.name(), referenced.columnName(),
                null, false);
    }
}
