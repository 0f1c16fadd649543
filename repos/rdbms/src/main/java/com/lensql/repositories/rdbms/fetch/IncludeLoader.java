package com.lensql.repositories.rdbms.fetch;

import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.core.where.RelationFilter;
import com.lensql.repositories.rdbms.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Attaches included relations to already loaded rows. Many relations are stored as a list, single
 * relations as a row or null; counts go into the {@link Row#COUNT} row.
 */
public class IncludeLoader {
    private static final Logger logger = LoggerFactory.getLogger(IncludeLoader.class);

    private final CompositeRegistry registry;

    public IncludeLoader(CompositeRegistry registry) {
        this.registry = registry;
    }

    public void load(Transaction tx, EntityMetadata entity, List<Row> rows, List<RelationFilter> includes) {
        for (RelationFilter include : includes) {
            RelationMetadata relation = entity.requireRelation(include.relation());
            EntityFetcher fetcher = registry.fetcher(relation.targetEntity());
            logger.debug("Including {}.{} for {} rows", entity.name(), relation.name(), rows.size());
            for (Row row : rows) {
                load(tx, relation, fetcher, row, include);
            }
        }
    }

    private void load(Transaction tx, RelationMetadata relation, EntityFetcher fetcher, Row row, RelationFilter include) {
        if (relation.kind() == RelationKind.BELONGS_TO) {
            Object foreignKey = row.get(relation.foreignKeyField());
            if (foreignKey == null) {
                row.put(relation.name(), null);
                return;
            }
            Object key = registry.fieldValue(relation.targetEntity(), relation.referencedField(), foreignKey);
            List<Row> related = fetcher.fetchByField(tx, relation.referencedField(), key, include);
            row.put(relation.name(), related.isEmpty() ? null : related.get(0));
            return;
        }

        Object parentKey = row.get(relation.referencedField());
        Object key = registry.fieldValue(relation.targetEntity(), relation.foreignKeyField(), parentKey);
        List<Row> related = key == null ? List.of() : fetcher.fetchByField(tx, relation.foreignKeyField(), key, include);
        if (relation.isMany()) {
            row.put(relation.name(), related);
        } else {
            row.put(relation.name(), related.isEmpty() ? null : related.get(0));
        }

        if (include.includeCount()) {
            Row counts = row.getRow(Row.COUNT);
            if (counts == null) {
                counts = new Row();
                row.put(Row.COUNT, counts);
            }
            counts.put(relation.name(), key == null ? 0L : fetcher.countByField(tx, relation.foreignKeyField(), key, include));
        }
    }
}
