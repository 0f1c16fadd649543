package com.lensql.repositories.rdbms.query;

import com.lensql.core.ContractViolationException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.core.where.SetParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;
import com.lensql.repositories.rdbms.fetch.EntityFetcher;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns relation write instructions of one entity into foreign-key assignments and follow-up
 * writes.
 */
class RelationWrites {
    private final QueryContext context;
    private final EntityMetadata entity;

    RelationWrites(QueryContext context, EntityMetadata entity) {
        this.context = context;
        this.entity = entity;
    }

    DeferredLookup connect(SetParam.Connect connect) {
        RelationMetadata relation = belongsTo(connect.relation());
        EntityFetcher fetcher = context.registry().fetcher(relation.targetEntity());
        return new DeferredLookup(relation.targetEntity(), connect.target(), fetcher::findUnique,
                (values, row) -> values.put(relation.foreignKeyField(), row.get(relation.referencedField())));
    }

    /**
     * Foreign-key field to clear.
     */
    String disconnect(SetParam.Disconnect disconnect) {
        RelationMetadata relation = belongsTo(disconnect.relation());
        if (!relation.foreignKeyNullable()) {
            throw new ContractViolationException("Relation " + entity.name() + "." + relation.name()
                    + " cannot be disconnected, its foreign key is required");
        }
        return relation.foreignKeyField();
    }

    /**
     * Whether {@code param} must run once the parent row exists.
     */
    static boolean followsWrite(SetParam param) {
        return param instanceof SetParam.SetRelation || param instanceof SetParam.CreateNested;
    }

    void createNested(Transaction tx, Row parent, SetParam.CreateNested nested) {
        RelationMetadata relation = entity.requireRelation(nested.relation());
        if (relation.kind() == RelationKind.BELONGS_TO) {
            throw new ContractViolationException("Nested create needs a has-many or has-one relation, "
                    + entity.name() + "." + relation.name() + " is belongs-to");
        }
        EntityMetadata child = context.entities().require(relation.targetEntity());
        Object parentKey = parent.get(relation.referencedField());
        for (List<SetParam> childParams : nested.children()) {
            List<SetParam> params = new ArrayList<>(childParams);
            params.add(SetParam.assign(relation.foreignKeyField(), parentKey));
            new CreateQuery(context, child, params).execIn(tx);
        }
    }

    void setRelation(Transaction tx, Row parent, SetParam.SetRelation set) {
        RelationMetadata relation = entity.requireRelation(set.relation());
        new HasManySetHandler(context).apply(tx, entity, parent, relation, set.targets());
    }

    private RelationMetadata belongsTo(String name) {
        RelationMetadata relation = entity.requireRelation(name);
        if (relation.kind() != RelationKind.BELONGS_TO) {
            throw new ContractViolationException("Relation " + entity.name() + "." + name + " is not belongs-to");
        }
        return relation;
    }
}
