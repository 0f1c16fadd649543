package com.lensql.repositories.rdbms.query;

import com.lensql.core.ContractViolationException;
import com.lensql.core.NotFoundException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.where.SetParam;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.Converters;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Updates the row selected by a unique selector and returns it as stored afterwards.
 *
 * <p>Nested creates run first, then has-many sets, then field changes. Field changes are applied
 * to the fetched row in the order given, so {@code increment} after {@code set} sees the new value.
 */
public class UpdateQuery extends QueryBuilder<Row> {
    private final UniqueWhere where;
    private final List<SetParam> params;

    public UpdateQuery(QueryContext context, EntityMetadata entity, UniqueWhere where, List<SetParam> params) {
        super(context, entity);
        this.where = where;
        this.params = List.copyOf(params);
    }

    @Override
    protected Row run(Transaction tx) {
        Row existing = context.reader().findUnique(tx, entity, where).orElseThrow(() ->
                new NotFoundException("No record found to update"));
        if (params.isEmpty()) {
            return existing;
        }

        RelationWrites relations = new RelationWrites(context, entity);
        for (SetParam param : params) {
            if (param instanceof SetParam.CreateNested nested) {
                relations.createNested(tx, existing, nested);
            }
        }
        for (SetParam param : params) {
            if (param instanceof SetParam.SetRelation set) {
                relations.setRelation(tx, existing, set);
            }
        }

        Row working = new Row(existing);
        Map<String, Object> changes = new LinkedHashMap<>();
        List<DeferredLookup> lookups = new ArrayList<>();
        for (SetParam param : params) {
            if (param instanceof SetParam.Assign assign) {
                FieldMetadata field = entity.requireField(assign.field());
                Object value = Converters.normalize(field.type(), assign.value());
                working.put(field.name(), value);
                changes.put(field.name(), value);
            } else if (param instanceof SetParam.Mutate mutate) {
                FieldMetadata field = entity.requireField(mutate.field());
                if (!field.type().typeClass().supportsArithmetic()) {
                    throw new ContractViolationException("Field " + entity.name() + "." + field.name() + " is not numeric");
                }
                Object value = Converters.mutate(field, working.get(field.name()), mutate.mutation(), mutate.amount());
                working.put(field.name(), value);
                changes.put(field.name(), value);
            } else if (param instanceof SetParam.Connect connect) {
                lookups.add(relations.connect(connect));
            } else if (param instanceof SetParam.Disconnect disconnect) {
                changes.put(relations.disconnect(disconnect), null);
            } else if (!RelationWrites.followsWrite(param)) {
                throw new ContractViolationException("Unsupported write parameter " + param);
            }
        }
        for (DeferredLookup lookup : lookups) {
            lookup.apply(tx, changes);
        }

        String pk = entity.primaryKey().name();
        Object key = existing.get(pk);
        if (!changes.isEmpty()) {
            context.writer().updateByPrimaryKey(tx, entity, key, changes);
        }
        Object current = changes.containsKey(pk) ? changes.get(pk) : key;
        return context.reader().findByPrimaryKey(tx, entity, current).orElseThrow(() ->
                new NotFoundException("Updated " + entity.name() + " row could not be read back"));
    }

    @Override
    protected boolean writes() {
        return true;
    }
}
