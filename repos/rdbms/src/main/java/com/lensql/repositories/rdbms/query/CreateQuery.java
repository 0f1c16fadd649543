package com.lensql.repositories.rdbms.query;

import com.lensql.core.ContractViolationException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.SetParam;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inserts one row. Connected relations are looked up first, in the order given; nested creates and
 * has-many sets run after the insert. All of it shares one transaction.
 */
public class CreateQuery extends QueryBuilder<Row> {
    private static final Logger logger = LoggerFactory.getLogger(CreateQuery.class);

    private final List<SetParam> params = new ArrayList<>();

    public CreateQuery(QueryContext context, EntityMetadata entity, List<SetParam> params) {
        super(context, entity);
        this.params.addAll(params);
    }

    public CreateQuery with(SetParam... more) {
        checkNotConsumed();
        params.addAll(Arrays.asList(more));
        return this;
    }

    @Override
    protected Row run(Transaction tx) {
        RelationWrites relations = new RelationWrites(context, entity);
        Map<String, Object> values = new LinkedHashMap<>();
        List<DeferredLookup> lookups = new ArrayList<>();
        List<SetParam> followUps = new ArrayList<>();

        for (SetParam param : params) {
            if (param instanceof SetParam.Assign assign) {
                entity.requireField(assign.field());
                values.put(assign.field(), assign.value());
            } else if (param instanceof SetParam.Mutate mutate) {
                throw new ContractViolationException("Cannot apply " + mutate.mutation() + " to "
                        + entity.name() + "." + mutate.field() + " on a row that does not exist yet");
            } else if (param instanceof SetParam.Connect connect) {
                lookups.add(relations.connect(connect));
            } else if (param instanceof SetParam.Disconnect disconnect) {
                values.put(relations.disconnect(disconnect), null);
            } else if (RelationWrites.followsWrite(param)) {
                followUps.add(param);
            } else {
                throw new ContractViolationException("Unsupported write parameter " + param);
            }
        }

        for (DeferredLookup lookup : lookups) {
            lookup.apply(tx, values);
        }
        Row row = context.writer().insert(tx, entity, values);
        logger.debug("Created {} {}", entity.name(), row.get(entity.primaryKey().name()));

        for (SetParam followUp : followUps) {
            if (followUp instanceof SetParam.CreateNested nested) {
                relations.createNested(tx, row, nested);
            } else {
                relations.setRelation(tx, row, (SetParam.SetRelation) followUp);
            }
        }
        return row;
    }

    @Override
    protected boolean writes() {
        return true;
    }
}
