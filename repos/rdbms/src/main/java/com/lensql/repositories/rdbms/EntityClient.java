package com.lensql.repositories.rdbms;

import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.where.SetParam;
import com.lensql.core.where.UniqueWhere;
import com.lensql.core.where.WhereParam;
import com.lensql.repositories.rdbms.query.AggregateQuery;
import com.lensql.repositories.rdbms.query.CountQuery;
import com.lensql.repositories.rdbms.query.CreateManyQuery;
import com.lensql.repositories.rdbms.query.CreateQuery;
import com.lensql.repositories.rdbms.query.DeleteManyQuery;
import com.lensql.repositories.rdbms.query.DeleteQuery;
import com.lensql.repositories.rdbms.query.FindFirstQuery;
import com.lensql.repositories.rdbms.query.FindManyQuery;
import com.lensql.repositories.rdbms.query.FindUniqueQuery;
import com.lensql.repositories.rdbms.query.GroupByQuery;
import com.lensql.repositories.rdbms.query.UpdateManyQuery;
import com.lensql.repositories.rdbms.query.UpdateQuery;
import com.lensql.repositories.rdbms.query.UpsertQuery;

import java.util.List;

/**
 * Entry point for queries against one entity. Every method returns a fresh single-use builder.
 */
public class EntityClient {
    private final QueryContext context;
    private final EntityMetadata entity;

    public EntityClient(QueryContext context, EntityMetadata entity) {
        this.context = context;
        this.entity = entity;
    }

    public EntityMetadata metadata() {
        return entity;
    }

    public FindUniqueQuery findUnique(UniqueWhere where) {
        return new FindUniqueQuery(context, entity, where);
    }

    public FindFirstQuery findFirst(WhereParam... where) {
        return new FindFirstQuery(context, entity, List.of(where));
    }

    public FindManyQuery findMany(WhereParam... where) {
        return new FindManyQuery(context, entity, List.of(where));
    }

    public CreateQuery create(SetParam... params) {
        return create(List.of(params));
    }

    public CreateQuery create(List<SetParam> params) {
        return new CreateQuery(context, entity, params);
    }

    public CreateManyQuery createMany(List<List<SetParam>> rows) {
        return new CreateManyQuery(context, entity, rows);
    }

    public UpdateQuery update(UniqueWhere where, SetParam... params) {
        return update(where, List.of(params));
    }

    public UpdateQuery update(UniqueWhere where, List<SetParam> params) {
        return new UpdateQuery(context, entity, where, params);
    }

    public UpdateManyQuery updateMany(List<WhereParam> where, List<SetParam> changes) {
        return new UpdateManyQuery(context, entity, where, changes);
    }

    public DeleteQuery delete(UniqueWhere where) {
        return new DeleteQuery(context, entity, where);
    }

    public DeleteManyQuery deleteMany(WhereParam... where) {
        return new DeleteManyQuery(context, entity, List.of(where));
    }

    /**
     * {@code create} is used on its own when no row matches {@code where}; {@code update} applies
     * otherwise.
     */
    public UpsertQuery upsert(UniqueWhere where, List<SetParam> create, List<SetParam> update) {
        return new UpsertQuery(context, entity, where, create, update);
    }

    public CountQuery count(WhereParam... where) {
        return new CountQuery(context, entity, List.of(where));
    }

    public AggregateQuery aggregate(WhereParam... where) {
        return new AggregateQuery(context, entity, List.of(where));
    }

    public GroupByQuery groupBy(List<String> by, WhereParam... where) {
        return new GroupByQuery(context, entity, by, List.of(where));
    }
}
