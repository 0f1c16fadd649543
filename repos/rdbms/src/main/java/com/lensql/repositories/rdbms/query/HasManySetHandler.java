package com.lensql.repositories.rdbms.query;

import com.lensql.core.ContractViolationException;
import com.lensql.core.NotFoundException;
import com.lensql.core.Row;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.core.where.Condition;
import com.lensql.core.where.Operator;
import com.lensql.core.where.QueryMode;
import com.lensql.core.where.SetParam;
import com.lensql.core.where.UniqueWhere;
import com.lensql.repositories.rdbms.QueryContext;
import com.lensql.repositories.rdbms.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Makes the children of a has-many relation exactly a given set of rows. Children outside the set
 * are detached when the foreign key is nullable and deleted otherwise; the set is then attached to
 * the parent. Running it twice with the same set changes nothing the second time.
 */
public class HasManySetHandler {
    private static final Logger logger = LoggerFactory.getLogger(HasManySetHandler.class);

    private final QueryContext context;

    public HasManySetHandler(QueryContext context) {
        this.context = context;
    }

    public void apply(Transaction tx, EntityMetadata parent, Row parentRow, RelationMetadata relation,
                      List<UniqueWhere> targets) {
        if (relation.kind() != RelationKind.HAS_MANY) {
            throw new ContractViolationException("Relation " + parent.name() + "." + relation.name() + " is not has-many");
        }
        EntityMetadata child = context.entities().require(relation.targetEntity());
        FieldMetadata foreignKey = child.requireField(relation.foreignKeyField());
        FieldMetadata childKey = child.primaryKey();
        Object parentKey = parentRow.get(relation.referencedField());

        List<Object> keep = new ArrayList<>();
        for (UniqueWhere target : targets) {
            Row row = context.reader().findUnique(tx, child, target).orElseThrow(() -> new NotFoundException(
                    "No " + child.name() + " found where " + target.field() + " = " + target.key()));
            keep.add(row.get(childKey.name()));
        }

        List<Condition> outside = new ArrayList<>();
        outside.add(comparison(foreignKey, Operator.EQUALS, parentKey));
        if (!keep.isEmpty()) {
            outside.add(comparison(childKey, Operator.NOT_IN, keep));
        }
        Condition stale = new Condition.All(outside);

        long removed;
        if (relation.foreignKeyNullable()) {
            removed = context.writer().update(tx, child, stale, List.of(SetParam.assign(foreignKey.name(), null)));
        } else {
            removed = context.writer().delete(tx, child, stale);
        }

        long attached = 0;
        if (!keep.isEmpty()) {
            attached = context.writer().update(tx, child, comparison(childKey, Operator.IN, keep),
                    List.of(SetParam.assign(foreignKey.name(), parentKey)));
        }
        logger.debug("Set {}.{}: {} detached, {} attached", parent.name(), relation.name(), removed, attached);
    }

    private static Condition comparison(FieldMetadata field, Operator op, Object operand) {
        return new Condition.Comparison(field, op, operand, QueryMode.DEFAULT, List.of());
    }
}
