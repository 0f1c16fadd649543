package com.lensql.core.where;

import com.lensql.core.ContractViolationException;
import com.lensql.core.meta.EntityMetadata;
import com.lensql.core.meta.EntityRegistry;
import com.lensql.core.meta.FieldMetadata;
import com.lensql.core.meta.RelationKind;
import com.lensql.core.meta.RelationMetadata;
import com.lensql.core.meta.TypeClass;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles predicate lists into {@link Condition} trees.
 *
 * <p>Modes and JSON paths are gathered from the whole list first and then applied to every
 * predicate on the same field, regardless of where they appear in the list. Relation quantifiers
 * become correlated existence checks joined on the relation's foreign key:
 * <ul>
 *     <li>some: at least one related row matches</li>
 *     <li>every: no related row fails to match</li>
 *     <li>none: no related row matches</li>
 * </ul>
 */
public class ConditionResolver {
    private final EntityRegistry registry;

    public ConditionResolver(EntityRegistry registry) {
        this.registry = registry;
    }

    public Condition resolve(EntityMetadata entity, List<WhereParam> params) {
        List<Condition> conditions = compileEach(entity, params);
        return conditions.size() == 1 ? conditions.get(0) : new Condition.All(conditions);
    }

    /**
     * One condition per predicate of {@code params}, mode and path markers excluded. Modes and
     * paths are collected from {@code params} before any predicate is compiled.
     */
    private List<Condition> compileEach(EntityMetadata entity, List<WhereParam> params) {
        Map<String, QueryMode> modes = new HashMap<>();
        Map<String, List<String>> paths = new HashMap<>();
        for (WhereParam param : params) {
            if (param instanceof WhereParam.ModeParam mode) {
                FieldMetadata field = entity.requireField(mode.field());
                if (!field.type().typeClass().supportsModes()) {
                    throw new ContractViolationException("Field " + entity.name() + "." + field.name()
                            + " does not accept a query mode");
                }
                modes.put(mode.field(), mode.mode());
            } else if (param instanceof WhereParam.JsonPathParam path) {
                FieldMetadata field = entity.requireField(path.field());
                if (field.type().typeClass() != TypeClass.JSON) {
                    throw new ContractViolationException("Field " + entity.name() + "." + field.name()
                            + " is not a JSON field");
                }
                paths.put(path.field(), path.path());
            }
        }

        List<Condition> conditions = new ArrayList<>();
        for (WhereParam param : params) {
            Condition condition = compile(entity, param, modes, paths);
            if (condition != null) {
                conditions.add(condition);
            }
        }
        return conditions;
    }

    public Condition unique(EntityMetadata entity, UniqueWhere where) {
        FieldMetadata field = entity.requireField(where.field());
        if (!field.identifying()) {
            throw new ContractViolationException("Field " + entity.name() + "." + field.name()
                    + " is neither a primary key nor unique");
        }
        return new Condition.Comparison(field, Operator.EQUALS, where.key(), QueryMode.DEFAULT, List.of());
    }

    private Condition compile(EntityMetadata entity, WhereParam param,
                              Map<String, QueryMode> modes, Map<String, List<String>> paths) {
        if (param instanceof WhereParam.FieldPredicate predicate) {
            return comparison(entity, predicate, modes, paths);
        }
        if (param instanceof WhereParam.ModeParam || param instanceof WhereParam.JsonPathParam) {
            return null;
        }
        if (param instanceof WhereParam.Logical logical) {
            return switch (logical.op()) {
                case AND -> resolve(entity, logical.params());
                case OR -> new Condition.Any(compileEach(entity, logical.params()));
                case NOT -> new Condition.Not(resolve(entity, logical.params()));
            };
        }
        if (param instanceof WhereParam.RelationPredicate relation) {
            return exists(entity, relation);
        }
        throw new ContractViolationException("Unsupported predicate " + param);
    }

    private Condition comparison(EntityMetadata entity, WhereParam.FieldPredicate predicate,
                                 Map<String, QueryMode> modes, Map<String, List<String>> paths) {
        FieldMetadata field = entity.requireField(predicate.field());
        Operator op = predicate.op().operator();
        if (!field.type().typeClass().allows(op)) {
            throw new ContractViolationException("Operator " + op + " is not allowed on "
                    + entity.name() + "." + field.name() + " (" + field.type() + ")");
        }
        if (op.isNullCheck() && !field.nullable()) {
            throw new ContractViolationException("Field " + entity.name() + "." + field.name() + " is not nullable");
        }
        return new Condition.Comparison(
                field,
                op,
                predicate.op().operand(),
                modes.getOrDefault(field.name(), QueryMode.DEFAULT),
                paths.getOrDefault(field.name(), List.of()));
    }

    private Condition exists(EntityMetadata entity, WhereParam.RelationPredicate predicate) {
        RelationMetadata relation = entity.requireRelation(predicate.relation());
        EntityMetadata target = registry.require(relation.targetEntity());

        String innerColumn;
        String outerColumn;
        if (relation.kind() == RelationKind.BELONGS_TO) {
            innerColumn = relation.referencedColumn();
            outerColumn = relation.foreignKeyColumn();
        } else {
            innerColumn = relation.foreignKeyColumn();
            outerColumn = relation.referencedColumn();
        }

        Condition filter = resolve(target, predicate.params());
        return switch (predicate.quantifier()) {
            case SOME -> new Condition.Exists(target.tableName(), innerColumn, outerColumn, filter, false);
            case EVERY -> new Condition.Exists(target.tableName(), innerColumn, outerColumn, new Condition.Not(filter), true);
            case NONE -> new Condition.Exists(target.tableName(), innerColumn, outerColumn, filter, true);
        };
    }
}
