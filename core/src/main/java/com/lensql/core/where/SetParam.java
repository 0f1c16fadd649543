package com.lensql.core.where;

import java.util.List;

/**
 * One write instruction for create, update or upsert. Field assignments and arithmetic apply in
 * the order given; relation instructions run inside the same transaction as the write.
 */
public interface SetParam {

    record Assign(String field, Object value) implements SetParam {
    }

    record Mutate(String field, NumericMutation mutation, Number amount) implements SetParam {
    }

    /**
     * Points a BelongsTo relation at the row selected by {@code target}. Resolved lazily, right
     * before the write executes.
     */
    record Connect(String relation, UniqueWhere target) implements SetParam {
    }

    /**
     * Clears a nullable BelongsTo relation.
     */
    record Disconnect(String relation) implements SetParam {
    }

    /**
     * Replaces the children of a HasMany relation with exactly {@code targets}.
     */
    record SetRelation(String relation, List<UniqueWhere> targets) implements SetParam {
        public SetRelation {
            targets = List.copyOf(targets);
        }
    }

    /**
     * Creates children of a HasMany or HasOne relation after the parent row is written.
     */
    record CreateNested(String relation, List<List<SetParam>> children) implements SetParam {
        public CreateNested {
            children = List.copyOf(children);
        }
    }

    static SetParam assign(String field, Object value) {
        return new Assign(field, value);
    }

    static SetParam increment(String field, Number amount) {
        return new Mutate(field, NumericMutation.INCREMENT, amount);
    }

    static SetParam decrement(String field, Number amount) {
        return new Mutate(field, NumericMutation.DECREMENT, amount);
    }

    static SetParam multiply(String field, Number amount) {
        return new Mutate(field, NumericMutation.MULTIPLY, amount);
    }

    static SetParam divide(String field, Number amount) {
        return new Mutate(field, NumericMutation.DIVIDE, amount);
    }

    static SetParam connect(String relation, UniqueWhere target) {
        return new Connect(relation, target);
    }

    static SetParam disconnect(String relation) {
        return new Disconnect(relation);
    }

    static SetParam set(String relation, List<UniqueWhere> targets) {
        return new SetRelation(relation, targets);
    }

    static SetParam create(String relation, List<List<SetParam>> children) {
        return new CreateNested(relation, children);
    }
}
