package com.lensql.core.where;

import java.util.Arrays;
import java.util.List;

public class RelationRef {
    private final String relation;

    public RelationRef(String relation) {
        this.relation = relation;
    }

    public WhereParam some(WhereParam... params) {
        return new WhereParam.RelationPredicate(relation, WhereParam.Quantifier.SOME, Arrays.asList(params));
    }

    public WhereParam every(WhereParam... params) {
        return new WhereParam.RelationPredicate(relation, WhereParam.Quantifier.EVERY, Arrays.asList(params));
    }

    public WhereParam none(WhereParam... params) {
        return new WhereParam.RelationPredicate(relation, WhereParam.Quantifier.NONE, Arrays.asList(params));
    }

    public RelationFilter fetch() {
        return RelationFilter.of(relation);
    }

    public IncludeBuilder include() {
        return IncludeBuilder.of(relation);
    }

    public SetParam connect(UniqueWhere target) {
        return SetParam.connect(relation, target);
    }

    public SetParam disconnect() {
        return SetParam.disconnect(relation);
    }

    public SetParam set(List<UniqueWhere> targets) {
        return SetParam.set(relation, targets);
    }

    @SafeVarargs
    public final SetParam create(List<SetParam>... children) {
        return SetParam.create(relation, Arrays.asList(children));
    }
}
