package com.lensql.core.where;

public enum SortOrder {
    ASC,
    DESC;

    public SortOrder reverse() {
        return this == ASC ? DESC : ASC;
    }
}
