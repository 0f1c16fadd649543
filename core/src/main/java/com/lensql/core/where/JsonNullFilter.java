package com.lensql.core.where;

public enum JsonNullFilter {
    /** the column itself is SQL NULL */
    DB_NULL,
    /** the value at the path is JSON null */
    JSON_NULL,
    /** either of the above */
    ANY_NULL
}
