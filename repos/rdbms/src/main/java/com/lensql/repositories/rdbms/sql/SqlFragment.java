package com.lensql.repositories.rdbms.sql;

import java.util.ArrayList;
import java.util.List;

/**
 * A piece of SQL together with the parameters its placeholders bind, in order.
 */
public record SqlFragment(String sql, List<SqlParam> params) {
    public static final SqlFragment TRUE = of("1=1");
    public static final SqlFragment FALSE = of("1=0");

    public SqlFragment {
        params = List.copyOf(params);
    }

    public static SqlFragment of(String sql, SqlParam... params) {
        return new SqlFragment(sql, List.of(params));
    }

    public static SqlFragment join(String separator, List<SqlFragment> fragments) {
        StringBuilder sql = new StringBuilder();
        List<SqlParam> params = new ArrayList<>();
        for (int i = 0; i < fragments.size(); i++) {
            if (i > 0) {
                sql.append(separator);
            }
            sql.append(fragments.get(i).sql());
            params.addAll(fragments.get(i).params());
        }
        return new SqlFragment(sql.toString(), params);
    }

    public SqlFragment wrap(String prefix, String suffix) {
        return new SqlFragment(prefix + sql + suffix, params);
    }
}
