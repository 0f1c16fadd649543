package com.lensql.repositories.rdbms.query;

import com.lensql.core.Row;

public record BatchResult(BatchQuery.Kind kind, Row row) {
}
