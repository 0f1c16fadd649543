package com.lensql.repositories.rdbms;

import java.sql.Connection;

/**
 * A connection borrowed for one unit of work. Statements issued through the same transaction run
 * sequentially on the same connection.
 */
public class Transaction {
    private final Connection connection;
    private final boolean transactional;

    Transaction(Connection connection, boolean transactional) {
        this.connection = connection;
        this.transactional = transactional;
    }

    public Connection connection() {
        return connection;
    }

    /**
     * False for the auto-commit connections reads run on.
     */
    public boolean isTransactional() {
        return transactional;
    }
}
