package com.lensql.core;

import java.sql.SQLException;

/**
 * Wraps a driver failure. The original {@link SQLException} is kept as the cause.
 */
public class DatabaseException extends LensException {
    private final String sqlState;

    public DatabaseException(String message, SQLException cause) {
        super(message, cause);
        this.sqlState = cause.getSQLState();
    }

    public String sqlState() {
        return sqlState;
    }

    public SQLException sqlException() {
        return (SQLException) getCause();
    }
}
