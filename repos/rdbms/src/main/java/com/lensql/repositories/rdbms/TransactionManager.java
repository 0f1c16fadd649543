package com.lensql.repositories.rdbms;

import com.lensql.core.DatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.function.Function;

/**
 * Hands out connections from a {@link DataSource}, either in auto-commit mode or wrapped in a
 * transaction that commits when the work returns and rolls back when it throws.
 */
public class TransactionManager {
    private static final Logger logger = LoggerFactory.getLogger(TransactionManager.class);

    private final DataSource dataSource;

    public TransactionManager(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public <T> T inTransaction(Function<Transaction, T> work) {
        Connection conn = null;
        try {
            conn = dataSource.getConnection();
            conn.setAutoCommit(false);
            T result = work.apply(new Transaction(conn, true));
            conn.commit();
            return result;
        } catch (SQLException e) {
            rollback(conn, e);
            logger.error("Transaction failed: {}", e.getMessage(), e);
            throw new DatabaseException("Transaction failed", e);
        } catch (RuntimeException e) {
            rollback(conn, e);
            throw e;
        } finally {
            if (conn != null) {
                try {
                    conn.setAutoCommit(true);
                    conn.close();
                } catch (SQLException closeException) {
                    logger.error("Failed to close connection", closeException);
                }
            }
        }
    }

    public <T> T withConnection(Function<Transaction, T> work) {
        try (Connection conn = dataSource.getConnection()) {
            return work.apply(new Transaction(conn, false));
        } catch (SQLException e) {
            logger.error("Failed to obtain connection: {}", e.getMessage(), e);
            throw new DatabaseException("Failed to obtain connection", e);
        }
    }

    private void rollback(Connection conn, Exception cause) {
        if (conn == null) {
            return;
        }
        logger.warn("Rolling back transaction: {}", cause.getMessage());
        try {
            conn.rollback();
        } catch (SQLException rollbackException) {
            logger.error("Failed to rollback transaction", rollbackException);
            cause.addSuppressed(rollbackException);
        }
    }
}
