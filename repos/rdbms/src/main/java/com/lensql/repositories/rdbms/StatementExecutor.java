package com.lensql.repositories.rdbms;

import com.lensql.core.DatabaseException;
import com.lensql.core.Row;
import com.lensql.repositories.rdbms.sql.SqlFragment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs rendered statements on a transaction's connection. Driver failures surface as
 * {@link DatabaseException} with the original {@link SQLException} as cause.
 */
public class StatementExecutor {
    private static final Logger logger = LoggerFactory.getLogger(StatementExecutor.class);

    private final Dialect dialect;

    public StatementExecutor(Dialect dialect) {
        this.dialect = dialect;
    }

    @FunctionalInterface
    public interface RowMapper {
        Row map(ResultSet rs) throws SQLException;
    }

    public List<Row> query(Transaction tx, SqlFragment statement, RowMapper mapper) {
        logger.debug("SQL: {} {}", statement.sql(), statement.params());
        Connection conn = tx.connection();
        try (PreparedStatement stmt = prepare(conn, statement);
             ResultSet rs = stmt.executeQuery()) {
            List<Row> rows = new ArrayList<>();
            while (rs.next()) {
                rows.add(mapper.map(rs));
            }
            return rows;
        } catch (SQLException e) {
            logger.error("Error executing query: {}", e.getMessage(), e);
            throw new DatabaseException("Error executing query: " + e.getMessage(), e);
        }
    }

    /**
     * Runs a statement expected to return a single numeric column, such as a count.
     */
    public long queryLong(Transaction tx, SqlFragment statement) {
        logger.debug("SQL: {} {}", statement.sql(), statement.params());
        try (PreparedStatement stmt = prepare(tx.connection(), statement);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        } catch (SQLException e) {
            logger.error("Error executing query: {}", e.getMessage(), e);
            throw new DatabaseException("Error executing query: " + e.getMessage(), e);
        }
    }

    public long update(Transaction tx, SqlFragment statement) {
        logger.debug("SQL: {} {}", statement.sql(), statement.params());
        try (PreparedStatement stmt = prepare(tx.connection(), statement)) {
            return stmt.executeUpdate();
        } catch (SQLException e) {
            logger.error("Error executing update: {}", e.getMessage(), e);
            throw new DatabaseException("Error executing update: " + e.getMessage(), e);
        }
    }

    private PreparedStatement prepare(Connection conn, SqlFragment statement) throws SQLException {
        PreparedStatement stmt = conn.prepareStatement(statement.sql());
        try {
            for (int i = 0; i < statement.params().size(); i++) {
                dialect.bind(stmt, i + 1, statement.params().get(i));
            }
            return stmt;
        } catch (SQLException | RuntimeException e) {
            stmt.close();
            throw e;
        }
    }
}
