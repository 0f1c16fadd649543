package com.lensql.repositories.rdbms;

import com.lensql.core.DatabaseException;
import com.lensql.core.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class TransactionManagerTest {
    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    private TransactionManager manager;

    @BeforeEach
    public void setUp() throws SQLException {
        when(dataSource.getConnection()).thenReturn(connection);
        manager = new TransactionManager(dataSource);
    }

    @Test
    public void commitsWhenWorkReturns() throws SQLException {
        String result = manager.inTransaction(tx -> {
            assertTrue(tx.isTransactional());
            assertSame(connection, tx.connection());
            return "done";
        });

        assertEquals("done", result);
        InOrder order = inOrder(connection);
        order.verify(connection).setAutoCommit(false);
        order.verify(connection).commit();
        order.verify(connection).close();
        verify(connection, never()).rollback();
    }

    @Test
    public void rollsBackWhenWorkThrows() throws SQLException {
        NotFoundException thrown = assertThrows(NotFoundException.class, () ->
                manager.inTransaction(tx -> {
                    throw new NotFoundException("No record found to update");
                }));

        assertEquals("No record found to update", thrown.getMessage());
        verify(connection).rollback();
        verify(connection, never()).commit();
        verify(connection).close();
    }

    @Test
    public void failedRollbackIsSuppressedOnTheOriginalError() throws SQLException {
        doThrow(new SQLException("connection reset")).when(connection).rollback();

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () ->
                manager.inTransaction(tx -> {
                    throw new IllegalStateException("boom");
                }));

        assertEquals(1, thrown.getSuppressed().length);
        assertEquals("connection reset", thrown.getSuppressed()[0].getMessage());
    }

    @Test
    public void commitFailureBecomesDatabaseException() throws SQLException {
        doThrow(new SQLException("serialization failure", "40001")).when(connection).commit();

        DatabaseException thrown = assertThrows(DatabaseException.class, () -> manager.inTransaction(tx -> 1));

        assertEquals("40001", thrown.sqlState());
        verify(connection).rollback();
    }

    @Test
    public void readsRunInAutoCommit() throws SQLException {
        boolean transactional = manager.withConnection(Transaction::isTransactional);

        assertFalse(transactional);
        verify(connection, never()).setAutoCommit(false);
        verify(connection).close();
    }
}
