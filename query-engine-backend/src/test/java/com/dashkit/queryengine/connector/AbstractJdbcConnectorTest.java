package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.exception.ConnectionException;
import com.dashkit.queryengine.exception.QueryExecutionException;
import com.dashkit.queryengine.model.ColumnType;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.ConnectorResult;
import com.dashkit.queryengine.model.DataSourceType;
import com.dashkit.queryengine.model.QueryExecutionContext;
import com.dashkit.queryengine.model.SchemaInfo;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class AbstractJdbcConnectorTest {

    private ExecutorService executor;
    private Connection connection;
    private Statement statement;

    @BeforeEach
    public void setup() throws Exception {
        executor = Executors.newCachedThreadPool();
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);
    }

    @AfterEach
    public void teardown() {
        executor.shutdownNow();
    }

    private static ConnectionConfig config() {
        return ConnectionConfig.builder().id("stub").type(DataSourceType.DUCKDB).name("stub").build();
    }

    private static class StubConnector extends AbstractJdbcConnector {
        private final Connection connection;
        private SQLException connectFailure;

        StubConnector(Connection connection, ExecutorService executor) {
            super(config(), DuckDbConnector.TYPE_MAPPING, executor);
            this.connection = connection;
        }

        @Override
        protected void doConnect() throws SQLException {
            if (connectFailure != null) {
                throw connectFailure;
            }
        }

        @Override
        protected Connection borrowConnection() {
            return connection;
        }

        @Override
        protected void doClose() {
        }

        @Override
        protected SchemaInfo readSchema(Connection connection) {
            return new SchemaInfo(List.of());
        }
    }

    @Test
    public void testTimeoutCancelsRunningStatement() throws Exception {
        CountDownLatch cancelled = new CountDownLatch(1);
        when(statement.execute(anyString())).thenAnswer(invocation -> {
            cancelled.await(5, TimeUnit.SECONDS);
            throw new SQLException("Interrupted");
        });
        doAnswer(invocation -> {
            cancelled.countDown();
            return null;
        }).when(statement).cancel();

        StubConnector connector = new StubConnector(connection, executor);
        QueryExecutionContext context = QueryExecutionContext.builder().timeoutMs(100).build();

        QueryExecutionException ex = assertThrows(QueryExecutionException.class,
                () -> connector.executeQuery("SELECT 1", context));
        assertTrue(ex.isTimeout());
        assertEquals("Query timed out after 100ms", ex.getMessage());
        verify(statement).cancel();
    }

    @Test
    public void testDriverErrorIsWrappedWithMessage() throws Exception {
        when(statement.execute(anyString())).thenThrow(new SQLException("Catalog Error: Table with name x does not exist!"));

        StubConnector connector = new StubConnector(connection, executor);
        QueryExecutionException ex = assertThrows(QueryExecutionException.class,
                () -> connector.executeQuery("SELECT * FROM x", QueryExecutionContext.empty()));
        assertFalse(ex.isTimeout());
        assertTrue(ex.getMessage().contains("Table with name x does not exist"), ex.getMessage());
        assertInstanceOf(SQLException.class, ex.getCause());
    }

    @Test
    public void testColumnTypeFallsBackToValueInference() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(statement.execute(anyString())).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(2);
        when(md.getColumnLabel(1)).thenReturn("ratio");
        when(md.getColumnLabel(2)).thenReturn("flag");
        when(md.getColumnTypeName(anyInt())).thenReturn(null);
        when(md.isNullable(anyInt())).thenReturn(ResultSetMetaData.columnNullable);
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(1.5);
        when(rs.getObject(2)).thenReturn(true);

        StubConnector connector = new StubConnector(connection, executor);
        ConnectorResult result = connector.executeQuery("SELECT ratio, flag FROM t", QueryExecutionContext.empty());

        assertEquals(ColumnType.FLOAT, result.getColumns().get(0).getType());
        assertEquals(ColumnType.BOOLEAN, result.getColumns().get(1).getType());
        assertEquals(1.5, result.getRows().get(0).get("ratio"));
        assertTrue(result.getColumns().get(0).isNullable());
    }

    @Test
    public void testConnectFailureBecomesConnectionException() {
        StubConnector connector = new StubConnector(connection, executor);
        connector.connectFailure = new SQLException("unreachable");

        ConnectionException ex = assertThrows(ConnectionException.class, connector::connect);
        assertTrue(ex.getMessage().contains("unreachable"), ex.getMessage());
        assertFalse(connector.isConnected());
        assertFalse(connector.testConnection());
        assertFalse(connector.getHealth().isHealthy());
    }
}
