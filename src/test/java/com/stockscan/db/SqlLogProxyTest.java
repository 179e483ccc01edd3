package com.stockscan.db;

import org.apache.logging.log4j.LogManager;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SqlLogProxyTest {

    @Test
    void wrapConnection_shouldReturnTypedStatementsThatDelegate() throws Exception {
        Connection raw = mock(Connection.class);
        PreparedStatement prepared = mock(PreparedStatement.class);
        Statement plain = mock(Statement.class);
        when(raw.prepareStatement("DELETE FROM bars_daily WHERE trade_date=?")).thenReturn(prepared);
        when(raw.createStatement()).thenReturn(plain);
        when(prepared.executeUpdate()).thenReturn(3);
        when(plain.execute("SET search_path TO s")).thenReturn(false);

        Connection wrapped = SqlLogProxy.wrapConnection(raw, LogManager.getLogger("SQL"));
        PreparedStatement statement = wrapped.prepareStatement("DELETE FROM bars_daily WHERE trade_date=?");

        assertNotSame(prepared, statement);
        assertEquals(3, statement.executeUpdate());
        verify(prepared).executeUpdate();
        wrapped.createStatement().execute("SET search_path TO s");
        verify(plain).execute("SET search_path TO s");
    }

    @Test
    void wrapConnection_shouldRethrowDelegateFailureUnwrapped() throws Exception {
        Connection raw = mock(Connection.class);
        PreparedStatement prepared = mock(PreparedStatement.class);
        SQLException duplicate = new SQLException("duplicate key", "23505");
        when(raw.prepareStatement("INSERT INTO universe VALUES (?)")).thenReturn(prepared);
        when(prepared.executeUpdate()).thenThrow(duplicate);

        PreparedStatement statement = SqlLogProxy.wrapConnection(raw, LogManager.getLogger("SQL"))
                .prepareStatement("INSERT INTO universe VALUES (?)");

        SQLException thrown = assertThrows(SQLException.class, statement::executeUpdate);
        assertSame(duplicate, thrown);
    }
}
