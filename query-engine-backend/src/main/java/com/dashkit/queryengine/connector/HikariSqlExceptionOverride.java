package com.dashkit.queryengine.connector;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;

/**
 * HikariCP SQL exception override that keeps pooled connections alive for errors caused by
 * the query rather than by the connection.
 *
 * Dashboard traffic produces a steady stream of syntax errors (EXPLAIN validation of user SQL)
 * and cancellations (query timeouts); none of them mean the session is broken.
 */
public class HikariSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }

        if (sqlException instanceof SQLFeatureNotSupportedException
                || sqlException instanceof SQLSyntaxErrorException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlState.startsWith("0A")) {
            // 0A000: feature not supported
            return Override.DO_NOT_EVICT;
        }
        if (sqlState.startsWith("42")) {
            // syntax error or access rule violation
            return Override.DO_NOT_EVICT;
        }
        if ("HY008".equals(sqlState)) {
            // operation cancelled
            return Override.DO_NOT_EVICT;
        }

        return Override.CONTINUE_EVICT;
    }
}
