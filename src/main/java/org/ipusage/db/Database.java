package org.ipusage.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

public final class Database {

    private Database() {
    }

    /**
     * Opens a connection with auto-commit off. Callers only read and roll back when done.
     */
    public static Connection open(JdbcTarget target) throws SQLException {
        final var connection = target.user() == null
                ? DriverManager.getConnection(target.url())
                : DriverManager.getConnection(target.url(), target.user(), target.password());
        try {
            connection.setAutoCommit(false);
            return connection;
        } catch (SQLException ex) {
            connection.close();
            throw ex;
        }
    }
}
