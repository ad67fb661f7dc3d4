package org.ipusage.db;

import org.ipusage.UsageReport;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs both counts inside one read transaction, used first since unused depends on it.
 */
public final class UsageCollector {
    private final UsedIpCounter usedCounter;
    private final UnusedIpCounter unusedCounter;

    public UsageCollector(UsedIpCounter usedCounter, UnusedIpCounter unusedCounter) {
        this.usedCounter = usedCounter;
        this.unusedCounter = unusedCounter;
    }

    public UsageReport collect(Connection connection) throws SQLException {
        final UsageReport report;
        try {
            final var used = usedCounter.count(connection);
            final var unused = unusedCounter.count(connection, used);
            report = new UsageReport(used, unused);
        } catch (SQLException | RuntimeException ex) {
            try {
                endReadTransaction(connection);
            } catch (SQLException rollbackFailure) {
                ex.addSuppressed(rollbackFailure);
            }
            throw ex;
        }
        endReadTransaction(connection);
        return report;
    }

    private static void endReadTransaction(Connection connection) throws SQLException {
        if (!connection.getAutoCommit()) connection.rollback();
    }
}
