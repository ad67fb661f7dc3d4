package org.ipusage.db;

import org.ipusage.Console;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Calendar;
import java.util.Map;
import java.util.TimeZone;
import java.util.TreeMap;

/**
 * Counts, per tenant, addresses that are allocated or were deallocated too recently to be
 * handed out again.
 */
public final class UsedIpCounter {
    private static final String QUERY = """
            SELECT s.tenant_id, COUNT(a.id)
            FROM quark_subnets s
            LEFT OUTER JOIN quark_ip_addresses a
              ON s.id = a.subnet_id
              AND (a.deallocated IS NULL OR a.deallocated = ? OR a.deallocated_at > ?)
            WHERE %s
            GROUP BY s.tenant_id
            """;
    // SQLite keeps quark timestamps as naive UTC text and compares them as strings.
    private static final DateTimeFormatter SQLITE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private final SubnetFilter filter;
    private final Duration reuseAfter;
    private final Clock clock;
    private final Console console;

    public UsedIpCounter(SubnetFilter filter, Duration reuseAfter, Clock clock, Console console) {
        this.filter = filter;
        this.reuseAfter = reuseAfter;
        this.clock = clock;
        this.console = console;
    }

    public Map<String, Long> count(Connection connection) throws SQLException {
        final var reuseWindow = clock.instant().minus(reuseAfter);
        final var started = System.nanoTime();
        final var used = new TreeMap<String, Long>();
        try (var statement = connection.prepareStatement(QUERY.formatted(filter.whereClause()))) {
            statement.setBoolean(1, false);
            bindTimestamp(connection, statement, 2, reuseWindow);
            filter.bind(statement, 3);
            try (var rows = statement.executeQuery()) {
                while (rows.next()) {
                    used.put(rows.getString(1), rows.getLong(2));
                }
            }
        }
        console.debug("Used IPs: %d tenant(s), reuse window starts %s (%d ms)",
                used.size(), reuseWindow, (System.nanoTime() - started) / 1_000_000);
        return used;
    }

    private static void bindTimestamp(Connection connection, PreparedStatement statement, int index, Instant instant)
            throws SQLException {
        if (isSqlite(connection)) {
            statement.setString(index, SQLITE_TIMESTAMP.format(instant));
        } else {
            statement.setTimestamp(index, Timestamp.from(instant), utc());
        }
    }

    private static boolean isSqlite(Connection connection) throws SQLException {
        return "SQLite".equalsIgnoreCase(connection.getMetaData().getDatabaseProductName());
    }

    static Calendar utc() {
        return Calendar.getInstance(TimeZone.getTimeZone("UTC"));
    }
}
