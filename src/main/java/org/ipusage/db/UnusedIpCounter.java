package org.ipusage.db;

import inet.ipaddr.IPAddress;
import org.ipusage.Console;
import org.ipusage.net.SubnetCapacity;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Counts, per tenant, addresses still available: subnet size minus IP policy exclusions,
 * minus the tenant's used addresses. Only tenants with a qualifying subnet are reported and
 * results are not clamped at zero.
 */
public final class UnusedIpCounter {
    private static final String QUERY = """
            SELECT s.id, s.tenant_id, s.cidr, c.cidr
            FROM quark_subnets s
            LEFT OUTER JOIN quark_ip_policy_cidrs c
              ON c.ip_policy_id = s.ip_policy_id
            WHERE %s
            """;

    private final SubnetFilter filter;
    private final Console console;

    public UnusedIpCounter(SubnetFilter filter, Console console) {
        this.filter = filter;
        this.console = console;
    }

    public Map<String, Long> count(Connection connection, Map<String, Long> used) throws SQLException {
        final var started = System.nanoTime();
        final var subnets = loadSubnets(connection);
        final var unused = new TreeMap<String, Long>();
        for (final var subnet : subnets.values()) {
            unused.merge(subnet.tenantId(), subnet.capacity(), Long::sum);
        }
        for (final var entry : used.entrySet()) {
            unused.computeIfPresent(entry.getKey(), (tenant, total) -> total - entry.getValue());
        }
        console.debug("Unused IPs: %d subnet(s) across %d tenant(s) (%d ms)",
                subnets.size(), unused.size(), (System.nanoTime() - started) / 1_000_000);
        return unused;
    }

    private Map<String, SubnetRow> loadSubnets(Connection connection) throws SQLException {
        final var subnets = new LinkedHashMap<String, SubnetRow>();
        try (var statement = connection.prepareStatement(QUERY.formatted(filter.whereClause()))) {
            filter.bind(statement, 1);
            try (var rows = statement.executeQuery()) {
                while (rows.next()) {
                    final var id = rows.getString(1);
                    var subnet = subnets.get(id);
                    if (subnet == null) {
                        subnet = new SubnetRow(id, rows.getString(2), parse(id, rows.getString(3)), new ArrayList<>());
                        subnets.put(id, subnet);
                    }
                    final var exclusion = rows.getString(4);
                    if (exclusion != null) subnet.exclusions().add(parse(id, exclusion));
                }
            }
        }
        return subnets;
    }

    private static IPAddress parse(String subnetId, String cidr) {
        try {
            return SubnetCapacity.parse(cidr);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Subnet " + subnetId + " has an invalid CIDR: " + cidr, ex);
        }
    }

    private record SubnetRow(String id, String tenantId, IPAddress cidr, List<IPAddress> exclusions) {
        long capacity() {
            return SubnetCapacity.available(cidr, exclusions).longValueExact();
        }
    }
}
