package org.ipusage.db;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Subnets that take part in the report: the target network, IPv4, usable, and owned by a
 * hyphenated tenant id or the literal usage tenant.
 */
public record SubnetFilter(String networkId, int ipVersion, String tenantPattern, String usageTenant) {
    public static final String HYPHENATED_TENANTS = "%-%";

    public SubnetFilter {
        Objects.requireNonNull(networkId, "networkId");
        Objects.requireNonNull(tenantPattern, "tenantPattern");
        Objects.requireNonNull(usageTenant, "usageTenant");
    }

    public static SubnetFilter ipv4(String networkId, String usageTenant) {
        return new SubnetFilter(networkId, 4, HYPHENATED_TENANTS, usageTenant);
    }

    /** Predicate over the subnet table aliased as {@code s}. */
    public String whereClause() {
        return "s.network_id = ? AND s.ip_version = ? AND s.do_not_use = ?"
                + " AND (s.tenant_id LIKE ? OR s.tenant_id = ?)";
    }

    /** Binds the predicate parameters starting at {@code index}; returns the next free index. */
    public int bind(PreparedStatement statement, int index) throws SQLException {
        var i = index;
        statement.setString(i++, networkId);
        statement.setInt(i++, ipVersion);
        statement.setBoolean(i++, false);
        statement.setString(i++, tenantPattern);
        statement.setString(i++, usageTenant);
        return i;
    }
}
