package org.ipusage.db;

import org.ipusage.Config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Temporary SQLite database with the quark tables, plus helpers to seed subnets, policies and
 * addresses.
 */
public final class QuarkFixture implements AutoCloseable {
    public static final String PUBLIC_NETWORK = Config.DEFAULT_PUBLIC_NETWORK_ID;
    // Same text layout SQLAlchemy writes for DateTime columns on SQLite.
    private static final DateTimeFormatter STORED_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private final String url;
    private final Connection connection;

    private QuarkFixture(String url, Connection connection) {
        this.url = url;
        this.connection = connection;
    }

    public static QuarkFixture create(Path dir) throws SQLException, IOException {
        final var url = "jdbc:sqlite:" + dir.resolve("quark.db");
        final var connection = DriverManager.getConnection(url);
        try (var in = QuarkFixture.class.getResourceAsStream("/quark-schema.sql");
             var statement = connection.createStatement()) {
            for (final var sql : statements(in)) {
                statement.executeUpdate(sql);
            }
        }
        return new QuarkFixture(url, connection);
    }

    public String url() {
        return url;
    }

    public JdbcTarget target() {
        return new JdbcTarget(url, null, null);
    }

    public QuarkFixture subnet(String id, String tenantId, String cidr) throws SQLException {
        return subnet(id, tenantId, PUBLIC_NETWORK, 4, cidr, false, null);
    }

    public QuarkFixture subnet(String id, String tenantId, String networkId, int ipVersion, String cidr,
                               boolean doNotUse, String policyId) throws SQLException {
        try (var statement = connection.prepareStatement("""
                INSERT INTO quark_subnets (id, tenant_id, network_id, ip_version, cidr, do_not_use, ip_policy_id)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                """)) {
            statement.setString(1, id);
            statement.setString(2, tenantId);
            statement.setString(3, networkId);
            statement.setInt(4, ipVersion);
            statement.setString(5, cidr);
            statement.setBoolean(6, doNotUse);
            statement.setString(7, policyId);
            statement.executeUpdate();
        }
        return this;
    }

    public QuarkFixture policy(String policyId, String... excludedCidrs) throws SQLException {
        try (var statement = connection.prepareStatement("INSERT INTO quark_ip_policy (id) VALUES (?)")) {
            statement.setString(1, policyId);
            statement.executeUpdate();
        }
        for (final var cidr : excludedCidrs) {
            try (var statement = connection.prepareStatement(
                    "INSERT INTO quark_ip_policy_cidrs (id, ip_policy_id, cidr) VALUES (?, ?, ?)")) {
                statement.setString(1, UUID.randomUUID().toString());
                statement.setString(2, policyId);
                statement.setString(3, cidr);
                statement.executeUpdate();
            }
        }
        return this;
    }

    public QuarkFixture allocated(String subnetId, int count) throws SQLException {
        for (var i = 0; i < count; i++) {
            address(subnetId, i % 2 == 0 ? null : Boolean.FALSE, null);
        }
        return this;
    }

    public QuarkFixture deallocated(String subnetId, Instant deallocatedAt) throws SQLException {
        return deallocated(subnetId, STORED_TIMESTAMP.format(deallocatedAt));
    }

    public QuarkFixture deallocated(String subnetId, String storedTimestamp) throws SQLException {
        return address(subnetId, Boolean.TRUE, storedTimestamp);
    }

    private QuarkFixture address(String subnetId, Boolean deallocated, String deallocatedAt) throws SQLException {
        try (var statement = connection.prepareStatement("""
                INSERT INTO quark_ip_addresses (id, subnet_id, version, deallocated, deallocated_at)
                VALUES (?, ?, 4, ?, ?)
                """)) {
            statement.setString(1, UUID.randomUUID().toString());
            statement.setString(2, subnetId);
            if (deallocated == null) {
                statement.setNull(3, java.sql.Types.BOOLEAN);
            } else {
                statement.setBoolean(3, deallocated);
            }
            if (deallocatedAt == null) {
                statement.setNull(4, java.sql.Types.TIMESTAMP);
            } else {
                statement.setString(4, deallocatedAt);
            }
            statement.executeUpdate();
        }
        return this;
    }

    @Override
    public void close() throws SQLException {
        connection.close();
    }

    private static String[] statements(InputStream in) throws IOException {
        final var script = new String(in.readAllBytes(), StandardCharsets.UTF_8)
                .replaceAll("(?m)^--.*$", "");
        return java.util.Arrays.stream(script.split(";"))
                .map(String::trim)
                .filter(sql -> !sql.isEmpty())
                .toArray(String[]::new);
    }
}
