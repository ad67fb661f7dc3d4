package org.ipusage;

import org.ipusage.db.Database;
import org.ipusage.db.JdbcTarget;
import org.ipusage.db.SubnetFilter;
import org.ipusage.db.UnusedIpCounter;
import org.ipusage.db.UsageCollector;
import org.ipusage.db.UsedIpCounter;

import java.io.IOException;
import java.io.PrintStream;
import java.sql.SQLException;
import java.time.Clock;

public final class IpUsageApp {

    private IpUsageApp() {
    }

    public static void main(String[] args) throws Exception {
        final var status = run(args, System.out, System.err, ConfigPaths.defaults(), Clock.systemUTC());
        if (status != 0) System.exit(status);
    }

    static int run(String[] args, PrintStream out, PrintStream err, ConfigPaths paths, Clock clock)
            throws SQLException, IOException {
        final var options = CliOptions.parse(args);
        final var console = new Console(err, options.verbose(), options.debug());

        final Config config;
        final JdbcTarget target;
        try {
            final var files = paths.resolve(options.configFiles(), options.configDir());
            if (files.isEmpty()) {
                console.error("ERROR: Unable to find configuration file via the default search paths "
                        + paths.searchPaths() + " and the '--config-file' option!");
                return 1;
            }
            console.debug("Reading configuration from %s", files);
            config = new ConfigManager(files).load();
            target = JdbcTarget.from(config.connection(), config.user(), config.password());
        } catch (ConfigurationException ex) {
            console.error("ERROR: " + ex.getMessage());
            return 1;
        }

        final var filter = SubnetFilter.ipv4(config.publicNetworkId(), config.usageTenant());
        console.info("Network: %s | Tenant: %s | Reuse after: %ds | Database: %s",
                filter.networkId(), filter.usageTenant(), config.reuseAfter().toSeconds(), target.redactedUrl());

        final var collector = new UsageCollector(
                new UsedIpCounter(filter, config.reuseAfter(), clock, console),
                new UnusedIpCounter(filter, console));
        final UsageReport report;
        try (var connection = Database.open(target)) {
            report = collector.collect(connection);
        }
        out.println(ObjectMapperFactory.create().writeValueAsString(report));
        out.flush();
        return 0;
    }
}
