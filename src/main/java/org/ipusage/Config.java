package org.ipusage;

import java.time.Duration;

public record Config(String connection, String user, String password, Duration reuseAfter,
                     String publicNetworkId, String usageTenant) {
    public static final Duration DEFAULT_REUSE_AFTER = Duration.ofSeconds(7200);
    public static final String DEFAULT_PUBLIC_NETWORK_ID = "00000000-0000-0000-0000-000000000000";
    public static final String DEFAULT_USAGE_TENANT = "rackspace";

    public static Config defaultConfig() {
        return new Config(null, null, null, DEFAULT_REUSE_AFTER, DEFAULT_PUBLIC_NETWORK_ID, DEFAULT_USAGE_TENANT);
    }
}
