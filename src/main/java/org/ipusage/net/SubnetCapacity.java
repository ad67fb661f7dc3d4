package org.ipusage.net;

import inet.ipaddr.AddressStringException;
import inet.ipaddr.AddressStringParameters.RangeParameters;
import inet.ipaddr.IPAddress;
import inet.ipaddr.IPAddressString;
import inet.ipaddr.IPAddressStringParameters;
import inet.ipaddr.IncompatibleAddressException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;

/**
 * Address counts for subnets and the IP policy exclusions carved out of them.
 */
public final class SubnetCapacity {
    private static final IPAddressStringParameters STRICT = strictParameters();

    private SubnetCapacity() {
    }

    /**
     * Parses CIDR notation into its prefix block. A bare address is a single host. Legacy
     * inet_aton forms, wildcards and ranges are rejected.
     */
    public static IPAddress parse(String cidr) {
        if (cidr == null || cidr.isBlank()) throw new IllegalArgumentException("CIDR cannot be blank");
        try {
            return new IPAddressString(cidr.trim(), STRICT).toAddress().toPrefixBlock();
        } catch (AddressStringException | IncompatibleAddressException ex) {
            throw new IllegalArgumentException("Invalid CIDR entry: " + cidr + " (" + ex.getMessage() + ")", ex);
        }
    }

    /**
     * Subnet size minus the distinct addresses excluded by the policy. Exclusions are clipped
     * to the subnet and overlaps count once; exclusions of the other address family are ignored.
     */
    public static BigInteger available(IPAddress subnet, Collection<IPAddress> exclusions) {
        return subnet.getCount().subtract(excluded(subnet, exclusions));
    }

    static BigInteger excluded(IPAddress subnet, Collection<IPAddress> exclusions) {
        final var clipped = new ArrayList<IPAddress>(exclusions.size());
        for (final var exclusion : exclusions) {
            if (exclusion.getIPVersion() != subnet.getIPVersion()) continue;
            final var overlap = subnet.intersect(exclusion);
            if (overlap != null) clipped.add(overlap.withoutPrefixLength());
        }
        if (clipped.isEmpty()) return BigInteger.ZERO;
        final var first = clipped.remove(0);
        var total = BigInteger.ZERO;
        for (final var block : first.mergeToSequentialBlocks(clipped.toArray(new IPAddress[0]))) {
            total = total.add(block.getCount());
        }
        return total;
    }

    private static IPAddressStringParameters strictParameters() {
        final var builder = new IPAddressStringParameters.Builder();
        builder.allowEmpty(false);
        builder.allowAll(false);
        builder.allowSingleSegment(false);
        builder.getIPv4AddressParametersBuilder().allow_inet_aton(false);
        builder.getIPv4AddressParametersBuilder().setRangeOptions(RangeParameters.NO_RANGE);
        builder.getIPv6AddressParametersBuilder().setRangeOptions(RangeParameters.NO_RANGE);
        return builder.toParams();
    }
}
