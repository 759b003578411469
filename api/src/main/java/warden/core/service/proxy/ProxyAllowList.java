package warden.core.service.proxy;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import warden.core.config.AuthProxyConfig;

/**
 * Checks whether a socket address belongs to a trusted authenticating proxy.
 *
 * <p>Entries are IP literals or CIDR ranges, IPv4 or IPv6. Entries may also be
 * comma or space separated within one configuration value. An empty allow-list
 * trusts every address.
 */
@ApplicationScoped
public class ProxyAllowList {

    private static final Logger LOG = Logger.getLogger(ProxyAllowList.class);

    /** Sentinel for entries that failed to parse (ConcurrentHashMap cannot store null). */
    private static final ParsedCidr INVALID_CIDR = new ParsedCidr(new byte[0], -1);

    private static final byte[] INVALID_IP = new byte[0];

    private final List<String> entries;
    private final Map<String, ParsedCidr> cidrCache = new ConcurrentHashMap<>();

    private record ParsedCidr(byte[] networkBytes, int prefixLength) {}

    @Inject
    public ProxyAllowList(AuthProxyConfig config) {
        this(config.whitelist().orElse(List.of()));
    }

    public ProxyAllowList(List<String> configured) {
        final var split = new ArrayList<String>();
        for (final var value : configured) {
            for (final var entry : value.split("[,\\s]+")) {
                if (!entry.isBlank()) {
                    split.add(entry.trim());
                }
            }
        }
        this.entries = List.copyOf(split);
    }

    public boolean isRestricted() {
        return !entries.isEmpty();
    }

    /**
     * Check if the given socket address may act as the auth proxy.
     *
     * @param remoteAddress the direct connection's remote IP address
     * @return true if the allow-list is empty or contains the address
     */
    public boolean isAllowed(String remoteAddress) {
        if (entries.isEmpty()) {
            return true;
        }
        final var sourceBytes = parseIpAddressLiteral(stripBrackets(remoteAddress));
        if (sourceBytes == INVALID_IP) {
            LOG.debugf("Remote address is not an IP literal: %s", remoteAddress);
            return false;
        }
        for (final var entry : entries) {
            if (matches(sourceBytes, entry)) {
                return true;
            }
        }
        return false;
    }

    private boolean matches(byte[] sourceBytes, String entry) {
        final var parsed = cidrCache.computeIfAbsent(entry, this::parseEntry);
        if (parsed == INVALID_CIDR) {
            return false;
        }

        final var networkBytes = parsed.networkBytes();
        final var prefixLength = parsed.prefixLength();
        if (networkBytes.length != sourceBytes.length) {
            return false;
        }

        final var fullBytes = prefixLength / 8;
        final var remainingBits = prefixLength % 8;
        for (var i = 0; i < fullBytes; i++) {
            if (networkBytes[i] != sourceBytes[i]) {
                return false;
            }
        }
        if (remainingBits > 0) {
            final var mask = (byte) (0xFF << (8 - remainingBits));
            return (networkBytes[fullBytes] & mask) == (sourceBytes[fullBytes] & mask);
        }
        return true;
    }

    /**
     * Parse an allow-list entry. A bare address is a range of one.
     */
    private ParsedCidr parseEntry(String entry) {
        final var slash = entry.indexOf('/');
        final var address = slash < 0 ? entry : entry.substring(0, slash);
        final var addressBytes = parseIpAddressLiteral(stripBrackets(address));
        if (addressBytes == INVALID_IP) {
            LOG.warnf("Invalid auth proxy allow-list entry: %s", entry);
            return INVALID_CIDR;
        }
        final var maxPrefix = addressBytes.length * 8;
        if (slash < 0) {
            return new ParsedCidr(addressBytes, maxPrefix);
        }
        try {
            final var prefixLength = Integer.parseInt(entry.substring(slash + 1));
            if (prefixLength < 0 || prefixLength > maxPrefix) {
                LOG.warnf("Invalid prefix length %d in allow-list entry (max %d): %s", prefixLength, maxPrefix, entry);
                return INVALID_CIDR;
            }
            return new ParsedCidr(addressBytes, prefixLength);
        } catch (NumberFormatException e) {
            LOG.warnf("Invalid prefix length in allow-list entry: %s", entry);
            return INVALID_CIDR;
        }
    }

    private static String stripBrackets(String address) {
        if (address != null && address.startsWith("[") && address.endsWith("]")) {
            return address.substring(1, address.length() - 1);
        }
        return address;
    }

    private static byte[] parseIpAddressLiteral(String ip) {
        if (!isIpAddressLiteral(ip)) {
            return INVALID_IP;
        }
        try {
            // only literals reach here, so no DNS lookup happens
            return InetAddress.getByName(ip).getAddress();
        } catch (UnknownHostException e) {
            return INVALID_IP;
        }
    }

    private static boolean isIpAddressLiteral(String input) {
        if (input == null || input.isEmpty()) {
            return false;
        }
        if (input.contains(":")) {
            return true;
        }
        if (!Character.isDigit(input.charAt(0))) {
            return false;
        }
        for (var i = 0; i < input.length(); i++) {
            final var c = input.charAt(i);
            if (c != '.' && !Character.isDigit(c)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "ProxyAllowList" + Arrays.toString(entries.toArray());
    }
}
