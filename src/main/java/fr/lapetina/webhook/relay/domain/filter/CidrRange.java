package fr.lapetina.webhook.relay.domain.filter;

import com.google.common.net.InetAddresses;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Arrays;
import java.util.Objects;

/**
 * A single IPv4 or IPv6 network prefix.
 *
 * <p>Address literals are parsed with Guava's {@link InetAddresses}, so a range string is
 * never resolved through DNS. A bare address is a /32 (IPv4) or /128 (IPv6) range.
 * Host bits set below the prefix are cleared; {@link #hadHostBits()} reports it.
 */
public final class CidrRange {

    private final String source;
    private final byte[] network;
    private final int prefixLength;
    private final boolean hadHostBits;

    private CidrRange(String source, byte[] network, int prefixLength, boolean hadHostBits) {
        this.source = source;
        this.network = network;
        this.prefixLength = prefixLength;
        this.hadHostBits = hadHostBits;
    }

    /**
     * Parses a CIDR string such as {@code 10.0.0.0/8}, {@code 2001:db8::/32} or {@code 192.168.1.7}.
     *
     * @throws IllegalArgumentException if the string is not a valid range
     */
    public static CidrRange parse(String cidr) {
        Objects.requireNonNull(cidr, "cidr");
        String trimmed = cidr.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("CIDR range is blank");
        }

        String addressPart = trimmed;
        String prefixPart = null;
        int slash = trimmed.indexOf('/');
        if (slash >= 0) {
            addressPart = trimmed.substring(0, slash).trim();
            prefixPart = trimmed.substring(slash + 1).trim();
            if (addressPart.isEmpty() || prefixPart.isEmpty()) {
                throw new IllegalArgumentException("Invalid CIDR range: " + trimmed);
            }
        }

        if (!InetAddresses.isInetAddress(addressPart)) {
            throw new IllegalArgumentException("Invalid address in CIDR range: " + trimmed);
        }
        byte[] address = InetAddresses.forString(addressPart).getAddress();
        int maxPrefix = address.length * 8;

        int prefix = maxPrefix;
        if (prefixPart != null) {
            try {
                prefix = Integer.parseInt(prefixPart);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid prefix length in CIDR range: " + trimmed, e);
            }
            if (prefix < 0 || prefix > maxPrefix) {
                throw new IllegalArgumentException(
                        "Prefix length " + prefix + " out of range (max " + maxPrefix + "): " + trimmed);
            }
        }

        byte[] network = applyMask(address, prefix);
        boolean hostBits = !Arrays.equals(network, address);
        return new CidrRange(trimmed, network, prefix, hostBits);
    }

    /**
     * Returns true if the address lies inside this range. Addresses of the other family never match.
     */
    public boolean contains(InetAddress address) {
        if (address == null) {
            return false;
        }
        byte[] candidate = address.getAddress();
        if (candidate.length != network.length) {
            return false;
        }

        int fullBytes = prefixLength / 8;
        int remainingBits = prefixLength % 8;

        for (int i = 0; i < fullBytes; i++) {
            if (candidate[i] != network[i]) {
                return false;
            }
        }
        if (remainingBits > 0) {
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
        }
        return true;
    }

    public int prefixLength() {
        return prefixLength;
    }

    public boolean isIpv6() {
        return network.length == 16;
    }

    public boolean hadHostBits() {
        return hadHostBits;
    }

    public String source() {
        return source;
    }

    private static byte[] applyMask(byte[] address, int prefix) {
        byte[] masked = new byte[address.length];
        int fullBytes = prefix / 8;
        int remainingBits = prefix % 8;
        System.arraycopy(address, 0, masked, 0, fullBytes);
        if (remainingBits > 0) {
            masked[fullBytes] = (byte) (address[fullBytes] & (0xFF << (8 - remainingBits)));
        }
        return masked;
    }

    @Override
    public String toString() {
        return InetAddresses.toAddrString(toInetAddress(network)) + "/" + prefixLength;
    }

    private static InetAddress toInetAddress(byte[] bytes) {
        try {
            return InetAddress.getByAddress(bytes);
        } catch (UnknownHostException e) {
            // Only thrown for illegal lengths, which parse() never produces
            throw new IllegalStateException(e);
        }
    }
}
