package fr.lapetina.webhook.relay.domain.filter;

import com.google.common.net.InetAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Ordered set of permitted source CIDR ranges, parsed once.
 *
 * <p>Rules:
 * - An empty or unset list permits every caller.
 * - Malformed entries are logged and skipped; the remaining ranges still apply.
 * - If every entry of a non-empty list is malformed, the {@link MalformedAllowListPolicy} decides.
 * - A candidate that is not an IP literal is never permitted by a restricting list.
 *
 * Instances are immutable and safe to share across request threads.
 */
public final class AllowList {

    private static final Logger log = LoggerFactory.getLogger(AllowList.class);

    private static final AllowList PERMIT_ALL = new AllowList(List.of(), 0, Mode.PERMIT_ALL);

    private enum Mode {
        PERMIT_ALL,
        DENY_ALL,
        RESTRICTED
    }

    private final List<CidrRange> ranges;
    private final int rejectedEntries;
    private final Mode mode;

    private AllowList(List<CidrRange> ranges, int rejectedEntries, Mode mode) {
        this.ranges = List.copyOf(ranges);
        this.rejectedEntries = rejectedEntries;
        this.mode = mode;
    }

    /**
     * Returns an allow-list that permits every caller.
     */
    public static AllowList permitAll() {
        return PERMIT_ALL;
    }

    /**
     * Parses the configured range strings.
     *
     * @param entries CIDR range strings, may be null or empty
     * @param policy  applied when every entry is malformed
     */
    public static AllowList parse(List<String> entries, MalformedAllowListPolicy policy) {
        if (entries == null) {
            return PERMIT_ALL;
        }

        List<CidrRange> parsed = new ArrayList<>();
        int configured = 0;
        int rejected = 0;
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            configured++;
            try {
                CidrRange range = CidrRange.parse(entry);
                if (range.hadHostBits()) {
                    log.warn("Allow-list entry '{}' has host bits set, using network {}", entry.trim(), range);
                }
                parsed.add(range);
            } catch (IllegalArgumentException e) {
                rejected++;
                log.warn("Ignoring invalid allow-list entry '{}': {}", entry, e.getMessage());
            }
        }

        if (configured == 0) {
            return PERMIT_ALL;
        }
        if (parsed.isEmpty()) {
            if (policy == MalformedAllowListPolicy.DENY_ALL) {
                log.error("All {} allow-list entries are invalid, rejecting every caller (policy={})",
                        configured, policy);
                return new AllowList(List.of(), rejected, Mode.DENY_ALL);
            }
            log.error("All {} allow-list entries are invalid, permitting every caller (policy={})",
                    configured, policy);
            return new AllowList(List.of(), rejected, Mode.PERMIT_ALL);
        }
        return new AllowList(parsed, rejected, Mode.RESTRICTED);
    }

    /**
     * Decides whether {@code candidateIp} falls within any of {@code ranges}.
     * Malformed ranges are skipped; a list with no usable range permits everything.
     */
    public static boolean isAllowed(String candidateIp, List<String> ranges) {
        return parse(ranges, MalformedAllowListPolicy.PERMIT_ALL).permits(candidateIp);
    }

    /**
     * Returns true if the candidate IP is permitted.
     */
    public boolean permits(String candidateIp) {
        return switch (mode) {
            case PERMIT_ALL -> true;
            case DENY_ALL -> false;
            case RESTRICTED -> matchesAnyRange(candidateIp);
        };
    }

    private boolean matchesAnyRange(String candidateIp) {
        InetAddress address = parseCandidate(candidateIp);
        if (address == null) {
            return false;
        }
        for (CidrRange range : ranges) {
            if (range.contains(address)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns true if callers are actually filtered, i.e. this list does not permit everyone.
     */
    public boolean isRestricted() {
        return mode != Mode.PERMIT_ALL;
    }

    public List<CidrRange> getRanges() {
        return ranges;
    }

    public int getRejectedEntries() {
        return rejectedEntries;
    }

    private static InetAddress parseCandidate(String candidateIp) {
        if (candidateIp == null) {
            return null;
        }
        String trimmed = candidateIp.trim();
        if (!InetAddresses.isInetAddress(trimmed)) {
            return null;
        }
        return InetAddresses.forString(trimmed);
    }

    @Override
    public String toString() {
        return "AllowList{mode=" + mode + ", ranges=" + ranges + ", rejected=" + rejectedEntries + "}";
    }
}
