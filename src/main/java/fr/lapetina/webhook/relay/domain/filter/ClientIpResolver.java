package fr.lapetina.webhook.relay.domain.filter;

import fr.lapetina.webhook.relay.domain.model.IncomingRequest;

import java.util.List;
import java.util.Objects;

/**
 * Extracts the originating client IP of a request.
 *
 * <p>Each proxy appends the address it saw to the forwarding header, so the left-most entry is
 * the original client. When the header appears several times its occurrences are read in
 * arrival order. Without a usable header the socket peer address is used.
 *
 * <p>The result is not validated; the allow-list does that. An empty string means the IP
 * could not be determined.
 */
public final class ClientIpResolver {

    public static final String X_FORWARDED_FOR = "X-Forwarded-For";

    private final String forwardedHeader;

    public ClientIpResolver(String forwardedHeader) {
        this.forwardedHeader = Objects.requireNonNull(forwardedHeader, "Forwarded header name is required");
    }

    public ClientIpResolver() {
        this(X_FORWARDED_FOR);
    }

    /**
     * Resolves the client IP.
     *
     * @param forwardedValues values of the forwarding header, in arrival order (may be empty)
     * @param socketPeerIp    the direct peer address, may be null
     * @return the resolved IP, or an empty string
     */
    public String resolve(List<String> forwardedValues, String socketPeerIp) {
        if (forwardedValues != null) {
            for (String value : forwardedValues) {
                if (value == null || value.isBlank()) {
                    continue;
                }
                int comma = value.indexOf(',');
                return (comma >= 0 ? value.substring(0, comma) : value).trim();
            }
        }
        return socketPeerIp == null ? "" : socketPeerIp.trim();
    }

    /**
     * Resolves the client IP of an incoming request.
     */
    public String resolve(IncomingRequest request) {
        return resolve(request.headerValues(forwardedHeader), request.peerAddress());
    }

    public String getForwardedHeader() {
        return forwardedHeader;
    }
}
