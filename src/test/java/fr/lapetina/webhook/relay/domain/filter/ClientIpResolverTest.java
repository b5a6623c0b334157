package fr.lapetina.webhook.relay.domain.filter;

import fr.lapetina.webhook.relay.domain.model.IncomingRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ClientIpResolverTest {

    private final ClientIpResolver resolver = new ClientIpResolver();

    @Test
    @DisplayName("should take the left-most forwarded entry")
    void shouldTakeLeftMostEntry() {
        String ip = resolver.resolve(List.of("203.0.113.5, 10.0.0.1, 10.0.0.2"), "10.0.0.3");

        assertThat(ip).isEqualTo("203.0.113.5");
    }

    @Test
    @DisplayName("should trim whitespace around the entry")
    void shouldTrimWhitespace() {
        assertThat(resolver.resolve(List.of("   198.51.100.1  "), null)).isEqualTo("198.51.100.1");
    }

    @Test
    @DisplayName("should use the first occurrence when the header repeats")
    void shouldUseFirstOccurrence() {
        String ip = resolver.resolve(List.of("198.51.100.1", "203.0.113.9"), "10.0.0.3");

        assertThat(ip).isEqualTo("198.51.100.1");
    }

    @Test
    @DisplayName("should fall back to the socket peer without a header")
    void shouldFallBackToPeer() {
        assertThat(resolver.resolve(List.of(), "10.0.0.3")).isEqualTo("10.0.0.3");
        assertThat(resolver.resolve(null, "10.0.0.3")).isEqualTo("10.0.0.3");
    }

    @Test
    @DisplayName("should fall back to the socket peer with a blank header")
    void shouldFallBackToPeerWithBlankHeader() {
        assertThat(resolver.resolve(List.of("  "), "10.0.0.3")).isEqualTo("10.0.0.3");
    }

    @Test
    @DisplayName("should return empty string when nothing is known")
    void shouldReturnEmptyWhenUnknown() {
        assertThat(resolver.resolve(List.of(), null)).isEmpty();
    }

    @Test
    @DisplayName("should not validate the extracted value")
    void shouldNotValidate() {
        assertThat(resolver.resolve(List.of("unknown, 10.0.0.1"), "10.0.0.3")).isEqualTo("unknown");
    }

    @Test
    @DisplayName("should read the header case-insensitively from a request")
    void shouldResolveFromRequest() {
        IncomingRequest request = IncomingRequest.builder()
                .method("POST")
                .header("x-forwarded-for", "198.51.100.7, 10.0.0.1")
                .peerAddress("10.0.0.1")
                .build();

        assertThat(resolver.resolve(request)).isEqualTo("198.51.100.7");
    }

    @Test
    @DisplayName("should honour a custom forwarding header")
    void shouldUseCustomHeader() {
        ClientIpResolver custom = new ClientIpResolver("X-Real-IP");
        IncomingRequest request = IncomingRequest.builder()
                .method("POST")
                .header("X-Forwarded-For", "198.51.100.7")
                .header("X-Real-IP", "203.0.113.1")
                .build();

        assertThat(custom.resolve(request)).isEqualTo("203.0.113.1");
        assertThat(custom.getForwardedHeader()).isEqualTo("X-Real-IP");
    }
}
