package fr.lapetina.webhook.relay.domain.filter;

import com.google.common.net.InetAddresses;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CidrRangeTest {

    @Nested
    @DisplayName("Parsing")
    class Parsing {

        @Test
        @DisplayName("should parse IPv4 range")
        void shouldParseIpv4Range() {
            CidrRange range = CidrRange.parse("10.0.0.0/8");

            assertThat(range.prefixLength()).isEqualTo(8);
            assertThat(range.isIpv6()).isFalse();
            assertThat(range.hadHostBits()).isFalse();
            assertThat(range).hasToString("10.0.0.0/8");
        }

        @Test
        @DisplayName("should parse IPv6 range")
        void shouldParseIpv6Range() {
            CidrRange range = CidrRange.parse("2001:db8::/32");

            assertThat(range.prefixLength()).isEqualTo(32);
            assertThat(range.isIpv6()).isTrue();
            assertThat(range).hasToString("2001:db8::/32");
        }

        @Test
        @DisplayName("should treat bare address as single host range")
        void shouldTreatBareAddressAsSingleHost() {
            assertThat(CidrRange.parse("192.168.1.7").prefixLength()).isEqualTo(32);
            assertThat(CidrRange.parse("::1").prefixLength()).isEqualTo(128);
        }

        @Test
        @DisplayName("should trim surrounding whitespace")
        void shouldTrimWhitespace() {
            CidrRange range = CidrRange.parse("  172.16.0.0/12 ");

            assertThat(range).hasToString("172.16.0.0/12");
            assertThat(range.source()).isEqualTo("172.16.0.0/12");
        }

        @Test
        @DisplayName("should clear host bits and report them")
        void shouldClearHostBits() {
            CidrRange range = CidrRange.parse("10.1.2.3/8");

            assertThat(range.hadHostBits()).isTrue();
            assertThat(range).hasToString("10.0.0.0/8");
            assertThat(range.contains(InetAddresses.forString("10.200.0.1"))).isTrue();
        }

        @Test
        @DisplayName("should reject malformed ranges")
        void shouldRejectMalformedRanges() {
            assertThatThrownBy(() -> CidrRange.parse("not-a-cidr"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CidrRange.parse("10.0.0.0/33"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CidrRange.parse("10.0.0.0/-1"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CidrRange.parse("10.0.0.0/abc"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CidrRange.parse("/8"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CidrRange.parse("2001:db8::/129"))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> CidrRange.parse(" "))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should never resolve host names")
        void shouldNeverResolveHostNames() {
            assertThatThrownBy(() -> CidrRange.parse("localhost/32"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Membership")
    class Membership {

        @Test
        @DisplayName("should contain addresses inside the prefix")
        void shouldContainAddressesInsidePrefix() {
            CidrRange range = CidrRange.parse("192.168.0.0/16");

            assertThat(range.contains(InetAddresses.forString("192.168.0.0"))).isTrue();
            assertThat(range.contains(InetAddresses.forString("192.168.255.255"))).isTrue();
            assertThat(range.contains(InetAddresses.forString("192.169.0.0"))).isFalse();
        }

        @Test
        @DisplayName("should match prefixes not aligned on a byte")
        void shouldMatchPartialBytePrefix() {
            CidrRange range = CidrRange.parse("172.16.0.0/12");

            assertThat(range.contains(InetAddresses.forString("172.31.255.255"))).isTrue();
            assertThat(range.contains(InetAddresses.forString("172.32.0.0"))).isFalse();
            assertThat(range.contains(InetAddresses.forString("172.15.255.255"))).isFalse();
        }

        @Test
        @DisplayName("should match every address with zero prefix")
        void shouldMatchEverythingWithZeroPrefix() {
            CidrRange range = CidrRange.parse("0.0.0.0/0");

            assertThat(range.contains(InetAddresses.forString("8.8.8.8"))).isTrue();
            assertThat(range.contains(InetAddresses.forString("255.255.255.255"))).isTrue();
        }

        @Test
        @DisplayName("should never match across address families")
        void shouldNotMatchAcrossFamilies() {
            assertThat(CidrRange.parse("0.0.0.0/0").contains(InetAddresses.forString("2001:db8::1"))).isFalse();
            assertThat(CidrRange.parse("::/0").contains(InetAddresses.forString("10.0.0.1"))).isFalse();
        }

        @Test
        @DisplayName("should not contain null")
        void shouldNotContainNull() {
            assertThat(CidrRange.parse("10.0.0.0/8").contains(null)).isFalse();
        }
    }
}
