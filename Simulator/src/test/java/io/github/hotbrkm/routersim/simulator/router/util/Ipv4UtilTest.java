package io.github.hotbrkm.routersim.simulator.router.util;

import io.github.hotbrkm.routersim.simulator.router.exception.AddressParseException;
import io.github.hotbrkm.routersim.simulator.router.exception.InvalidPrefixException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Ipv4Util Test")
class Ipv4UtilTest {

    @Nested
    @DisplayName("ipv4ToInt() method")
    class Ipv4ToIntTest {

        @Test
        @DisplayName("Converts valid IPv4 address to integer")
        void shouldConvertValidIpToInt() {
            // Given
            String ip = "192.168.1.1";

            // When
            int result = Ipv4Util.ipv4ToInt(ip);

            // Then
            int expected = (192 << 24) | (168 << 16) | (1 << 8) | 1;
            assertThat(result).isEqualTo(expected);
        }

        @Test
        @DisplayName("Converts 255.255.255.255 to -1")
        void shouldConvertMaxIp() {
            assertThat(Ipv4Util.ipv4ToInt("255.255.255.255")).isEqualTo(-1);
        }

        @ParameterizedTest
        @ValueSource(strings = {"999.1.1.1", "1.2.3", "1.2.3.4.5", "a.b.c.d", "1..2.3", "1.2.3.4.", "-1.2.3.4", " "})
        @DisplayName("Rejects malformed addresses")
        void shouldRejectMalformedAddress(String ip) {
            assertThatThrownBy(() -> Ipv4Util.ipv4ToInt(ip))
                    .isInstanceOf(AddressParseException.class);
        }
    }

    @Nested
    @DisplayName("networkMask() method")
    class NetworkMaskTest {

        @Test
        @DisplayName("/0 yields an empty mask and /32 a full mask")
        void shouldHandleBoundaryPrefixes() {
            assertThat(Ipv4Util.networkMask(0)).isZero();
            assertThat(Ipv4Util.networkMask(32)).isEqualTo(0xFFFFFFFF);
        }

        @Test
        @DisplayName("/24 yields 255.255.255.0")
        void shouldBuildClassCMask() {
            assertThat(Ipv4Util.intToIpv4(Ipv4Util.networkMask(24))).isEqualTo("255.255.255.0");
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 33, 64})
        @DisplayName("Rejects prefix lengths outside 0-32")
        void shouldRejectInvalidPrefix(int prefix) {
            assertThatThrownBy(() -> Ipv4Util.networkMask(prefix))
                    .isInstanceOf(InvalidPrefixException.class)
                    .hasMessageContaining(String.valueOf(prefix));
        }
    }

    @Test
    @DisplayName("intToIpv4() renders high octets as unsigned values")
    void shouldRenderUnsignedOctets() {
        assertThat(Ipv4Util.intToIpv4(Ipv4Util.ipv4ToInt("200.100.50.25"))).isEqualTo("200.100.50.25");
    }
}
