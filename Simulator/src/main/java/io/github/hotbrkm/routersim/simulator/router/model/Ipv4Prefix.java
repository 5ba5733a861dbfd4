package io.github.hotbrkm.routersim.simulator.router.model;

import io.github.hotbrkm.routersim.simulator.router.exception.AddressParseException;
import io.github.hotbrkm.routersim.simulator.router.util.Ipv4Util;

/**
 * IPv4 network address with a prefix length.
 * <p>
 * The stored value always has the host bits cleared, so {@code 192.168.1.5/24} is held
 * as {@code 192.168.1.0/24}. Equality is structural on value and prefix length.
 *
 * @param value        network address as an unsigned 32-bit value
 * @param prefixLength prefix length, 0-32
 */
public record Ipv4Prefix(int value, int prefixLength) {

    private static final char PREFIX_SEPARATOR = '/';

    public Ipv4Prefix {
        value = value & Ipv4Util.networkMask(prefixLength);
    }

    /**
     * Parses {@code a.b.c.d} or {@code a.b.c.d/n}. A missing prefix means a host route (/32).
     *
     * @param text address text
     * @return masked network address
     * @throws AddressParseException if the address or the prefix is not numeric
     * @throws io.github.hotbrkm.routersim.simulator.router.exception.InvalidPrefixException
     *         if the prefix is outside 0-32
     */
    public static Ipv4Prefix parse(String text) {
        if (text == null || text.isBlank()) {
            throw new AddressParseException("Address must not be empty. Example: 192.168.0.1/24");
        }

        String trimmed = text.trim();
        int slash = trimmed.indexOf(PREFIX_SEPARATOR);
        if (slash < 0) {
            return new Ipv4Prefix(Ipv4Util.ipv4ToInt(trimmed), Ipv4Util.MAX_PREFIX_LENGTH);
        }

        int prefixLength = Ipv4Util.parsePrefixLength(trimmed.substring(slash + 1), trimmed);
        return new Ipv4Prefix(Ipv4Util.ipv4ToInt(trimmed.substring(0, slash)), prefixLength);
    }

    public static Ipv4Prefix host(int value) {
        return new Ipv4Prefix(value, Ipv4Util.MAX_PREFIX_LENGTH);
    }

    /**
     * Checks whether this network covers the given address.
     * <p>
     * The other address is masked with this network's prefix; its own prefix length is ignored.
     *
     * @param other address to test
     * @return true if {@code other} falls inside this network
     */
    public boolean contains(Ipv4Prefix other) {
        return (other.value & mask()) == value;
    }

    public int mask() {
        return Ipv4Util.networkMask(prefixLength);
    }

    public boolean isHost() {
        return prefixLength == Ipv4Util.MAX_PREFIX_LENGTH;
    }

    @Override
    public String toString() {
        return Ipv4Util.intToIpv4(value) + PREFIX_SEPARATOR + prefixLength;
    }
}
