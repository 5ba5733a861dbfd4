package io.github.hotbrkm.routersim.simulator.router.util;

import io.github.hotbrkm.routersim.simulator.router.exception.AddressParseException;
import io.github.hotbrkm.routersim.simulator.router.exception.InvalidPrefixException;

/**
 * Utility class for IPv4 address arithmetic.
 * <p>
 * Addresses are held in a signed {@code int}; all operations treat it as an unsigned 32-bit value.
 */
public final class Ipv4Util {

    public static final int MIN_PREFIX_LENGTH = 0;
    public static final int MAX_PREFIX_LENGTH = 32;

    private static final int OCTET_COUNT = 4;
    private static final int MAX_OCTET_VALUE = 255;

    private Ipv4Util() {
        // Prevent instantiation
    }

    /**
     * Converts an IPv4 dotted quad to an integer.
     *
     * @param ip IPv4 address (e.g. "192.168.1.1")
     * @return integer representation, {@code (a<<24)|(b<<16)|(c<<8)|d}
     * @throws AddressParseException if the text is not four decimal octets in the range 0-255
     */
    public static int ipv4ToInt(String ip) {
        if (ip == null || ip.isBlank()) {
            throw new AddressParseException("IP address must not be empty. Example: 192.168.0.1");
        }

        String[] octets = ip.split("\\.", -1);
        if (octets.length != OCTET_COUNT) {
            throw new AddressParseException("Invalid IP address format: " + ip + ". Example: 192.168.0.1");
        }

        int result = 0;
        for (String octet : octets) {
            result = (result << 8) | parseOctet(octet, ip);
        }
        return result;
    }

    /**
     * Converts an integer back to its dotted quad form.
     *
     * @param value address as an unsigned 32-bit value
     * @return dotted quad (e.g. "10.0.0.1")
     */
    public static String intToIpv4(int value) {
        return ((value >>> 24) & 0xFF) + "." + ((value >>> 16) & 0xFF) + "." + ((value >>> 8) & 0xFF) + "." + (value & 0xFF);
    }

    /**
     * Returns the network mask for a prefix length.
     * <p>
     * /0 yields 0 (matches everything), /32 yields 0xFFFFFFFF.
     *
     * @param prefixLength prefix length
     * @return network mask
     * @throws InvalidPrefixException if the prefix length is outside 0-32
     */
    public static int networkMask(int prefixLength) {
        validatePrefixLength(prefixLength);
        return prefixLength == 0 ? 0 : -(1 << (MAX_PREFIX_LENGTH - prefixLength));
    }

    /**
     * Parses the text after {@code /} in an address.
     * <p>
     * Only decimal digits are accepted, as for octets. A leading minus is read as a number so that
     * negative lengths are reported as an invalid prefix rather than a format error.
     *
     * @param prefix prefix text (e.g. "24")
     * @param text   whole address text, for the error message
     * @return prefix length, not yet range-checked
     * @throws AddressParseException if the prefix is empty, signed with '+', or not numeric
     */
    public static int parsePrefixLength(String prefix, String text) {
        String digits = prefix.startsWith("-") ? prefix.substring(1) : prefix;
        if (digits.isEmpty() || !isDigits(digits)) {
            throw new AddressParseException("Prefix length must be numeric: '" + prefix + "' in " + text);
        }

        try {
            return Integer.parseInt(prefix);
        } catch (NumberFormatException e) {
            throw new AddressParseException("Prefix length is out of range: '" + prefix + "' in " + text, e);
        }
    }

    public static void validatePrefixLength(int prefixLength) {
        if (prefixLength < MIN_PREFIX_LENGTH || prefixLength > MAX_PREFIX_LENGTH) {
            throw new InvalidPrefixException(prefixLength);
        }
    }

    private static int parseOctet(String octet, String ip) {
        if (octet.isEmpty() || !isDigits(octet)) {
            throw new AddressParseException("IP octet must be numeric: '" + octet + "' in " + ip);
        }

        int value;
        try {
            value = Integer.parseInt(octet);
        } catch (NumberFormatException e) {
            throw new AddressParseException("IP octet must be numeric: '" + octet + "' in " + ip, e);
        }

        if (value > MAX_OCTET_VALUE) {
            throw new AddressParseException("IP octet must be 0-255: " + octet + " in " + ip);
        }
        return value;
    }

    private static boolean isDigits(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
