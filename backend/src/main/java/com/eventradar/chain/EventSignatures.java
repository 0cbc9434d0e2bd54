package com.eventradar.chain;

import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Event topic hashing and contract address checks.
 */
public final class EventSignatures {

    private static final Pattern HEX_DIGITS = Pattern.compile("[0-9a-fA-F]+");

    private EventSignatures() {
    }

    /**
     * Keccak-256 of the canonical event signature, e.g. {@code Transfer(address,address,uint256)}.
     * Whitespace is stripped before hashing.
     *
     * @return 0x-prefixed 32-byte topic
     */
    public static String topicOf(String eventSignature) {
        if (eventSignature == null || eventSignature.isBlank()) {
            throw new IllegalArgumentException("Event signature is required");
        }
        return Hash.sha3String(eventSignature.replaceAll("\\s+", ""));
    }

    /** 0x-prefixed, 20 bytes of hex. Checksum casing is not enforced. */
    public static boolean isValidAddress(String address) {
        if (address == null || !Numeric.containsHexPrefix(address)) {
            return false;
        }
        String digits = Numeric.cleanHexPrefix(address);
        return digits.length() == Keys.ADDRESS_LENGTH_IN_HEX && HEX_DIGITS.matcher(digits).matches();
    }

    /** Lowercase 0x form used in filters and event records. */
    public static String normalizeAddress(String address) {
        return address.toLowerCase(Locale.ROOT);
    }
}
