package com.pocketca.crypto;

import java.math.BigInteger;
import java.security.SecureRandom;

/**
 * Allocates 128-bit certificate serial numbers.
 *
 * <p>Each serial is 16 random bytes whose first two bytes are replaced by
 * {@link CryptoConstants#SERIAL_TAG}, leaving 112 bits of entropy. Issued serials
 * are not tracked: collisions are avoided by entropy alone.
 */
public class SerialNumberAllocator {

    private final SecureRandom random;

    public SerialNumberAllocator() {
        this(new SecureRandom());
    }

    public SerialNumberAllocator(SecureRandom random) {
        this.random = random;
    }

    /**
     * @return a new positive serial number
     */
    public BigInteger allocate() {
        byte[] serial = new byte[CryptoConstants.SERIAL_LENGTH];
        random.nextBytes(serial);
        System.arraycopy(CryptoConstants.SERIAL_TAG, 0, serial, 0, CryptoConstants.SERIAL_TAG.length);
        return new BigInteger(1, serial);
    }

    /**
     * Check whether a serial carries this allocator's tag.
     */
    public static boolean isTagged(BigInteger serial) {
        return serial.signum() > 0
            && serial.bitLength() <= CryptoConstants.SERIAL_LENGTH * 8
            && serial.shiftRight((CryptoConstants.SERIAL_LENGTH - 2) * 8).intValue() == CryptoConstants.SERIAL_TAG_VALUE;
    }
}
