package com.questrail.kmip.model;

import java.util.Objects;
import java.util.Optional;

/**
 * KeyBlock
 * -----------------------------------------------------------------------------
 * Decoded key block of a key-bearing managed object.
 *
 * <p>{@code keyMaterial} is present only when the key value carried its
 * material as a byte string. Transparent (structured) key material is not
 * retained and reads as empty.</p>
 *
 * Immutability is enforced via defensive copying.
 */
public final class KeyBlock
{
    private final KeyFormatType keyFormatType;
    private final byte[] keyMaterial;
    private final CryptographicAlgorithm cryptographicAlgorithm;
    private final Integer cryptographicLength;
    private final KeyWrappingData keyWrappingData;

    public KeyBlock(KeyFormatType keyFormatType,
                    byte[] keyMaterial,
                    CryptographicAlgorithm cryptographicAlgorithm,
                    Integer cryptographicLength,
                    KeyWrappingData keyWrappingData) {

        this.keyFormatType = Objects.requireNonNull(keyFormatType, "keyFormatType");
        this.keyMaterial = (keyMaterial == null) ? null : keyMaterial.clone();
        this.cryptographicAlgorithm = cryptographicAlgorithm;
        this.cryptographicLength = cryptographicLength;
        this.keyWrappingData = keyWrappingData;
    }

    public KeyFormatType keyFormatType() {
        return keyFormatType;
    }

    /**
     * Returns a copy of the key material bytes, if the key value carried them.
     */
    public Optional<byte[]> keyMaterial() {
        return Optional.ofNullable(keyMaterial).map(byte[]::clone);
    }

    /**
     * Length of the key material without copying it; -1 when absent.
     */
    public int keyMaterialLength() {
        return keyMaterial == null ? -1 : keyMaterial.length;
    }

    /**
     * Copy the key material into {@code target}, which must be exactly
     * {@link #keyMaterialLength()} bytes long.
     *
     * @throws IllegalStateException if the key value carried no material
     */
    public void copyKeyMaterial(byte[] target) {
        if (keyMaterial == null) {
            throw new IllegalStateException("Key block carries no key material");
        }
        if (target.length != keyMaterial.length) {
            throw new IllegalArgumentException(
                    "Target holds " + target.length + " byte(s), key material is " + keyMaterial.length);
        }
        System.arraycopy(keyMaterial, 0, target, 0, keyMaterial.length);
    }

    public Optional<CryptographicAlgorithm> cryptographicAlgorithm() {
        return Optional.ofNullable(cryptographicAlgorithm);
    }

    public Optional<Integer> cryptographicLength() {
        return Optional.ofNullable(cryptographicLength);
    }

    public Optional<KeyWrappingData> keyWrappingData() {
        return Optional.ofNullable(keyWrappingData);
    }

    @Override
    public String toString() {
        // Key material is deliberately left out.
        return "KeyBlock[" +
                "format=" + keyFormatType +
                ", materialLength=" + keyMaterialLength() +
                ", algorithm=" + cryptographicAlgorithm +
                ", length=" + cryptographicLength +
                ", wrapped=" + (keyWrappingData != null) +
                ']';
    }
}
