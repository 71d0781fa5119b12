package com.rangerewards.domain;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import lombok.Value;

/**
 * Stable identity of a liquidity position: owner (address or NFT id), pool, tick range and a
 * salt separating several ranges of the same owner.
 *
 * <p>{@link #getId()} is the SHA-256 of the identifying fields and is what the REST surface
 * exposes.
 */
@Value
public class PositionKey {

    String owner;
    String poolId;
    int tickLower;
    int tickUpper;
    String salt;
    String id;

    public static PositionKey of(String owner, String poolId, int tickLower, int tickUpper, String salt) {
        String normalizedSalt = salt != null ? salt : "";
        String raw = String.join(
                "|", owner, poolId, String.valueOf(tickLower), String.valueOf(tickUpper), normalizedSalt);
        return new PositionKey(owner, poolId, tickLower, tickUpper, normalizedSalt, sha256(raw));
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JDK provides SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
