package com.transmuter.domain;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Price-feed descriptor of a collateral. {@code peg} names the reference the collateral tracks (e.g. "EUR")
 * and {@code targetPrice} its BASE_18 value in stablecoins at peg.
 */
public record OracleConfig(OracleReadType readType, String peg, BigInteger targetPrice) {

    /**
     * Hash of the peg reference. Collaterals sharing it are correlated and price redemptions together.
     */
    public String configHash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            String key = (peg == null ? "" : peg) + "|" + (targetPrice == null ? "" : targetPrice.toString());
            return HexFormat.of().formatHex(digest.digest(key.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
