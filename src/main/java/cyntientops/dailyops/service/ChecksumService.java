package cyntientops.dailyops.service;

import cyntientops.dailyops.util.Jsons;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes a stable SHA-256 digest over the canonical JSON form of a dataset.
 * Same content always hashes the same; property and map order do not matter.
 */
public class ChecksumService {

    /**
     * @return lowercase hex digest
     * @throws cyntientops.dailyops.exception.SerializationException if the value cannot be serialized
     */
    public String checksum(Object dataset) {
        byte[] bytes = Jsons.toCanonicalBytes(dataset);
        return HexFormat.of().formatHex(sha256().digest(bytes));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
