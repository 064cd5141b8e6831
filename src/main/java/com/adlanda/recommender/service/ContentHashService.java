package com.adlanda.recommender.service;

import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes content hashes of embedding input text.
 *
 * Used for change detection during sync: an item whose hash matches the
 * snapshot stored next to its vector has not changed and is not re-embedded.
 */
@Service
public class ContentHashService {

    /**
     * Computes the SHA-256 hash of the given text.
     *
     * @param content The text to hash
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashBytes = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
