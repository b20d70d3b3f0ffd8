package com.adlanda.knowledgesync.service;

import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Service for computing content hashes.
 *
 * The hash is recorded with every ingested document and copied into chunk metadata,
 * so downstream consumers can tell which version of a document a chunk came from.
 */
@Service
public class FileHashService {

    /**
     * Computes the SHA-256 hash of raw content.
     *
     * @param content The bytes to hash
     * @return Hexadecimal string representation of the hash (64 characters)
     */
    public String computeHash(byte[] content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is always available in standard JVMs
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
