package com.williamcallahan.actdb.persistence;

import org.springframework.stereotype.Component;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content hashes for content-addressed storage keys.
 */
@Component
public class ContentHasher {

    /**
     * Generates SHA-256 hash for serialized content.
     *
     * @param data bytes to hash
     * @return hexadecimal string representation of the hash
     */
    public String sha256(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(data);
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Builds a storage key of the form {@code prefix/hh/hhhhhhhhhhhhhh} from the first 64 bits of the
     * content hash. The two-character directory level keeps directories small.
     *
     * @param prefix key prefix without a trailing slash
     * @param data serialized value
     * @return storage key
     */
    public String storageKey(String prefix, byte[] data) {
        String hash = sha256(data);
        return prefix + "/" + hash.substring(0, 2) + "/" + hash.substring(2, 16);
    }
}
