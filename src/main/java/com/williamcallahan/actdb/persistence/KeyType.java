package com.williamcallahan.actdb.persistence;

import java.util.Objects;

/**
 * How the storage key of a stored value is chosen.
 */
public sealed interface KeyType permits KeyType.Forced, KeyType.Calculated {

    static KeyType forced(String key) {
        return new Forced(key);
    }

    static KeyType calculated(String prefix) {
        return new Calculated(prefix);
    }

    /**
     * Store under exactly this key, replacing any previous value.
     *
     * @param key full storage key including any prefixes
     */
    record Forced(String key) implements KeyType {
        public Forced {
            Objects.requireNonNull(key, "Storage key is required");
            if (key.isBlank()) {
                throw new IllegalArgumentException("Storage key must not be blank");
            }
        }
    }

    /**
     * Store under a key derived from the content hash. Equal values share one blob.
     *
     * @param prefix key prefix without a trailing slash
     */
    record Calculated(String prefix) implements KeyType {
        public Calculated {
            Objects.requireNonNull(prefix, "Key prefix is required");
        }
    }
}
