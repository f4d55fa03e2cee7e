package com.sparrowwallet.vortex.ratchet;

import com.sparrowwallet.vortex.Utils;

import java.util.*;

/**
 * Message keys derived ahead of the messages that need them, keyed by the sender's ratchet public key and message
 * number. Holds at most {@code capacity} keys; inserting beyond that evicts the oldest.
 */
public class SkippedMessageKeys {
    private final int capacity;
    private final LinkedHashMap<String, SkippedKey> keys = new LinkedHashMap<>();

    public SkippedMessageKeys(int capacity) {
        this.capacity = capacity;
    }

    public static String keyFor(byte[] ratchetPublicKey, int messageNumber) {
        return Utils.toBase64(ratchetPublicKey) + ":" + messageNumber;
    }

    /**
     * Caches a key and returns the number of older keys evicted to stay within capacity.
     */
    public int put(String key, byte[] messageKey, long timestamp) {
        SkippedKey previous = keys.put(key, new SkippedKey(messageKey, timestamp));
        if(previous != null) {
            previous.wipe();
        }

        int evicted = 0;
        Iterator<SkippedKey> iter = keys.values().iterator();
        while(keys.size() > capacity && iter.hasNext()) {
            iter.next().wipe();
            iter.remove();
            evicted++;
        }

        return evicted;
    }

    /**
     * Removes and returns the message key for the given ratchet key and message number, if cached.
     */
    public Optional<byte[]> take(byte[] ratchetPublicKey, int messageNumber) {
        SkippedKey skippedKey = keys.remove(keyFor(ratchetPublicKey, messageNumber));
        return Optional.ofNullable(skippedKey).map(SkippedKey::messageKey);
    }

    /**
     * Deletes every key cached before the given time and returns how many were deleted.
     */
    public int removeOlderThan(long cutoff) {
        int removed = 0;
        for(Iterator<SkippedKey> iter = keys.values().iterator(); iter.hasNext(); ) {
            SkippedKey skippedKey = iter.next();
            if(skippedKey.timestamp() < cutoff) {
                skippedKey.wipe();
                iter.remove();
                removed++;
            }
        }

        return removed;
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    /**
     * Returns the cached entries in insertion order.
     */
    public Map<String, SkippedKey> entries() {
        return Collections.unmodifiableMap(keys);
    }

    public SkippedMessageKeys copy() {
        SkippedMessageKeys copy = new SkippedMessageKeys(capacity);
        for(Map.Entry<String, SkippedKey> entry : keys.entrySet()) {
            copy.keys.put(entry.getKey(), new SkippedKey(entry.getValue().messageKey().clone(), entry.getValue().timestamp()));
        }

        return copy;
    }

    public void wipe() {
        for(SkippedKey skippedKey : keys.values()) {
            skippedKey.wipe();
        }
        keys.clear();
    }

    public record SkippedKey(byte[] messageKey, long timestamp) {
        void wipe() {
            Utils.wipe(messageKey);
        }
    }
}
