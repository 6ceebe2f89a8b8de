package com.example.spamnet.util;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Set of recently seen keys bounded by size and age. Used as the gossip dedup
 * ledger: a key stays known for {@code ttlMs} after it was first added, and the
 * oldest keys are evicted first once {@code maxSize} is exceeded.
 *
 * <p>Not thread-safe; the owner serialises access.
 */
public class LruTtlSet {

    private final int maxSize;
    private final long ttlMs;
    // Insertion order == age order, since re-adding a present key is a no-op
    private final LinkedHashMap<String, Long> map;

    public LruTtlSet(int maxSize, long ttlMs) {
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize");
        if (ttlMs <= 0) throw new IllegalArgumentException("ttlMs");
        this.maxSize = maxSize;
        this.ttlMs = ttlMs;
        this.map = new LinkedHashMap<>(16, 0.75f, false);
    }

    public boolean addIfAbsent(String key, long now) {
        prune(now);
        if (map.containsKey(key)) {
            return false;
        }
        map.put(key, now);
        if (map.size() > maxSize) {
            Iterator<Map.Entry<String, Long>> it = map.entrySet().iterator();
            it.next();
            it.remove();
        }
        return true;
    }

    public boolean contains(String key, long now) {
        prune(now);
        return map.containsKey(key);
    }

    /** Forgets {@code key} so the same message can be accepted again. */
    public boolean remove(String key) {
        return map.remove(key) != null;
    }

    public int size() {
        return map.size();
    }

    private void prune(long now) {
        if (map.isEmpty()) return;
        long threshold = now - ttlMs;
        Iterator<Map.Entry<String, Long>> it = map.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Long> e = it.next();
            if (e.getValue() >= threshold) {
                break;
            }
            it.remove();
        }
    }
}
