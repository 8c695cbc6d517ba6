package com.flowlens.store;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map that drops its eldest entry once it holds more than {@code maxSize} entries. In access order
 * the eldest entry is the least recently read or written one, otherwise the first inserted. Not
 * thread safe; {@link FlowStore} guards it, including reads of an access-ordered map.
 */
class BoundedMap<K, V> extends LinkedHashMap<K, V> {

    private final int maxSize;
    private long evictions;

    BoundedMap(int maxSize, boolean accessOrder) {
        super(16, 0.75f, accessOrder);
        this.maxSize = maxSize;
    }

    @Override
    protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
        if (maxSize > 0 && size() > maxSize) {
            evictions++;
            return true;
        }
        return false;
    }

    long getEvictions() {
        return evictions;
    }

    void resetEvictions() {
        evictions = 0;
    }
}
