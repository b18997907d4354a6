/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.Map;

import com.google.common.collect.Maps;

/**
 * A key/value pair stored in a bucket, together with the hash bits of the
 * key that have not been consumed on the path to that bucket.
 */
final class Entry<K,V>
{
    final K key;
    final V value;
    final BitSequence residual;

    Entry(K key, V value, BitSequence residual) {
        this.key = key;
        this.value = value;
        this.residual = residual;
    }

    /**
     * Returns this entry moved one level down, with one more residual bit
     * consumed.
     */
    Entry<K,V> descend(Direction direction) {
        return new Entry<>(key, value, residual.consume(direction));
    }

    Map.Entry<K,V> toMapEntry() {
        return Maps.immutableEntry(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
