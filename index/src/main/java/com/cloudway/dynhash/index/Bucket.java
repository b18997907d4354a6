/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * A leaf of the index: entries kept in ascending key order. Several entries
 * may share a key; a new duplicate is placed after the existing ones.
 */
final class Bucket<K,V> implements Branch<K,V>, Iterable<Entry<K,V>>
{
    private final Comparator<? super K> comparator;
    private final List<Entry<K,V>> entries = new ArrayList<>();

    Bucket(Comparator<? super K> comparator) {
        this.comparator = comparator;
    }

    @Override
    public boolean isBucket() {
        return true;
    }

    @Override
    public Bucket<K,V> asBucket() {
        return this;
    }

    int size() {
        return entries.size();
    }

    boolean isEmpty() {
        return entries.isEmpty();
    }

    void insert(Entry<K,V> entry) {
        // upper bound: first position whose key is greater than the new key
        int lo = 0, hi = entries.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (comparator.compare(entries.get(mid).key, entry.key) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        entries.add(lo, entry);
    }

    Entry<K,V> firstMatch(Object key) {
        for (Entry<K,V> e : entries) {
            if (Objects.equals(e.key, key))
                return e;
        }
        return null;
    }

    Entry<K,V> removeFirstMatch(Object key) {
        for (Iterator<Entry<K,V>> it = entries.iterator(); it.hasNext(); ) {
            Entry<K,V> e = it.next();
            if (Objects.equals(e.key, key)) {
                it.remove();
                return e;
            }
        }
        return null;
    }

    boolean contains(Object key) {
        return firstMatch(key) != null;
    }

    List<V> allMatches(Object key) {
        List<V> values = new ArrayList<>();
        for (Entry<K,V> e : entries) {
            if (Objects.equals(e.key, key))
                values.add(e.value);
        }
        return Collections.unmodifiableList(values);
    }

    boolean isFull(int capacity, double fillFactor) {
        return entries.size() > capacity * fillFactor;
    }

    /**
     * Returns true if some entry has no residual bits left, so the bucket
     * can no longer be split.
     */
    boolean isExhausted() {
        for (Entry<K,V> e : entries) {
            if (e.residual.isEmpty())
                return true;
        }
        return false;
    }

    /**
     * Removes and returns all entries, in key order.
     */
    List<Entry<K,V>> drain() {
        List<Entry<K,V>> all = new ArrayList<>(entries);
        entries.clear();
        return all;
    }

    @Override
    public Iterator<Entry<K,V>> iterator() {
        return Collections.unmodifiableList(entries).iterator();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
