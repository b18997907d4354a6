/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import com.google.common.base.MoreObjects;
import com.google.common.collect.Iterators;
import com.google.common.collect.Ordering;

import com.cloudway.dynhash.common.Optionals;
import com.cloudway.dynhash.index.hash.KeyHasher;
import com.cloudway.dynhash.index.hash.Sha256KeyHasher;

import static java.util.Objects.requireNonNull;

/**
 * A dynamic hashing index: a binary trie over the bits of a hash of each
 * key. Leaves are key ordered buckets of bounded size; a bucket that grows
 * beyond its fill threshold is split into a subtree, and a subtree whose two
 * buckets become empty is merged back into a single bucket.
 *
 * <p>The index is a multimap. Several entries may be added under the same
 * key; {@link #get}, {@link #contains} and {@link #delete} act on the first
 * matching entry of the key's bucket.
 *
 * <p>Iteration order follows the structure of the hash bits, not the key
 * order: entries are only sorted within a bucket.
 *
 * <p>This class is not thread safe.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public final class DynamicHashIndex<K, V> implements Iterable<Map.Entry<K, V>>
{
    private final IndexConfig config;
    private final KeyHasher<? super K> hasher;
    private final Node<K,V> root;
    private int size;

    private DynamicHashIndex(IndexConfig config, KeyHasher<? super K> hasher, Comparator<? super K> comparator) {
        this.config = requireNonNull(config);
        this.hasher = requireNonNull(hasher);
        this.root = new Node<>(0, config, requireNonNull(comparator));
    }

    /**
     * Create an index configured from the {@code dynhash.properties} resource
     * and system properties, hashing keys with SHA-256.
     */
    public static <K extends Comparable<? super K>, V> DynamicHashIndex<K, V> create() {
        return create(IndexConfig.load());
    }

    public static <K extends Comparable<? super K>, V> DynamicHashIndex<K, V> create(IndexConfig config) {
        return create(config, Sha256KeyHasher.create());
    }

    public static <K extends Comparable<? super K>, V> DynamicHashIndex<K, V>
    create(IndexConfig config, KeyHasher<? super K> hasher) {
        return new DynamicHashIndex<K, V>(config, hasher, Ordering.<K>natural());
    }

    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    /**
     * Builds an index with explicit parameters. Parameters left unset take
     * their default values.
     */
    public static final class Builder<K, V> {
        private int capacity = IndexConfig.DEFAULT_CAPACITY;
        private double fillFactor = IndexConfig.DEFAULT_FILL_FACTOR;
        private Direction direction = Direction.DEFAULT;
        private KeyHasher<? super K> hasher;
        private Comparator<? super K> comparator;

        Builder() {}

        public Builder<K, V> capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder<K, V> fillFactor(double fillFactor) {
            this.fillFactor = fillFactor;
            return this;
        }

        public Builder<K, V> direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder<K, V> config(IndexConfig config) {
            this.capacity = config.capacity();
            this.fillFactor = config.fillFactor();
            this.direction = config.direction();
            return this;
        }

        public Builder<K, V> hasher(KeyHasher<? super K> hasher) {
            this.hasher = hasher;
            return this;
        }

        /**
         * Sets the order of entries within a bucket. Keys must be
         * {@link Comparable} when no comparator is given.
         */
        public Builder<K, V> comparator(Comparator<? super K> comparator) {
            this.comparator = comparator;
            return this;
        }

        public DynamicHashIndex<K, V> build() {
            return new DynamicHashIndex<K, V>(
                IndexConfig.of(capacity, fillFactor, direction),
                Optionals.<KeyHasher<? super K>>or(hasher, Sha256KeyHasher::create),
                Optionals.<Comparator<? super K>>firstNonNull(comparator, Builder.<K>naturalOrder()));
        }

        @SuppressWarnings("unchecked")
        private static <K> Comparator<? super K> naturalOrder() {
            return (Comparator<? super K>)(Comparator<?>)Ordering.natural();
        }
    }

    public IndexConfig config() {
        return config;
    }

    private BitSequence hash(K key) {
        requireNonNull(key, "key");
        BitSequence bits = hasher.hash(key);
        if (bits == null || bits.length() != hasher.width()) {
            throw new HashInputException(key, "Hash of key " + key + " has " +
                (bits == null ? "no" : String.valueOf(bits.length())) +
                " bits, expected " + hasher.width());
        }
        return bits;
    }

    /**
     * Adds an entry. Entries already stored under the same key are kept.
     *
     * @throws HashInputException if the key cannot be hashed
     */
    public void add(K key, V value) {
        root.add(key, value, hash(key));
        size++;
    }

    /**
     * Returns the value of the first entry stored under the given key.
     */
    public Optional<V> get(K key) {
        Entry<K,V> e = root.locate(hash(key)).firstMatch(key);
        return e != null ? Optional.ofNullable(e.value) : Optional.empty();
    }

    /**
     * Returns the values of all entries stored under the given key, in
     * bucket order.
     */
    public List<V> getAll(K key) {
        return root.locate(hash(key)).allMatches(key);
    }

    public boolean contains(K key) {
        return root.locate(hash(key)).contains(key);
    }

    /**
     * Removes the first entry stored under the given key. Nothing happens
     * if the key is absent.
     *
     * @return true if an entry was removed
     */
    public boolean delete(K key) {
        if (root.delete(key, hash(key)) != null) {
            size--;
            return true;
        }
        return false;
    }

    /**
     * Returns the number of node levels of the trie. An index without any
     * split has height 1.
     */
    public int height() {
        return root.height();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return Iterators.unmodifiableIterator(Iterators.transform(root.traverser(), Entry::toMapEntry));
    }

    /**
     * Returns all entries: depth first, left branch before right branch,
     * each bucket in key order.
     */
    public Stream<Map.Entry<K, V>> traverse() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("config", config)
            .add("size", size)
            .add("height", height())
            .toString();
    }
}
