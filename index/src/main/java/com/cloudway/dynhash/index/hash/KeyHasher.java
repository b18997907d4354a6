/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index.hash;

import com.cloudway.dynhash.index.BitSequence;
import com.cloudway.dynhash.index.HashInputException;

/**
 * Converts a key into the fixed width bit sequence that routes it through
 * a {@link com.cloudway.dynhash.index.DynamicHashIndex}.
 *
 * @param <K> the type of keys
 */
public interface KeyHasher<K>
{
    /**
     * Hash the given key.
     *
     * @param key the key to hash, never {@code null}
     * @return a bit sequence of exactly {@link #width()} bits
     * @throws HashInputException if the key cannot be converted to bytes
     */
    BitSequence hash(K key);

    /**
     * The number of bits of every sequence produced by this hasher.
     */
    int width();
}
