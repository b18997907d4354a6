/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index.hash;

import com.google.common.hash.Funnel;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

import com.cloudway.dynhash.index.BitSequence;

import static java.util.Objects.requireNonNull;

/**
 * Hashes keys with SHA-256 and routes on all 256 bits of the digest.
 *
 * @param <K> the type of keys
 */
public final class Sha256KeyHasher<K> implements KeyHasher<K>
{
    public static final int WIDTH = 256;

    private static final HashFunction SHA256 = Hashing.sha256();

    private final Funnel<? super K> funnel;

    private Sha256KeyHasher(Funnel<? super K> funnel) {
        this.funnel = funnel;
    }

    /**
     * Returns a hasher that serializes keys with {@link KeyFunnels#defaultFunnel()}.
     */
    public static Sha256KeyHasher<Object> create() {
        return new Sha256KeyHasher<>(KeyFunnels.defaultFunnel());
    }

    /**
     * Returns a hasher that serializes keys with the given funnel.
     */
    public static <K> Sha256KeyHasher<K> create(Funnel<? super K> funnel) {
        return new Sha256KeyHasher<>(requireNonNull(funnel));
    }

    @Override
    public BitSequence hash(K key) {
        return BitSequence.fromBytes(SHA256.hashObject(key, funnel).asBytes());
    }

    @Override
    public int width() {
        return WIDTH;
    }

    @Override
    public String toString() {
        return "Sha256KeyHasher(" + funnel + ")";
    }
}
