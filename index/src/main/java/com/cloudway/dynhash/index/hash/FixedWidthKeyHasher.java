/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index.hash;

import java.math.BigInteger;

import com.cloudway.dynhash.index.BitSequence;
import com.cloudway.dynhash.index.HashInputException;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Routes integral keys on their own binary representation, truncated to
 * the low {@code width} bits. Mostly useful to build deterministic tries.
 */
public final class FixedWidthKeyHasher implements KeyHasher<Number>
{
    public static final int DEFAULT_WIDTH = 32;

    private final int width;

    private FixedWidthKeyHasher(int width) {
        this.width = width;
    }

    public static FixedWidthKeyHasher create() {
        return new FixedWidthKeyHasher(DEFAULT_WIDTH);
    }

    /**
     * @param width the number of bits, between 1 and 64
     */
    public static FixedWidthKeyHasher create(int width) {
        checkArgument(width > 0 && width <= Long.SIZE, "width out of range: %s", width);
        return new FixedWidthKeyHasher(width);
    }

    @Override
    public BitSequence hash(Number key) {
        if (key instanceof Integer || key instanceof Long || key instanceof Short ||
            key instanceof Byte || key instanceof BigInteger) {
            return BitSequence.of(key.longValue(), width);
        }
        throw new HashInputException(key, "Not an integral key: " + key);
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public String toString() {
        return "FixedWidthKeyHasher(" + width + ")";
    }
}
