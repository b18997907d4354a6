/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.Arrays;

import com.google.common.primitives.Longs;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * An immutable sequence of bits derived from a hashed key. Bits are consumed
 * one at a time from either end, as selected by a {@link Direction}; the
 * residual sequence shares the underlying storage so consuming a bit takes
 * constant time.
 *
 * <p>Sequences compare bit by bit. The ordering is only used to route keys,
 * never to order them.
 */
public final class BitSequence implements Comparable<BitSequence>
{
    private static final BitSequence EMPTY = new BitSequence(new byte[0], 0, 0);

    // bits are packed most significant first, the sequence covers [from, to)
    private final byte[] data;
    private final int from, to;

    private BitSequence(byte[] data, int from, int to) {
        this.data = data;
        this.from = from;
        this.to = to;
    }

    public static BitSequence empty() {
        return EMPTY;
    }

    /**
     * Returns the bits of the given bytes, most significant bit of the first
     * byte first.
     */
    public static BitSequence fromBytes(byte[] bytes) {
        checkNotNull(bytes);
        return new BitSequence(bytes.clone(), 0, bytes.length * Byte.SIZE);
    }

    /**
     * Returns the low {@code width} bits of the given value, most significant
     * bit first.
     *
     * @param value the value to render
     * @param width the number of bits, between 1 and 64
     */
    public static BitSequence of(long value, int width) {
        checkArgument(width > 0 && width <= Long.SIZE, "width out of range: %s", width);
        return new BitSequence(Longs.toByteArray(value), Long.SIZE - width, Long.SIZE);
    }

    /**
     * Parse a string of {@code '0'} and {@code '1'} characters.
     */
    public static BitSequence parse(CharSequence bits) {
        int len = bits.length();
        byte[] buf = new byte[(len + Byte.SIZE - 1) / Byte.SIZE];
        for (int i = 0; i < len; i++) {
            char c = bits.charAt(i);
            if (c == '1') {
                buf[i >>> 3] |= (byte)(0x80 >>> (i & 7));
            } else if (c != '0') {
                throw new IllegalArgumentException("invalid bit character '" + c + "' at " + i);
            }
        }
        return new BitSequence(buf, 0, len);
    }

    public int length() {
        return to - from;
    }

    public boolean isEmpty() {
        return from == to;
    }

    /**
     * Returns the bit at the given position, counting from the front.
     */
    public boolean get(int index) {
        checkElementIndex(index, length());
        return bitAt(from + index);
    }

    private boolean bitAt(int pos) {
        return (data[pos >>> 3] & (0x80 >>> (pos & 7))) != 0;
    }

    /**
     * Returns the bit at the end selected by the given direction.
     *
     * @throws SequenceExhaustedException if this sequence is empty
     */
    public boolean bit(Direction direction) {
        checkNotExhausted();
        return direction == Direction.LEFT_TO_RIGHT ? bitAt(from) : bitAt(to - 1);
    }

    /**
     * Returns the residual sequence after removing one bit from the end
     * selected by the given direction.
     *
     * @throws SequenceExhaustedException if this sequence is empty
     */
    public BitSequence consume(Direction direction) {
        checkNotExhausted();
        return direction == Direction.LEFT_TO_RIGHT
            ? new BitSequence(data, from + 1, to)
            : new BitSequence(data, from, to - 1);
    }

    private void checkNotExhausted() {
        if (from == to)
            throw new SequenceExhaustedException("no bits left to consume");
    }

    @Override
    public int compareTo(BitSequence other) {
        int n = Math.min(length(), other.length());
        for (int i = 0; i < n; i++) {
            boolean a = bitAt(from + i), b = other.bitAt(other.from + i);
            if (a != b)
                return a ? 1 : -1;
        }
        return Integer.compare(length(), other.length());
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof BitSequence))
            return false;
        BitSequence other = (BitSequence)obj;
        return length() == other.length() && compareTo(other) == 0;
    }

    @Override
    public int hashCode() {
        int h = length();
        for (int i = from; i < to; i++) {
            h = 31 * h + (bitAt(i) ? 1 : 0);
        }
        return h;
    }

    @Override
    public String toString() {
        char[] buf = new char[length()];
        Arrays.fill(buf, '0');
        for (int i = 0; i < buf.length; i++) {
            if (bitAt(from + i))
                buf[i] = '1';
        }
        return new String(buf);
    }
}
