/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index.hash;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import com.google.common.hash.Funnel;
import com.google.common.hash.PrimitiveSink;

import com.cloudway.dynhash.index.HashInputException;

/**
 * Funnels that serialize keys to bytes before hashing.
 */
public final class KeyFunnels
{
    private KeyFunnels() {}

    /**
     * Returns a funnel for the common key types: strings (UTF-8), boxed
     * primitives, {@link BigInteger}, {@link UUID} and enum constants (by
     * name). These all compare and match by value. Other key types,
     * including arrays and mutable character sequences, are rejected with a
     * {@link HashInputException}.
     */
    public static Funnel<Object> defaultFunnel() {
        return DefaultFunnel.INSTANCE;
    }

    private enum DefaultFunnel implements Funnel<Object> {
        INSTANCE;

        @Override
        public void funnel(Object key, PrimitiveSink into) {
            if (key instanceof String) {
                into.putString((String)key, StandardCharsets.UTF_8);
            } else if (key instanceof Integer) {
                into.putInt((Integer)key);
            } else if (key instanceof Long) {
                into.putLong((Long)key);
            } else if (key instanceof Short) {
                into.putShort((Short)key);
            } else if (key instanceof Byte) {
                into.putByte((Byte)key);
            } else if (key instanceof Boolean) {
                into.putBoolean((Boolean)key);
            } else if (key instanceof Character) {
                into.putChar((Character)key);
            } else if (key instanceof Double) {
                into.putDouble((Double)key);
            } else if (key instanceof Float) {
                into.putFloat((Float)key);
            } else if (key instanceof BigInteger) {
                into.putBytes(((BigInteger)key).toByteArray());
            } else if (key instanceof UUID) {
                UUID uuid = (UUID)key;
                into.putLong(uuid.getMostSignificantBits()).putLong(uuid.getLeastSignificantBits());
            } else if (key instanceof Enum) {
                into.putString(((Enum<?>)key).name(), StandardCharsets.UTF_8);
            } else {
                throw new HashInputException(key, "Cannot convert key of type " +
                    key.getClass().getName() + " to bytes");
            }
        }

        @Override
        public String toString() {
            return "KeyFunnels.defaultFunnel()";
        }
    }
}
