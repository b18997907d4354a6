/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.IntFunction;

import com.google.common.collect.Ordering;
import org.junit.Test;
import static org.junit.Assert.*;

/**
 * Stores every key type accepted by the default SHA-256 hasher and looks
 * each key up again with a distinct but equal instance.
 */
public class KeyTypesIndexTest
{
    private static <K> List<K> generate(int count, IntFunction<K> f) {
        List<K> keys = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            keys.add(f.apply(i));
        }
        return keys;
    }

    private static <K extends Comparable<? super K>> void roundTrip(List<K> keys, Function<K, K> copy) {
        DynamicHashIndex<K, Integer> m = DynamicHashIndex.create(IndexConfig.of(3, 1.0, Direction.LEFT_TO_RIGHT));
        for (int i = 0; i < keys.size(); i++) {
            m.add(keys.get(i), i);
        }
        for (int i = 0; i < keys.size(); i++) {
            K equal = copy.apply(keys.get(i));
            assertEquals(keys.get(i), equal);
            assertTrue("missing " + equal, m.contains(equal));
            assertEquals(Integer.valueOf(i), m.get(equal).get());
        }
        for (K key : keys) {
            assertTrue(m.delete(copy.apply(key)));
        }
        assertTrue(m.isEmpty());
        assertEquals(1, m.height());
    }

    @Test
    public void string_keys() {
        KeyTypesIndexTest.<String>roundTrip(generate(50, i -> "key-" + i), s -> new String(s.toCharArray()));
    }

    @Test
    public void integer_keys() {
        KeyTypesIndexTest.<Integer>roundTrip(generate(50, i -> 100000 + i), x -> Integer.valueOf(x.toString()));
    }

    @Test
    public void long_keys() {
        KeyTypesIndexTest.<Long>roundTrip(generate(50, i -> 1L << 40 | i), x -> Long.valueOf(x.toString()));
    }

    @Test
    public void short_keys() {
        KeyTypesIndexTest.<Short>roundTrip(generate(50, i -> (short)(1000 + i)), x -> Short.valueOf(x.toString()));
    }

    @Test
    public void byte_keys() {
        KeyTypesIndexTest.<Byte>roundTrip(generate(50, i -> (byte)(i - 25)), x -> Byte.valueOf(x.toString()));
    }

    @Test
    public void boolean_keys() {
        roundTrip(Arrays.asList(true, false), x -> Boolean.valueOf(x.toString()));
    }

    @Test
    public void character_keys() {
        KeyTypesIndexTest.<Character>roundTrip(generate(50, i -> (char)('A' + i)), x -> Character.valueOf(x.toString().charAt(0)));
    }

    @Test
    public void double_keys() {
        KeyTypesIndexTest.<Double>roundTrip(generate(50, i -> i + 0.5), x -> Double.valueOf(x.toString()));
    }

    @Test
    public void float_keys() {
        KeyTypesIndexTest.<Float>roundTrip(generate(50, i -> i + 0.25f), x -> Float.valueOf(x.toString()));
    }

    @Test
    public void big_integer_keys() {
        KeyTypesIndexTest.<BigInteger>roundTrip(generate(50, i -> BigInteger.TEN.pow(30).add(BigInteger.valueOf(i))),
                  x -> new BigInteger(x.toString()));
    }

    @Test
    public void uuid_keys() {
        KeyTypesIndexTest.<UUID>roundTrip(generate(50, i -> UUID.randomUUID()),
                  x -> new UUID(x.getMostSignificantBits(), x.getLeastSignificantBits()));
    }

    @Test
    public void enum_keys() {
        roundTrip(Arrays.asList(TimeUnit.values()), x -> TimeUnit.valueOf(x.name()));
    }

    @Test
    public void keys_without_value_equality_rejected() {
        DynamicHashIndex<Object, String> m = DynamicHashIndex.<Object, String>builder()
            .comparator(Ordering.usingToString())
            .build();
        Object[] keys = {new byte[] {1, 2}, new StringBuilder("k")};
        for (Object key : keys) {
            try {
                m.add(key, "v");
                fail("key of type " + key.getClass().getName() + " must be rejected");
            } catch (HashInputException ex) {
                assertSame(key, ex.getKey());
            }
        }
        assertTrue(m.isEmpty());
    }
}
