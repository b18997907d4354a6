/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.UUID;

import com.google.common.collect.Ordering;
import org.junit.Test;
import static org.junit.Assert.*;

import com.cloudway.dynhash.index.hash.KeyHasher;
import com.cloudway.dynhash.index.hash.Sha256KeyHasher;

public class DynamicHashIndexTest extends DynamicHashIndexTestBase
{
    @Override
    protected DynamicHashIndex<Integer, Integer> newIndex() {
        return DynamicHashIndex.create(IndexConfig.of(4, 0.8, Direction.LEFT_TO_RIGHT));
    }

    @Test
    public void string_keys() {
        DynamicHashIndex<String, Integer> m = DynamicHashIndex.create(IndexConfig.defaults());
        for (int i = 0; i < 100; i++) {
            m.add("key" + i, i);
        }
        for (int i = 0; i < 100; i++) {
            assertEquals(Integer.valueOf(i), m.get("key" + i).get());
        }
        assertFalse(m.contains("key100"));
        assertTrue(m.height() > 1);
        assertEquals(100, m.traverse().count());
    }

    @Test
    public void uuid_keys() {
        DynamicHashIndex<UUID, String> m = DynamicHashIndex.<UUID, String>builder()
            .capacity(3).fillFactor(1.0).build();
        UUID u1 = UUID.randomUUID(), u2 = UUID.randomUUID();
        m.add(u1, "a");
        m.add(u2, "b");
        assertEquals("a", m.get(u1).get());
        assertEquals("b", m.get(u2).get());
    }

    @Test(expected = HashInputException.class)
    public void unsupported_key_type() {
        DynamicHashIndex<Object, String> m = DynamicHashIndex.<Object, String>builder()
            .comparator(Ordering.usingToString())
            .build();
        m.add(new Object(), "value");
    }

    @Test
    public void unsupported_key_type_on_lookup() {
        DynamicHashIndex<Object, String> m = DynamicHashIndex.<Object, String>builder()
            .comparator(Ordering.usingToString())
            .build();
        m.add("text", "value");
        try {
            m.contains(new char[] {'x', 'y'});
            fail("char[] key must be rejected");
        } catch (HashInputException ex) {
            assertNotNull(ex.getKey());
        }
        assertEquals(1, m.size());
    }

    @Test
    public void wrong_hash_width() {
        KeyHasher<Integer> shortHasher = new KeyHasher<Integer>() {
            @Override
            public BitSequence hash(Integer key) {
                return BitSequence.of(key, 8);
            }

            @Override
            public int width() {
                return 16;
            }
        };
        DynamicHashIndex<Integer, Integer> m = DynamicHashIndex.create(IndexConfig.defaults(), shortHasher);
        try {
            m.add(1, 1);
            fail("hash of wrong width must be rejected");
        } catch (HashInputException ex) {
            assertEquals(1, ex.getKey());
        }
        assertTrue(m.isEmpty());
    }

    @Test
    public void builder_defaults() {
        DynamicHashIndex<String, String> m = DynamicHashIndex.<String, String>builder().build();
        assertEquals(IndexConfig.defaults(), m.config());
        m.add("a", "b");
        assertEquals("b", m.get("a").get());
    }

    @Test
    public void builder_from_config() {
        IndexConfig conf = IndexConfig.of(5, 0.5, Direction.RIGHT_TO_LEFT);
        DynamicHashIndex<String, String> m = DynamicHashIndex.<String, String>builder().config(conf).build();
        assertEquals(conf, m.config());
    }

    @Test
    public void builder_clamps_config() {
        DynamicHashIndex<String, String> m = DynamicHashIndex.<String, String>builder()
            .capacity(1).fillFactor(0.1).direction(null)
            .hasher(Sha256KeyHasher.create())
            .build();
        assertEquals(IndexConfig.MIN_CAPACITY, m.config().capacity());
        assertEquals(IndexConfig.MIN_FILL_FACTOR, m.config().fillFactor(), 0.0);
        assertEquals(Direction.LEFT_TO_RIGHT, m.config().direction());
    }

    @Test
    public void create_from_resource() {
        DynamicHashIndex<String, String> m = DynamicHashIndex.create();
        assertEquals(IndexConfig.load(), m.config());
        m.add("x", "y");
        assertTrue(m.contains("x"));
    }
}
