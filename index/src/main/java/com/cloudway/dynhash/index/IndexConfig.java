/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.MoreObjects;

import com.cloudway.dynhash.common.Config;

/**
 * Immutable shape parameters of a {@link DynamicHashIndex}. Out of range
 * values are clamped to the nearest valid value rather than rejected.
 */
public final class IndexConfig
{
    private static final Logger logger = Logger.getLogger(IndexConfig.class.getName());

    public static final int MIN_CAPACITY = 3;
    public static final double MIN_FILL_FACTOR = 0.25;

    public static final int DEFAULT_CAPACITY = 8;
    public static final double DEFAULT_FILL_FACTOR = 0.80;

    public static final String CAPACITY_KEY = "dynhash.bucket.capacity";
    public static final String FILL_FACTOR_KEY = "dynhash.fill.factor";
    public static final String DIRECTION_KEY = "dynhash.direction";

    private final int capacity;
    private final double fillFactor;
    private final Direction direction;

    private IndexConfig(int capacity, double fillFactor, Direction direction) {
        this.capacity = capacity;
        this.fillFactor = fillFactor;
        this.direction = direction;
    }

    /**
     * Returns the default configuration: capacity 8, fill factor 0.80,
     * left to right.
     */
    public static IndexConfig defaults() {
        return new IndexConfig(DEFAULT_CAPACITY, DEFAULT_FILL_FACTOR, Direction.DEFAULT);
    }

    /**
     * Create a configuration, clamping capacity to at least 3 and fill factor
     * to at least 0.25. A {@code null} direction falls back to the default.
     */
    public static IndexConfig of(int capacity, double fillFactor, Direction direction) {
        if (capacity < MIN_CAPACITY) {
            logger.log(Level.WARNING, "Bucket capacity {0} is too small, using {1}",
                       new Object[]{capacity, MIN_CAPACITY});
            capacity = MIN_CAPACITY;
        }
        if (!(fillFactor >= MIN_FILL_FACTOR)) {
            logger.log(Level.WARNING, "Fill factor {0} is too small, using {1}",
                       new Object[]{fillFactor, MIN_FILL_FACTOR});
            fillFactor = MIN_FILL_FACTOR;
        }
        if (direction == null) {
            logger.log(Level.WARNING, "No consumption direction given, using {0}", Direction.DEFAULT);
            direction = Direction.DEFAULT;
        }
        return new IndexConfig(capacity, fillFactor, direction);
    }

    /**
     * Create a configuration from a direction name. Unrecognized names fall
     * back to the default direction.
     */
    public static IndexConfig of(int capacity, double fillFactor, String direction) {
        return of(capacity, fillFactor, parseDirection(direction));
    }

    private static Direction parseDirection(String name) {
        return Direction.parse(name).orElseGet(() -> {
            logger.log(Level.WARNING, "Unknown consumption direction {0}, using {1}",
                       new Object[]{name, Direction.DEFAULT});
            return Direction.DEFAULT;
        });
    }

    /**
     * Load the configuration from the default configuration resource,
     * with system properties taking precedence.
     */
    public static IndexConfig load() {
        return load(Config.getDefault());
    }

    public static IndexConfig load(Config conf) {
        return of(conf.getInt(CAPACITY_KEY, DEFAULT_CAPACITY),
                  conf.getDouble(FILL_FACTOR_KEY, DEFAULT_FILL_FACTOR),
                  conf.get(DIRECTION_KEY, Direction.DEFAULT.name()));
    }

    /**
     * The raw number of entries a bucket is sized for.
     */
    public int capacity() {
        return capacity;
    }

    /**
     * The fraction of capacity above which a bucket splits.
     */
    public double fillFactor() {
        return fillFactor;
    }

    public Direction direction() {
        return direction;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof IndexConfig))
            return false;
        IndexConfig other = (IndexConfig)obj;
        return capacity == other.capacity
            && Double.compare(fillFactor, other.fillFactor) == 0
            && direction == other.direction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(capacity, fillFactor, direction);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("capacity", capacity)
            .add("fillFactor", fillFactor)
            .add("direction", direction)
            .toString();
    }
}
