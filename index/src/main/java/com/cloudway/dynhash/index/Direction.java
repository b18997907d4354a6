/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.Optional;

/**
 * The end of a {@link BitSequence} from which bits are consumed while
 * descending the index.
 */
public enum Direction
{
    /** Consume the most significant (first) bit first. */
    LEFT_TO_RIGHT,

    /** Consume the least significant (last) bit first. */
    RIGHT_TO_LEFT;

    public static final Direction DEFAULT = LEFT_TO_RIGHT;

    /**
     * Parse a direction name, case insensitive. Dashes are accepted in place
     * of underscores.
     *
     * @param name the direction name
     * @return the direction, or empty if the name is not recognized
     */
    public static Optional<Direction> parse(String name) {
        if (name == null)
            return Optional.empty();
        String canon = name.trim().replace('-', '_');
        for (Direction d : values()) {
            if (d.name().equalsIgnoreCase(canon))
                return Optional.of(d);
        }
        return Optional.empty();
    }
}
