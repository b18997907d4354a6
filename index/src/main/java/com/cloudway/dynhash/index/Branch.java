/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

/**
 * The content of one of the two slots of a {@link Node}: either a leaf
 * {@link Bucket} or an internal child {@link Node}. Callers test
 * {@link #isBucket()} and then take the matching view; taking the other
 * view is an internal error.
 */
interface Branch<K,V>
{
    boolean isBucket();

    default Bucket<K,V> asBucket() {
        throw new IllegalStateException("branch is not a bucket: " + this);
    }

    default Node<K,V> asNode() {
        throw new IllegalStateException("branch is not a node: " + this);
    }

    /**
     * The two slots of a node, selected by one hash bit.
     */
    enum Side {
        LEFT, RIGHT;

        static Side of(boolean bit) {
            return bit ? RIGHT : LEFT;
        }
    }
}
