/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.collect.AbstractIterator;

/**
 * An internal node of the index. Each node routes on one bit of the hashed
 * key and owns two independent branches, each of which is either a bucket
 * or a child node.
 *
 * <p>All descents are iterative. The explicit stacks used for deletion and
 * traversal never hold more than one element per level, and the number of
 * levels is bounded by the width of the hash.
 */
final class Node<K,V> implements Branch<K,V>
{
    private static final Logger logger = Logger.getLogger(Node.class.getName());

    private final int depth;
    private final IndexConfig config;
    private final Comparator<? super K> comparator;

    private Branch<K,V> left, right;

    Node(int depth, IndexConfig config, Comparator<? super K> comparator) {
        this.depth = depth;
        this.config = config;
        this.comparator = comparator;
        this.left = new Bucket<>(comparator);
        this.right = new Bucket<>(comparator);
    }

    @Override
    public boolean isBucket() {
        return false;
    }

    @Override
    public Node<K,V> asNode() {
        return this;
    }

    int depth() {
        return depth;
    }

    Branch<K,V> branch(Side side) {
        return side == Side.LEFT ? left : right;
    }

    private void setBranch(Side side, Branch<K,V> branch) {
        if (side == Side.LEFT) {
            left = branch;
        } else {
            right = branch;
        }
    }

    private Side route(BitSequence bits) {
        return Side.of(bits.bit(config.direction()));
    }

    /**
     * Adds an entry below this node. The bucket that receives the entry is
     * split into a new child node if it exceeds its fill threshold.
     *
     * @param bits the hash bits of the key not consumed above this node
     */
    void add(K key, V value, BitSequence bits) {
        Direction dir = config.direction();
        Node<K,V> node = this;
        while (true) {
            Side side = node.route(bits);
            bits = bits.consume(dir);
            Branch<K,V> branch = node.branch(side);
            if (branch.isBucket()) {
                Bucket<K,V> bucket = branch.asBucket();
                bucket.insert(new Entry<>(key, value, bits));
                if (bucket.isFull(config.capacity(), config.fillFactor()))
                    node.overflow(side);
                return;
            }
            node = branch.asNode();
        }
    }

    /**
     * Replaces a full bucket with a new child node one level deeper. Each
     * entry is routed by the next bit of its own residual, so keys are never
     * rehashed. Entries are moved without checking the child's buckets, so
     * one insertion grows the tree by at most one level.
     */
    private void overflow(Side side) {
        Bucket<K,V> full = branch(side).asBucket();
        if (full.isExhausted()) {
            logger.log(Level.FINE, "Hash bits exhausted at depth {0}, keeping {1} entries in collision bucket",
                       new Object[]{depth, full.size()});
            return;
        }

        Node<K,V> child = new Node<>(depth + 1, config, comparator);
        for (Entry<K,V> e : full.drain()) {
            child.place(e);
        }
        setBranch(side, child);
        logger.log(Level.FINE, "Split {0} bucket at depth {1}", new Object[]{side, depth});
    }

    private void place(Entry<K,V> e) {
        branch(route(e.residual)).asBucket().insert(e.descend(config.direction()));
    }

    /**
     * Returns the bucket the given hash bits lead to.
     */
    Bucket<K,V> locate(BitSequence bits) {
        Direction dir = config.direction();
        Node<K,V> node = this;
        while (true) {
            Side side = node.route(bits);
            bits = bits.consume(dir);
            Branch<K,V> branch = node.branch(side);
            if (branch.isBucket())
                return branch.asBucket();
            node = branch.asNode();
        }
    }

    /**
     * Removes the first entry with the given key. Every node on the path,
     * except this one, that is left with two empty buckets is replaced in
     * its parent by a single empty bucket, from the bottom up.
     *
     * @return the removed entry, or {@code null} if the key was not found
     */
    Entry<K,V> delete(Object key, BitSequence bits) {
        Direction dir = config.direction();
        Deque<Node<K,V>> parents = new ArrayDeque<>(bits.length());
        Deque<Side> slots = new ArrayDeque<>(bits.length());

        Node<K,V> node = this;
        Side side;
        while (true) {
            side = node.route(bits);
            bits = bits.consume(dir);
            Branch<K,V> branch = node.branch(side);
            if (branch.isBucket())
                break;
            parents.push(node);
            slots.push(side);
            node = branch.asNode();
        }

        Entry<K,V> removed = node.branch(side).asBucket().removeFirstMatch(key);

        while (!parents.isEmpty() && node.isCollapsible()) {
            Node<K,V> parent = parents.pop();
            parent.setBranch(slots.pop(), new Bucket<>(comparator));
            logger.log(Level.FINE, "Merged empty buckets at depth {0}", node.depth);
            node = parent;
        }
        return removed;
    }

    /**
     * Returns true if both branches are empty buckets.
     */
    boolean isCollapsible() {
        return left.isBucket() && left.asBucket().isEmpty()
            && right.isBucket() && right.asBucket().isEmpty();
    }

    /**
     * Returns the number of node levels from this node down to its deepest
     * descendant, counting this node.
     */
    int height() {
        int height = 1;
        Deque<Node<K,V>> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node<K,V> node = stack.pop();
            height = Math.max(height, node.depth - depth + 1);
            for (Side side : Side.values()) {
                Branch<K,V> branch = node.branch(side);
                if (!branch.isBucket())
                    stack.push(branch.asNode());
            }
        }
        return height;
    }

    /**
     * Returns an iterator over all entries below this node: depth first,
     * left branch before right branch, each bucket in key order.
     */
    Iterator<Entry<K,V>> traverser() {
        return new Traverser<>(this);
    }

    private static final class Traverser<K,V> extends AbstractIterator<Entry<K,V>> {
        private final Deque<Branch<K,V>> pending = new ArrayDeque<>();
        private Iterator<Entry<K,V>> current;

        Traverser(Node<K,V> root) {
            pending.push(root);
        }

        @Override
        protected Entry<K,V> computeNext() {
            while (current == null || !current.hasNext()) {
                if (pending.isEmpty())
                    return endOfData();
                Branch<K,V> branch = pending.pop();
                if (branch.isBucket()) {
                    current = branch.asBucket().iterator();
                } else {
                    Node<K,V> node = branch.asNode();
                    pending.push(node.right);
                    pending.push(node.left);
                }
            }
            return current.next();
        }
    }

    @Override
    public String toString() {
        return "Node(depth=" + depth + ", left=" + left + ", right=" + right + ")";
    }
}
