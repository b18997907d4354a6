/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

/**
 * Thrown when a bit is consumed from an empty {@link BitSequence}.
 */
public class SequenceExhaustedException extends RuntimeException
{
    private static final long serialVersionUID = -2370813945620551823L;

    public SequenceExhaustedException(String message) {
        super(message);
    }
}
