/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.index;

/**
 * Thrown when a key cannot be converted into the form required by a
 * {@link com.cloudway.dynhash.index.hash.KeyHasher}, or when the hasher
 * produces a bit sequence of unexpected width.
 */
public class HashInputException extends RuntimeException
{
    private static final long serialVersionUID = 6124775328031570942L;

    private final transient Object key;

    public HashInputException(Object key, String message) {
        super(message);
        this.key = key;
    }

    public HashInputException(Object key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public Object getKey() {
        return key;
    }
}
