/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.common;

import java.util.Optional;

public final class Config
{
    private static final Configuration.Provider DEFAULT_PROVIDER = new DefaultConfiguration.Provider();
    private static Configuration.Provider provider = DEFAULT_PROVIDER;

    public static void setProvider(Configuration.Provider prov) {
        provider = prov != null ? prov : DEFAULT_PROVIDER;
    }

    /**
     * The name of the configuration resource searched on the classpath.
     */
    public static final String DEFAULT_RESOURCE = "dynhash.properties";

    private final Configuration conf;

    public Config(String name) {
        conf = provider.load(name);
    }

    public static Config getDefault() {
        return new Config(DEFAULT_RESOURCE);
    }

    public Optional<String> get(String name) {
        return conf.getProperty(name).map(String::trim);
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public int getInt(String name, int deflt) {
        return get(name).flatMap(Optionals.of(Integer::parseInt)).orElse(deflt);
    }

    public double getDouble(String name, double deflt) {
        return get(name).flatMap(Optionals.of(Double::parseDouble)).orElse(deflt);
    }

    @Override
    public String toString() {
        return conf.toString();
    }
}
