/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.dynhash.common;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.io.Resources;

import static java.util.Objects.requireNonNull;

/**
 * Properties loaded from a classpath resource. System properties take
 * precedence over the values read from the resource.
 */
class DefaultConfiguration implements Configuration
{
    private static final Logger logger = Logger.getLogger(DefaultConfiguration.class.getName());

    private final Properties props = new Properties();

    @Override
    public Optional<String> getProperty(String name) {
        Optional<String> val = Optional.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Optional.ofNullable(props.getProperty(name));
    }

    @Override
    public String toString() {
        return props.toString();
    }

    static class ConfigurationLoader extends CacheLoader<String, DefaultConfiguration> {
        private final ClassLoader loader;

        ConfigurationLoader(ClassLoader loader) {
            this.loader = loader;
        }

        @Override
        public DefaultConfiguration load(String name) throws IOException {
            DefaultConfiguration conf = new DefaultConfiguration();
            URL url = loader.getResource(name);
            if (url != null) {
                try (InputStream in = Resources.asByteSource(url).openBufferedStream()) {
                    conf.props.load(in);
                }
            } else {
                // use defaults if configuration resource not found
                logger.log(Level.FINE, "Configuration resource {0} not found, using defaults", name);
            }
            return conf;
        }
    }

    @SuppressWarnings("ClassNameSameAsAncestorName")
    static class Provider implements Configuration.Provider {
        private final LoadingCache<String, DefaultConfiguration> cache;

        Provider() {
            this(DefaultConfiguration.class.getClassLoader());
        }

        Provider(ClassLoader loader) {
            cache = CacheBuilder.newBuilder().build(new ConfigurationLoader(loader));
        }

        @Override
        public Configuration load(String name) {
            return cache.getUnchecked(requireNonNull(name));
        }
    }
}
