/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.instaclustr.webapp.ldap.cache;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.RemovalListener;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TimedCache} on a Guava {@link Cache}. Each entry remembers its own expiry so the ttl can differ per call.
 */
public class GuavaTimedCache<K, V> implements TimedCache<K, V>
{

    private static final Logger logger = LoggerFactory.getLogger(GuavaTimedCache.class);

    private final String name;

    private final Ticker ticker;

    private final Cache<K, Expiring<V>> cache;

    public GuavaTimedCache(final String name, final long maximumSize)
    {
        this(name, maximumSize, Ticker.systemTicker(), value -> {});
    }

    public GuavaTimedCache(final String name, final long maximumSize, final Ticker ticker)
    {
        this(name, maximumSize, ticker, value -> {});
    }

    /**
     * @param onRemoval called with every value leaving the cache, whether stale, evicted or invalidated
     */
    public GuavaTimedCache(final String name, final long maximumSize, final Ticker ticker, final Consumer<? super V> onRemoval)
    {
        this.name = name;
        this.ticker = ticker;

        final RemovalListener<K, Expiring<V>> listener = notification ->
        {
            logger.trace("{}: removed {} ({})", name, notification.getKey(), notification.getCause());

            if (notification.getValue() != null)
            {
                onRemoval.accept(notification.getValue().value);
            }
        };

        this.cache = CacheBuilder.newBuilder()
                                 .maximumSize(maximumSize)
                                 .removalListener(listener)
                                 .build();

        logger.info("Using cache {} with maximum size {}", name, maximumSize);
    }

    @Override
    public V getOrCompute(final K key, final Duration ttl, final Supplier<? extends V> loader)
    {
        final Expiring<V> cached = cache.getIfPresent(key);

        if (cached != null && cached.isStale(ticker.read()))
        {
            logger.debug("{}: entry for {} is stale, recomputing", name, key);
            cache.asMap().remove(key, cached);
        }

        try
        {
            return cache.get(key, () -> new Expiring<V>(loader.get(), ticker.read() + ttl.toNanos())).value;
        } catch (final UncheckedExecutionException ex)
        {
            if (ex.getCause() instanceof RuntimeException)
            {
                throw (RuntimeException) ex.getCause();
            }

            throw ex;
        } catch (final ExecutionException ex)
        {
            // a Supplier can not throw checked exceptions
            throw new UncheckedExecutionException(ex.getCause());
        }
    }

    @Override
    public void invalidate(final K key)
    {
        cache.invalidate(key);
    }

    @Override
    public void invalidate(final K key, final V value)
    {
        final Expiring<V> cached = cache.getIfPresent(key);

        if (cached != null && cached.value == value)
        {
            cache.asMap().remove(key, cached);
        }
    }

    @Override
    public void invalidateIf(final Predicate<? super K> predicate)
    {
        for (final K key : cache.asMap().keySet())
        {
            if (predicate.test(key))
            {
                cache.invalidate(key);
            }
        }
    }

    @Override
    public void invalidateAll()
    {
        cache.invalidateAll();
    }

    @Override
    public long size()
    {
        return cache.size();
    }

    private static final class Expiring<V>
    {

        private final V value;

        private final long expiresAtNanos;

        private Expiring(final V value, final long expiresAtNanos)
        {
            this.value = value;
            this.expiresAtNanos = expiresAtNanos;
        }

        private boolean isStale(final long nowNanos)
        {
            return nowNanos - expiresAtNanos >= 0;
        }
    }
}
