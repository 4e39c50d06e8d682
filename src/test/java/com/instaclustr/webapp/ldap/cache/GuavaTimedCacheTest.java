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

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.awaitility.Awaitility.await;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.expectThrows;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class GuavaTimedCacheTest
{

    private static final Duration TTL = Duration.ofMinutes(10);

    private ManualTicker ticker;

    private List<String> removed;

    private GuavaTimedCache<String, String> cache;

    @BeforeMethod
    public void setUp()
    {
        ticker = new ManualTicker();
        removed = new CopyOnWriteArrayList<>();
        cache = new GuavaTimedCache<>("test", 10, ticker, removed::add);
    }

    @Test
    public void testValueIsComputedOnceWithinTtl()
    {
        final AtomicInteger loads = new AtomicInteger();

        assertEquals(cache.getOrCompute("k", TTL, () -> "v" + loads.incrementAndGet()), "v1");

        ticker.advance(TTL.minusMillis(1));

        assertEquals(cache.getOrCompute("k", TTL, () -> "v" + loads.incrementAndGet()), "v1");
        assertEquals(loads.get(), 1);
    }

    @Test
    public void testStaleValueIsRecomputed()
    {
        final AtomicInteger loads = new AtomicInteger();

        cache.getOrCompute("k", TTL, () -> "v" + loads.incrementAndGet());

        ticker.advance(TTL);

        assertEquals(cache.getOrCompute("k", TTL, () -> "v" + loads.incrementAndGet()), "v2");
        assertEquals(removed, Collections.singletonList("v1"));
    }

    @Test
    public void testTtlIsPerEntry()
    {
        cache.getOrCompute("short", Duration.ofSeconds(1), () -> "a");
        cache.getOrCompute("long", TTL, () -> "b");

        ticker.advance(Duration.ofSeconds(2));

        assertEquals(cache.getOrCompute("short", TTL, () -> "c"), "c");
        assertEquals(cache.getOrCompute("long", TTL, () -> "d"), "b");
    }

    @Test
    public void testFailingLoaderLeavesNothingBehind()
    {
        final IllegalStateException ex = expectThrows(IllegalStateException.class, () -> cache.getOrCompute("k", TTL, () ->
        {
            throw new IllegalStateException("directory down");
        }));

        assertEquals(ex.getMessage(), "directory down");
        assertEquals(cache.size(), 0);
        assertEquals(cache.getOrCompute("k", TTL, () -> "v"), "v");
    }

    @Test
    public void testInvalidation()
    {
        cache.getOrCompute("alice", TTL, () -> "1");
        cache.getOrCompute("bob", TTL, () -> "2");
        cache.getOrCompute("bobby", TTL, () -> "3");

        cache.invalidate("alice");
        assertEquals(cache.size(), 2);

        cache.invalidateIf(key -> key.startsWith("bob"));
        assertEquals(cache.size(), 0);

        assertEquals(new ArrayList<>(removed), Arrays.asList("1", "2", "3"));

        cache.getOrCompute("carol", TTL, () -> "4");
        cache.invalidateAll();
        assertEquals(cache.size(), 0);
    }

    @Test
    public void testInvalidationOfReplacedValueKeepsCurrentOne()
    {
        final String first = cache.getOrCompute("k", TTL, () -> new String("v"));

        cache.invalidate("k");

        final String second = cache.getOrCompute("k", TTL, () -> new String("v"));

        // equal but not the same instance, the current entry stays
        cache.invalidate("k", first);
        assertEquals(cache.size(), 1);

        cache.invalidate("k", second);
        assertEquals(cache.size(), 0);
        assertEquals(removed.size(), 2);
    }

    @Test
    public void testConcurrentCallersShareOneComputation() throws Exception
    {
        final AtomicInteger loads = new AtomicInteger();
        final AtomicInteger waiting = new AtomicInteger();
        final CountDownLatch release = new CountDownLatch(1);
        final ExecutorService executor = Executors.newFixedThreadPool(4);

        try
        {
            final List<Future<String>> results = new ArrayList<>();

            for (int i = 0; i < 4; i++)
            {
                results.add(executor.submit(() ->
                                            {
                                                waiting.incrementAndGet();
                                                return cache.getOrCompute("k", TTL, () ->
                                                {
                                                    loads.incrementAndGet();

                                                    try
                                                    {
                                                        release.await();
                                                    } catch (final InterruptedException ex)
                                                    {
                                                        Thread.currentThread().interrupt();
                                                    }

                                                    return "v";
                                                });
                                            }));
            }

            await().atMost(5, SECONDS).until(() -> waiting.get() == 4 && loads.get() == 1);

            release.countDown();

            for (final Future<String> result : results)
            {
                assertEquals(result.get(5, SECONDS), "v");
            }

            assertEquals(loads.get(), 1);
        } finally
        {
            executor.shutdownNow();
        }
    }
}
