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
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Memoizing cache whose entries go stale a fixed time after they were computed.
 * <p>
 * Concurrent callers asking for the same missing key share one computation. A loader which throws leaves nothing
 * behind, the next call computes again. Loaders must not return null.
 */
public interface TimedCache<K, V>
{

    V getOrCompute(K key, Duration ttl, Supplier<? extends V> loader);

    void invalidate(K key);

    /**
     * Removes the entry of {@code key} only while it still holds this very {@code value}.
     */
    void invalidate(K key, V value);

    void invalidateIf(Predicate<? super K> predicate);

    void invalidateAll();

    long size();
}
