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
import java.util.concurrent.atomic.AtomicBoolean;

import com.google.common.base.Ticker;
import com.instaclustr.webapp.ldap.auth.DirectoryBinding;
import com.instaclustr.webapp.ldap.auth.DirectoryClient;
import com.instaclustr.webapp.ldap.exception.AuthError;
import com.instaclustr.webapp.ldap.exception.DirectoryException;
import com.instaclustr.webapp.ldap.exception.LDAPAuthFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps bound directory connections per (DN, credential) for a fixed time so repeated operations do not rebind.
 * <p>
 * Connections are handed out as {@link Lease}s. A connection which leaves the cache, because it went stale, was evicted
 * or was invalidated, is unbound once its last lease is closed, so a caller never sees its connection unbound under it.
 * <p>
 * Only successful binds are cached. Holding bound connections keyed by credentials is a trade-off of the deployment,
 * {@link #invalidate(String)} drops them when credentials rotate.
 */
public class ConnectionCache
{

    private static final Logger logger = LoggerFactory.getLogger(ConnectionCache.class);

    private static final int MAX_LEASE_ATTEMPTS = 3;

    private final DirectoryClient directoryClient;

    private final TimedCache<BindingKey, SharedBinding> bindings;

    private final Duration ttl;

    public ConnectionCache(final DirectoryClient directoryClient,
                           final long maximumSize,
                           final Ticker ticker,
                           final Duration ttl)
    {
        this.directoryClient = directoryClient;
        this.bindings = new GuavaTimedCache<BindingKey, SharedBinding>("LdapConnectionCache", maximumSize, ticker, SharedBinding::retire);
        this.ttl = ttl;
    }

    /**
     * Leases the connection bound as {@code dn}, binding first when there is none. Close the lease when done.
     *
     * @throws LDAPAuthFailedException with {@link AuthError#DIRECTORY_UNREACHABLE} when the bind does not succeed,
     *                                 which includes rejected credentials
     */
    public Lease getConnection(final String dn, final String credential) throws LDAPAuthFailedException
    {
        final BindingKey key = BindingKey.of(dn, credential);

        for (int attempt = 0; attempt < MAX_LEASE_ATTEMPTS; attempt++)
        {
            final SharedBinding shared = bindings.getOrCompute(key, ttl, () -> new SharedBinding(bind(dn, credential)));

            if (!shared.binding.isBound())
            {
                logger.debug("Cached connection for {} is no longer bound, binding again", dn);
                bindings.invalidate(key, shared);
                continue;
            }

            if (shared.acquire())
            {
                return new Lease(shared);
            }

            // left the cache between the lookup and the lease
            logger.trace("Cached connection for {} was retired, looking up again", dn);
        }

        throw new LDAPAuthFailedException(AuthError.DIRECTORY_UNREACHABLE, "Cannot keep a bound connection to ldap server as " + dn);
    }

    /**
     * Closes the lease and forgets its connection so it is never handed out again. The connection is unbound as soon
     * as no other lease holds it.
     */
    public void discard(final String dn, final String credential, final Lease lease)
    {
        bindings.invalidate(BindingKey.of(dn, credential), lease.shared);
        lease.close();
    }

    /**
     * Drops every connection bound as the given DN.
     */
    public void invalidate(final String dn)
    {
        bindings.invalidateIf(key -> key.getDn().equalsIgnoreCase(dn));
    }

    public void invalidateAll()
    {
        bindings.invalidateAll();
    }

    public long size()
    {
        return bindings.size();
    }

    private DirectoryBinding bind(final String dn, final String credential)
    {
        try
        {
            return directoryClient.bind(dn, credential);
        } catch (final DirectoryException ex)
        {
            logger.error("Cannot bind to ldap server as {}: {}", dn, ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());

            throw new LDAPAuthFailedException(AuthError.DIRECTORY_UNREACHABLE, "Cannot bind to ldap server", ex);
        }
    }

    /**
     * A caller's hold on a cached connection. Closing it more than once has no further effect.
     */
    public static final class Lease implements AutoCloseable
    {

        private final SharedBinding shared;

        private final AtomicBoolean closed = new AtomicBoolean();

        private Lease(final SharedBinding shared)
        {
            this.shared = shared;
        }

        public DirectoryBinding getBinding()
        {
            return shared.binding;
        }

        @Override
        public void close()
        {
            if (closed.compareAndSet(false, true))
            {
                shared.release();
            }
        }
    }

    private final class SharedBinding
    {

        private final DirectoryBinding binding;

        private int leases;

        private boolean retired;

        private SharedBinding(final DirectoryBinding binding)
        {
            this.binding = binding;
        }

        private synchronized boolean acquire()
        {
            if (retired)
            {
                return false;
            }

            leases++;
            return true;
        }

        private void release()
        {
            final boolean unbind;

            synchronized (this)
            {
                leases--;
                unbind = retired && leases == 0;
            }

            if (unbind)
            {
                directoryClient.unbind(binding);
            }
        }

        private void retire()
        {
            final boolean unbind;

            synchronized (this)
            {
                if (retired)
                {
                    return;
                }

                retired = true;
                unbind = leases == 0;
            }

            if (unbind)
            {
                directoryClient.unbind(binding);
            } else
            {
                logger.debug("Connection for {} left the cache while leased, unbinding after its last lease", binding.getBoundDn());
            }
        }
    }
}
