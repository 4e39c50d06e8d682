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
package com.instaclustr.webapp.ldap;

import static java.lang.String.format;

import java.time.Duration;
import java.util.Collections;
import java.util.Iterator;
import java.util.Locale;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.instaclustr.webapp.ldap.auth.DirectoryClient;
import com.instaclustr.webapp.ldap.auth.GroupMembershipEvaluator;
import com.instaclustr.webapp.ldap.auth.JndiDirectoryClient;
import com.instaclustr.webapp.ldap.auth.LdapAuthenticator;
import com.instaclustr.webapp.ldap.auth.LdapIdentityFactory;
import com.instaclustr.webapp.ldap.cache.ConnectionCache;
import com.instaclustr.webapp.ldap.cache.GuavaTimedCache;
import com.instaclustr.webapp.ldap.conf.LdapAuthenticatorConfiguration;
import com.instaclustr.webapp.ldap.exception.AuthError;
import com.instaclustr.webapp.ldap.exception.ConfigurationException;
import com.instaclustr.webapp.ldap.exception.LDAPAuthFailedException;
import com.instaclustr.webapp.ldap.metrics.MetricsSink;
import com.instaclustr.webapp.ldap.metrics.NoOpMetricsSink;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the web layer: password login against LDAP and identity resolution.
 * <p>
 * Construct one instance at start-up and share it, it holds the connection and membership caches. Nothing here
 * touches sessions or cookies.
 */
public class LdapAuthService
{

    private static final Logger logger = LoggerFactory.getLogger(LdapAuthService.class);

    public static final String LOGIN_METRIC = "ldap.login";
    public static final String LOGIN_DURATION_METRIC = "ldap.login.duration";
    public static final String OUTCOME_TAG = "outcome";
    public static final String SUCCESS_OUTCOME = "success";
    public static final String ERROR_OUTCOME = "error";

    private final ConnectionCache connectionCache;

    private final GroupMembershipEvaluator evaluator;

    private final LdapAuthenticator authenticator;

    private final LdapIdentityFactory identityFactory;

    private final UserStore userStore;

    private final MetricsSink metrics;

    public LdapAuthService(final LdapAuthenticatorConfiguration configuration,
                           final DirectoryClient directoryClient,
                           final UserStore userStore,
                           final MetricsSink metrics)
    {
        this(configuration, directoryClient, userStore, metrics, Ticker.systemTicker());
    }

    /**
     * @throws ConfigurationException when a required key is missing
     */
    public LdapAuthService(final LdapAuthenticatorConfiguration configuration,
                           final DirectoryClient directoryClient,
                           final UserStore userStore,
                           final MetricsSink metrics,
                           final Ticker ticker) throws ConfigurationException
    {
        configuration.validate();

        final Duration ttl = configuration.getCacheTtl();
        final long maxEntries = configuration.getCacheMaxEntries();

        this.connectionCache = new ConnectionCache(directoryClient, maxEntries, ticker, ttl);
        this.evaluator = new GroupMembershipEvaluator(directoryClient,
                                                      new GuavaTimedCache<>("GroupContainsUserCache", maxEntries, ticker),
                                                      new GuavaTimedCache<>("GroupsForUserCache", maxEntries, ticker),
                                                      configuration.getGroupMemberAttribute(),
                                                      ttl);
        this.authenticator = new LdapAuthenticator(configuration, directoryClient, connectionCache);
        this.identityFactory = new LdapIdentityFactory(configuration, connectionCache, evaluator);
        this.userStore = userStore;
        this.metrics = metrics;

        logger.info("{} was initialised with {}", LdapAuthService.class.getName(), configuration);
    }

    public static LdapAuthService create(final LdapAuthenticatorConfiguration configuration,
                                         final UserStore userStore) throws ConfigurationException
    {
        return create(configuration, userStore, new NoOpMetricsSink());
    }

    /**
     * Creates the service with the JNDI directory client, or with the one registered through
     * {@link ServiceLoader} when {@value LdapAuthenticatorConfiguration#LOAD_DIRECTORY_CLIENT_SERVICE_PROP} is true.
     */
    public static LdapAuthService create(final LdapAuthenticatorConfiguration configuration,
                                         final UserStore userStore,
                                         final MetricsSink metrics) throws ConfigurationException
    {
        configuration.validate();

        return new LdapAuthService(configuration, loadDirectoryClient(configuration).setup(configuration), userStore, metrics);
    }

    static DirectoryClient loadDirectoryClient(final LdapAuthenticatorConfiguration configuration) throws ConfigurationException
    {
        if (!configuration.isLoadDirectoryClientService())
        {
            return new JndiDirectoryClient();
        }

        final Iterator<DirectoryClient> registered = ServiceLoader.load(DirectoryClient.class).iterator();

        if (!registered.hasNext())
        {
            logger.warn("{} is set but no {} is registered, using {}",
                        LdapAuthenticatorConfiguration.LOAD_DIRECTORY_CLIENT_SERVICE_PROP,
                        DirectoryClient.class.getName(),
                        JndiDirectoryClient.class.getName());

            return new JndiDirectoryClient();
        }

        final DirectoryClient directoryClient = registered.next();

        if (registered.hasNext())
        {
            throw new ConfigurationException(LdapAuthenticatorConfiguration.LOAD_DIRECTORY_CLIENT_SERVICE_PROP,
                                             format("More than one %s is registered: %s, %s",
                                                    DirectoryClient.class.getName(),
                                                    directoryClient.getClass().getName(),
                                                    registered.next().getClass().getName()),
                                             null);
        }

        logger.info("Using directory client {}", directoryClient.getClass().getName());

        return directoryClient;
    }

    /**
     * Checks the username and password against the directory. Performs no session side effects.
     *
     * @throws LDAPAuthFailedException when the login is refused; only {@link LDAPAuthFailedException#getUserMessage()}
     *                                 may be shown to the user
     */
    public void tryLogin(final String username, final String password) throws LDAPAuthFailedException
    {
        final Stopwatch stopwatch = Stopwatch.createStarted();
        String outcome = ERROR_OUTCOME;

        try
        {
            authenticator.tryLogin(username, password);
            outcome = SUCCESS_OUTCOME;

            logger.info("User {} successfully authenticated", username);
        } catch (final LDAPAuthFailedException ex)
        {
            outcome = ex.getError().name().toLowerCase(Locale.ROOT);

            if (ex.getError() == AuthError.INVALID_CREDENTIALS)
            {
                logger.info("Failed login for {}", username);
            } else
            {
                logger.warn("Failed login for {}, reason was {}: {}", username, ex.getError(), ex.getMessage());
            }

            throw ex;
        } finally
        {
            metrics.increment(LOGIN_METRIC, Collections.singletonMap(OUTCOME_TAG, outcome));
            metrics.timing(LOGIN_DURATION_METRIC, stopwatch.elapsed(TimeUnit.MILLISECONDS), Collections.singletonMap(OUTCOME_TAG, outcome));
        }
    }

    /**
     * Verifies the credentials, creates the user record on first login and returns the user's identity.
     */
    public LdapIdentity login(final String username, final String password) throws LDAPAuthFailedException
    {
        tryLogin(username, password);

        final UserRecord user = userStore.findByUsername(username).orElseGet(() ->
                                                                             {
                                                                                 logger.info("Creating user record for {}", username);
                                                                                 return userStore.createUser(username);
                                                                             });

        userStore.persist(user);

        return identity(user);
    }

    /**
     * Rebuilds the identity of a user whose id was stored in a session.
     *
     * @return empty when the id is missing, "None" or unknown
     */
    public Optional<LdapIdentity> loadUser(final String id) throws LDAPAuthFailedException
    {
        logger.debug("Loading user {}", id);

        if (StringUtils.isBlank(id) || "None".equals(id))
        {
            return Optional.empty();
        }

        return userStore.findById(id).map(this::identity);
    }

    public LdapIdentity identity(final UserRecord user) throws LDAPAuthFailedException
    {
        return identityFactory.create(user);
    }

    /**
     * Forgets cached group membership of a user.
     */
    public void invalidate(final String username)
    {
        evaluator.invalidate(username);
    }

    /**
     * Forgets every cached connection bound as the given DN, e.g. after its password was rotated. Each is unbound once
     * no login still uses it.
     */
    public void invalidateConnections(final String dn)
    {
        connectionCache.invalidate(dn);
    }

    public void invalidateAll()
    {
        evaluator.invalidateAll();
        connectionCache.invalidateAll();
    }
}
