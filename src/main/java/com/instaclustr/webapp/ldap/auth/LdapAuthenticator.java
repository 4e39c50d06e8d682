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
package com.instaclustr.webapp.ldap.auth;

import javax.naming.InvalidNameException;
import javax.naming.ldap.LdapName;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;
import com.instaclustr.webapp.ldap.cache.ConnectionCache;
import com.instaclustr.webapp.ldap.conf.LdapAuthenticatorConfiguration;
import com.instaclustr.webapp.ldap.exception.AuthError;
import com.instaclustr.webapp.ldap.exception.ConfigurationException;
import com.instaclustr.webapp.ldap.exception.DirectoryException;
import com.instaclustr.webapp.ldap.exception.LDAPAuthFailedException;
import com.instaclustr.webapp.ldap.exception.MalformedDirectoryResponseException;
import com.instaclustr.webapp.ldap.utils.LdapFilters;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies a username and password against the directory.
 * <p>
 * The service account looks up the user's DN, its connection is then handed back to the cache, and the user's DN is
 * bound with the supplied password. Every way the user can be missing or the password be wrong ends in
 * {@link AuthError#INVALID_CREDENTIALS} so callers can not tell which usernames exist.
 */
public class LdapAuthenticator
{

    private static final Logger logger = LoggerFactory.getLogger(LdapAuthenticator.class);

    private final LdapAuthenticatorConfiguration configuration;

    private final DirectoryClient directoryClient;

    private final ConnectionCache connectionCache;

    public LdapAuthenticator(final LdapAuthenticatorConfiguration configuration,
                             final DirectoryClient directoryClient,
                             final ConnectionCache connectionCache)
    {
        this.configuration = configuration;
        this.directoryClient = directoryClient;
        this.connectionCache = connectionCache;
    }

    /**
     * Authenticate a user/password combination against the configured LDAP server.
     *
     * @param username value of the configured user name attribute, e.g. "bob" for uid=bob,ou=people,dc=example,dc=com
     * @param password corresponding password
     * @throws LDAPAuthFailedException when authentication fails, see {@link AuthError} for the reasons
     */
    public void tryLogin(final String username, final String password) throws LDAPAuthFailedException
    {
        // an empty password would make the bind anonymous and succeed
        if (StringUtils.isEmpty(username) || StringUtils.isEmpty(password))
        {
            logger.info("Refusing login with empty username or password");
            throw LDAPAuthFailedException.invalidCredentials();
        }

        final String bindUser;
        final String bindPassword;
        final String baseDn;
        final String userFilter;
        final String userAttribute;

        try
        {
            bindUser = configuration.getBindUser();
            bindPassword = configuration.getBindPassword();
            baseDn = configuration.getBaseDn();
            userFilter = configuration.getUserFilter();
            userAttribute = configuration.getUserNameAttribute();
        } catch (final ConfigurationException ex)
        {
            throw LDAPAuthFailedException.configurationMissing(ex);
        }

        final Stopwatch stopwatch = Stopwatch.createStarted();

        final String userDn;

        // the service connection is handed back before the user's bind
        try (ConnectionCache.Lease serviceLease = connectionCache.getConnection(bindUser, bindPassword))
        {
            userDn = searchUserDn(serviceLease.getBinding(), baseDn, LdapFilters.userFilter(userFilter, userAttribute, username), username);
        }

        logger.debug("Resolved LDAP DN of {}: {}", username, userDn);

        bindAsUser(username, userDn, password);

        logger.debug("Login of {} verified in {} ms", username, stopwatch.elapsed(TimeUnit.MILLISECONDS));
    }

    private String searchUserDn(final DirectoryBinding serviceBinding,
                                final String baseDn,
                                final String filter,
                                final String username)
    {
        final SearchResponse response;

        try
        {
            response = directoryClient.search(serviceBinding, baseDn, filter, configuration.getSearchScope(), Collections.emptyList());
        } catch (final DirectoryException ex)
        {
            throw new LDAPAuthFailedException(AuthError.DIRECTORY_UNREACHABLE, ex.getMessage(), ex);
        } catch (final MalformedDirectoryResponseException ex)
        {
            throw malformedStructure(ex);
        }

        if (!response.isSuccess() || response.isEmpty())
        {
            logger.info("Cannot find user {}", username);
            throw LDAPAuthFailedException.invalidCredentials();
        }

        final String dn = response.getEntries().get(0).getDn();

        if (StringUtils.isBlank(dn))
        {
            // the search filter for the user did not return a usable entry, so an invalid user was used for credentials
            logger.info("Entry found for user {} has no distinguished name", username);
            throw LDAPAuthFailedException.invalidCredentials();
        }

        return dn;
    }

    private void bindAsUser(final String username, final String userDn, final String password)
    {
        try
        {
            new LdapName(userDn);
        } catch (final InvalidNameException ex)
        {
            throw malformedStructure(ex);
        }

        final ConnectionCache.Lease userLease;

        try
        {
            userLease = connectionCache.getConnection(userDn, password);
        } catch (final LDAPAuthFailedException ex)
        {
            if (ex.getError() != AuthError.DIRECTORY_UNREACHABLE)
            {
                throw ex;
            }

            logger.info("Password incorrect for user {}", username);
            throw LDAPAuthFailedException.invalidCredentials(ex);
        }

        // only the successful bind matters, the user's own connection is never used
        connectionCache.discard(userDn, password, userLease);
    }

    private LDAPAuthFailedException malformedStructure(final Exception cause)
    {
        logger.error("Unable to parse LDAP structure. If you're using Active Directory and not specifying an OU, "
                         + "you must set {}=SUBTREE in the LDAP configuration.",
                     LdapAuthenticatorConfiguration.SEARCH_SCOPE_PROP,
                     cause);

        return new LDAPAuthFailedException(AuthError.MALFORMED_DIRECTORY_RESPONSE,
                                           "Could not parse LDAP structure. Try setting "
                                               + LdapAuthenticatorConfiguration.SEARCH_SCOPE_PROP
                                               + " in the LDAP configuration, or check logs",
                                           cause);
    }
}
