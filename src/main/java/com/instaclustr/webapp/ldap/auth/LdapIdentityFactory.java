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

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.instaclustr.webapp.ldap.LdapIdentity;
import com.instaclustr.webapp.ldap.UserRecord;
import com.instaclustr.webapp.ldap.cache.ConnectionCache;
import com.instaclustr.webapp.ldap.conf.LdapAuthenticatorConfiguration;
import com.instaclustr.webapp.ldap.exception.ConfigurationException;
import com.instaclustr.webapp.ldap.exception.LDAPAuthFailedException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds {@link LdapIdentity} instances. All lookups go through one service account connection.
 * <p>
 * A superuser or data profiler filter which is not configured, or configured empty, grants the capability to everyone.
 */
public class LdapIdentityFactory
{

    private static final Logger logger = LoggerFactory.getLogger(LdapIdentityFactory.class);

    private final LdapAuthenticatorConfiguration configuration;

    private final ConnectionCache connectionCache;

    private final GroupMembershipEvaluator evaluator;

    public LdapIdentityFactory(final LdapAuthenticatorConfiguration configuration,
                               final ConnectionCache connectionCache,
                               final GroupMembershipEvaluator evaluator)
    {
        this.configuration = configuration;
        this.connectionCache = connectionCache;
        this.evaluator = evaluator;
    }

    public LdapIdentity create(final UserRecord user) throws LDAPAuthFailedException
    {
        final String bindUser;
        final String bindPassword;

        try
        {
            bindUser = configuration.getBindUser();
            bindPassword = configuration.getBindPassword();
        } catch (final ConfigurationException ex)
        {
            throw LDAPAuthFailedException.configurationMissing(ex);
        }

        final boolean superuser;
        final boolean dataProfiler;
        final List<String> groups;

        try (ConnectionCache.Lease lease = connectionCache.getConnection(bindUser, bindPassword))
        {
            superuser = resolveCapability(lease.getBinding(), configuration.getSuperuserFilter(), "superuser", user);
            dataProfiler = resolveCapability(lease.getBinding(), configuration.getDataProfilerFilter(), "data profiler", user);
            groups = resolveGroups(lease.getBinding(), user);
        }

        final LdapIdentity identity = new LdapIdentity(user, superuser, dataProfiler, groups);

        logger.debug("Resolved {}", identity);

        return identity;
    }

    private boolean resolveCapability(final DirectoryBinding binding,
                                      final Optional<String> filter,
                                      final String capability,
                                      final UserRecord user)
    {
        if (!filter.isPresent() || StringUtils.isBlank(filter.get()))
        {
            logger.debug("Missing configuration for {} settings or empty. Skipping.", capability);
            return true;
        }

        try
        {
            return evaluator.groupContainsUser(binding,
                                               configuration.getBaseDn(),
                                               filter.get(),
                                               configuration.getUserNameAttribute(),
                                               user.getUsername());
        } catch (final ConfigurationException ex)
        {
            throw LDAPAuthFailedException.configurationMissing(ex);
        }
    }

    private List<String> resolveGroups(final DirectoryBinding binding, final UserRecord user)
    {
        final String baseDn;
        final String userFilter;
        final String userAttribute;

        try
        {
            baseDn = configuration.getBaseDn();
            userFilter = configuration.getUserFilter();
            userAttribute = configuration.getUserNameAttribute();
        } catch (final ConfigurationException ex)
        {
            logger.debug("Missing configuration for ldap settings ({}). Skipping group lookup.", ex.getKey());
            return Collections.emptyList();
        }

        return evaluator.groupsForUser(binding, baseDn, userFilter, userAttribute, user.getUsername());
    }
}
