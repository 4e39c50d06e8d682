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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.instaclustr.webapp.ldap.cache.TimedCache;
import com.instaclustr.webapp.ldap.exception.AuthError;
import com.instaclustr.webapp.ldap.exception.DirectoryException;
import com.instaclustr.webapp.ldap.exception.LDAPAuthFailedException;
import com.instaclustr.webapp.ldap.exception.MalformedDirectoryResponseException;
import com.instaclustr.webapp.ldap.utils.DistinguishedNames;
import com.instaclustr.webapp.ldap.utils.LdapFilters;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers group membership questions about a user. Both lookups are cached per bound DN and query.
 * Membership searches always cover the whole subtree below the base DN.
 */
public class GroupMembershipEvaluator
{

    private static final Logger logger = LoggerFactory.getLogger(GroupMembershipEvaluator.class);

    private final DirectoryClient directoryClient;

    private final TimedCache<MembershipKey, Boolean> groupContainsUserCache;

    private final TimedCache<MembershipKey, List<String>> groupsForUserCache;

    private final String memberOfAttribute;

    private final Duration ttl;

    public GroupMembershipEvaluator(final DirectoryClient directoryClient,
                                    final TimedCache<MembershipKey, Boolean> groupContainsUserCache,
                                    final TimedCache<MembershipKey, List<String>> groupsForUserCache,
                                    final String memberOfAttribute,
                                    final Duration ttl)
    {
        this.directoryClient = directoryClient;
        this.groupContainsUserCache = groupContainsUserCache;
        this.groupsForUserCache = groupsForUserCache;
        this.memberOfAttribute = memberOfAttribute;
        this.ttl = ttl;
    }

    /**
     * @return true when an entry matching {@code groupFilter} lists {@code username}, ignoring case, in {@code userAttribute}
     */
    public boolean groupContainsUser(final DirectoryBinding binding,
                                     final String baseDn,
                                     final String groupFilter,
                                     final String userAttribute,
                                     final String username) throws LDAPAuthFailedException
    {
        final GroupFilterQuery query = new GroupFilterQuery(baseDn, LdapFilters.groupFilter(groupFilter), userAttribute, username);

        return groupContainsUserCache.getOrCompute(new MembershipKey(binding.getBoundDn(), query),
                                                   ttl,
                                                   () -> searchGroupContainsUser(binding, query));
    }

    /**
     * @return common names of the groups listed in the user's member-of attribute, in directory order
     * @throws LDAPAuthFailedException with {@link AuthError#INVALID_CREDENTIALS} when the user can not be found
     */
    public List<String> groupsForUser(final DirectoryBinding binding,
                                      final String baseDn,
                                      final String userFilter,
                                      final String userAttribute,
                                      final String username) throws LDAPAuthFailedException
    {
        final GroupFilterQuery query = new GroupFilterQuery(baseDn,
                                                            LdapFilters.userFilter(userFilter, userAttribute, username),
                                                            memberOfAttribute,
                                                            username);

        return groupsForUserCache.getOrCompute(new MembershipKey(binding.getBoundDn(), query),
                                               ttl,
                                               () -> searchGroupsForUser(binding, query));
    }

    /**
     * Forgets every cached answer about the given user.
     */
    public void invalidate(final String username)
    {
        groupContainsUserCache.invalidateIf(key -> key.getQuery().getUsername().equalsIgnoreCase(username));
        groupsForUserCache.invalidateIf(key -> key.getQuery().getUsername().equalsIgnoreCase(username));
    }

    public void invalidateAll()
    {
        groupContainsUserCache.invalidateAll();
        groupsForUserCache.invalidateAll();
    }

    private Boolean searchGroupContainsUser(final DirectoryBinding binding, final GroupFilterQuery query)
    {
        final SearchResponse response = search(binding, query);

        if (!response.isSuccess() || response.isEmpty())
        {
            logger.warn("Unable to find group for {} {}", query.getBaseDn(), query.getFilter());
            return false;
        }

        boolean attributeSeen = false;

        for (final DirectoryEntry entry : response.getEntries())
        {
            if (!entry.hasAttribute(query.getAttribute()))
            {
                continue;
            }

            attributeSeen = true;

            for (final String value : entry.getValues(query.getAttribute()))
            {
                if (value.equalsIgnoreCase(query.getUsername()))
                {
                    return true;
                }
            }
        }

        if (!attributeSeen)
        {
            logger.warn("No group found for {} {} has attribute {}", query.getBaseDn(), query.getFilter(), query.getAttribute());
        }

        return false;
    }

    private List<String> searchGroupsForUser(final DirectoryBinding binding, final GroupFilterQuery query)
    {
        final SearchResponse response = search(binding, query);

        if (!response.isSuccess() || response.isEmpty())
        {
            logger.info("Cannot find user {}", query.getUsername());
            throw LDAPAuthFailedException.invalidCredentials();
        }

        final DirectoryEntry entry = response.getEntries().get(0);

        if (!entry.hasAttribute(query.getAttribute()))
        {
            logger.warn("Missing attribute \"{}\" when looked-up in LDAP database. "
                            + "The user {} does not seem to be a member of a group and will not see anything restricted by group membership.",
                        query.getAttribute(),
                        query.getUsername());

            return Collections.emptyList();
        }

        final List<String> groups = new ArrayList<>();

        for (final String value : entry.getValues(query.getAttribute()))
        {
            final Optional<String> commonName = DistinguishedNames.commonName(value);

            if (commonName.isPresent())
            {
                groups.add(commonName.get());
            } else
            {
                logger.warn("Skipping group '{}' of user {}, no common name could be parsed from it", value, query.getUsername());
            }
        }

        return Collections.unmodifiableList(groups);
    }

    private SearchResponse search(final DirectoryBinding binding, final GroupFilterQuery query)
    {
        try
        {
            return directoryClient.search(binding,
                                          query.getBaseDn(),
                                          query.getFilter(),
                                          SearchScope.SUBTREE,
                                          Collections.singletonList(query.getAttribute()));
        } catch (final DirectoryException ex)
        {
            throw new LDAPAuthFailedException(AuthError.DIRECTORY_UNREACHABLE, ex.getMessage(), ex);
        } catch (final MalformedDirectoryResponseException ex)
        {
            logger.error("Unable to parse LDAP response for {}", query, ex);
            throw new LDAPAuthFailedException(AuthError.MALFORMED_DIRECTORY_RESPONSE, ex.getMessage(), ex);
        }
    }

    public static final class MembershipKey
    {

        private final String boundDn;

        private final GroupFilterQuery query;

        MembershipKey(final String boundDn, final GroupFilterQuery query)
        {
            this.boundDn = boundDn;
            this.query = query;
        }

        public String getBoundDn()
        {
            return boundDn;
        }

        public GroupFilterQuery getQuery()
        {
            return query;
        }

        @Override
        public boolean equals(final Object obj)
        {
            if (this == obj)
            {
                return true;
            }

            if (!(obj instanceof MembershipKey))
            {
                return false;
            }

            final MembershipKey other = (MembershipKey) obj;

            return new EqualsBuilder().append(boundDn, other.boundDn).append(query, other.query).isEquals();
        }

        @Override
        public int hashCode()
        {
            return new HashCodeBuilder(19, 29).append(boundDn).append(query).toHashCode();
        }

        @Override
        public String toString()
        {
            return "MembershipKey[boundDn='" + boundDn + "', query=" + query + "]";
        }
    }
}
