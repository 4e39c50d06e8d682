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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.StringJoiner;

/**
 * An authenticated user with the capabilities resolved from the directory at construction time.
 */
public final class LdapIdentity
{

    private final UserRecord user;

    private final boolean superuser;

    private final boolean dataProfiler;

    private final List<String> ldapGroups;

    public LdapIdentity(final UserRecord user, final boolean superuser, final boolean dataProfiler, final List<String> ldapGroups)
    {
        if (user == null)
        {
            throw new IllegalArgumentException("User record of an identity can not be a null object.");
        }

        this.user = user;
        this.superuser = superuser;
        this.dataProfiler = dataProfiler;
        this.ldapGroups = Collections.unmodifiableList(new ArrayList<>(ldapGroups));
    }

    public boolean isActive()
    {
        return true;
    }

    public boolean isAuthenticated()
    {
        return true;
    }

    public boolean isAnonymous()
    {
        return false;
    }

    public String getId()
    {
        return user.getId();
    }

    public UserRecord getUser()
    {
        return user;
    }

    /**
     * Access to data profiling tools.
     */
    public boolean hasDataProfilingAccess()
    {
        return dataProfiler;
    }

    /**
     * Access to everything.
     */
    public boolean isSuperuser()
    {
        return superuser;
    }

    /**
     * @return common names of the directory groups of this user
     */
    public List<String> getLdapGroups()
    {
        return ldapGroups;
    }

    @Override
    public String toString()
    {
        return new StringJoiner(", ", LdapIdentity.class.getSimpleName() + "[", "]")
            .add("username='" + user.getUsername() + "'")
            .add("superuser=" + superuser)
            .add("dataProfiler=" + dataProfiler)
            .add("ldapGroups=" + ldapGroups)
            .toString();
    }
}
