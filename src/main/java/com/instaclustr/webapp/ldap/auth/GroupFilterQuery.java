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

import java.util.StringJoiner;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Parameters of a membership lookup, used together with the bound DN as cache key.
 */
public final class GroupFilterQuery
{

    private final String baseDn;

    private final String filter;

    private final String attribute;

    private final String username;

    public GroupFilterQuery(final String baseDn, final String filter, final String attribute, final String username)
    {
        this.baseDn = baseDn;
        this.filter = filter;
        this.attribute = attribute;
        this.username = username;
    }

    public String getBaseDn()
    {
        return baseDn;
    }

    public String getFilter()
    {
        return filter;
    }

    public String getAttribute()
    {
        return attribute;
    }

    public String getUsername()
    {
        return username;
    }

    @Override
    public boolean equals(final Object obj)
    {
        if (this == obj)
        {
            return true;
        }

        if (!(obj instanceof GroupFilterQuery))
        {
            return false;
        }

        final GroupFilterQuery other = (GroupFilterQuery) obj;

        return new EqualsBuilder()
            .append(baseDn, other.baseDn)
            .append(filter, other.filter)
            .append(attribute, other.attribute)
            .append(username, other.username)
            .isEquals();
    }

    @Override
    public int hashCode()
    {
        return new HashCodeBuilder(19, 29).append(baseDn).append(filter).append(attribute).append(username).toHashCode();
    }

    @Override
    public String toString()
    {
        return new StringJoiner(", ", GroupFilterQuery.class.getSimpleName() + "[", "]")
            .add("baseDn='" + baseDn + "'")
            .add("filter='" + filter + "'")
            .add("attribute='" + attribute + "'")
            .add("username='" + username + "'")
            .toString();
    }
}
