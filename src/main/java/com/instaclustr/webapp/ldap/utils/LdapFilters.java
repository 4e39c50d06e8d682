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
package com.instaclustr.webapp.ldap.utils;

import static java.lang.String.format;

public final class LdapFilters
{

    private LdapFilters()
    {
    }

    /**
     * Escapes an assertion value as described in RFC 4515, so user input can not change the filter structure.
     */
    public static String escape(final String value)
    {
        final StringBuilder escaped = new StringBuilder(value.length());

        for (final char c : value.toCharArray())
        {
            switch (c)
            {
                case '\\':
                    escaped.append("\\5c");
                    break;
                case '*':
                    escaped.append("\\2a");
                    break;
                case '(':
                    escaped.append("\\28");
                    break;
                case ')':
                    escaped.append("\\29");
                    break;
                case '\0':
                    escaped.append("\\00");
                    break;
                default:
                    escaped.append(c);
            }
        }

        return escaped.toString();
    }

    /**
     * Puts parentheses around a configured filter unless it already has them, so that both
     * {@code objectClass=person} and {@code (objectClass=person)} are accepted.
     */
    public static String wrap(final String filter)
    {
        final String trimmed = filter.trim();

        if (trimmed.startsWith("(") && trimmed.endsWith(")"))
        {
            return trimmed;
        }

        return "(" + trimmed + ")";
    }

    /**
     * {@code (&(<groupFilter>))}
     */
    public static String groupFilter(final String groupFilter)
    {
        return format("(&%s)", wrap(groupFilter));
    }

    /**
     * {@code (&(<userFilter>)(<attribute>=<escaped username>))}
     */
    public static String userFilter(final String userFilter, final String attribute, final String username)
    {
        return format("(&%s(%s=%s))", wrap(userFilter), attribute, escape(username));
    }
}
