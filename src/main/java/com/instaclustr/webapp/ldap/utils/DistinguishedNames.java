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

import javax.naming.InvalidNameException;
import javax.naming.NamingException;
import javax.naming.directory.Attribute;
import javax.naming.ldap.LdapName;
import javax.naming.ldap.Rdn;
import java.util.List;
import java.util.Optional;

public final class DistinguishedNames
{

    private DistinguishedNames()
    {
    }

    /**
     * Returns the value of the left-most {@code cn} component of a distinguished name, with escapes resolved.
     * <p>
     * {@code "cn=Smith\, John,ou=Groups,dc=example,dc=com"} gives {@code "Smith, John"}. Empty when the string is not
     * a distinguished name or has no {@code cn} component.
     */
    public static Optional<String> commonName(final String dn)
    {
        if (dn == null)
        {
            return Optional.empty();
        }

        final List<Rdn> rdns;

        try
        {
            rdns = new LdapName(dn).getRdns();
        } catch (final InvalidNameException | IllegalArgumentException ex)
        {
            return Optional.empty();
        }

        // LdapName lists components right to left
        for (int i = rdns.size() - 1; i >= 0; i--)
        {
            final Attribute cn = rdns.get(i).toAttributes().get("cn");

            if (cn == null)
            {
                continue;
            }

            try
            {
                final Object value = cn.get();

                if (value instanceof String && !((String) value).isEmpty())
                {
                    return Optional.of((String) value);
                }
            } catch (final NamingException ex)
            {
                return Optional.empty();
            }
        }

        return Optional.empty();
    }
}
