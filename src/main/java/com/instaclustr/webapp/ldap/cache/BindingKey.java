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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.hash.Hashing;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * Connection cache key. Only a SHA-256 fingerprint of the credential is kept.
 */
public final class BindingKey
{

    private final String dn;

    private final String credentialFingerprint;

    private BindingKey(final String dn, final String credentialFingerprint)
    {
        this.dn = dn;
        this.credentialFingerprint = credentialFingerprint;
    }

    public static BindingKey of(final String dn, final String credential)
    {
        if (dn == null)
        {
            throw new IllegalArgumentException("DN of a binding can not be null.");
        }

        return new BindingKey(dn, Hashing.sha256().hashString(credential == null ? "" : credential, UTF_8).toString());
    }

    public String getDn()
    {
        return dn;
    }

    @Override
    public boolean equals(final Object obj)
    {
        if (this == obj)
        {
            return true;
        }

        if (!(obj instanceof BindingKey))
        {
            return false;
        }

        final BindingKey other = (BindingKey) obj;

        return new EqualsBuilder().append(dn, other.dn).append(credentialFingerprint, other.credentialFingerprint).isEquals();
    }

    @Override
    public int hashCode()
    {
        return new HashCodeBuilder(19, 29).append(dn).append(credentialFingerprint).toHashCode();
    }

    @Override
    public String toString()
    {
        return "BindingKey[dn='" + dn + "', credentials=redacted]";
    }
}
