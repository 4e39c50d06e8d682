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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * One search result: its distinguished name and the returned attribute values.
 * Attribute names are matched case-insensitively.
 */
public final class DirectoryEntry
{

    private final String dn;

    private final Map<String, List<String>> attributes;

    public DirectoryEntry(final String dn, final Map<String, List<String>> attributes)
    {
        this.dn = dn;

        final Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

        for (final Map.Entry<String, List<String>> attribute : attributes.entrySet())
        {
            copy.put(attribute.getKey(), Collections.unmodifiableList(new ArrayList<>(attribute.getValue())));
        }

        this.attributes = Collections.unmodifiableMap(copy);
    }

    /**
     * @return distinguished name, null when the server did not send one
     */
    public String getDn()
    {
        return dn;
    }

    public Map<String, List<String>> getAttributes()
    {
        return attributes;
    }

    public boolean hasAttribute(final String name)
    {
        return attributes.containsKey(name);
    }

    public List<String> getValues(final String name)
    {
        return attributes.getOrDefault(name, Collections.emptyList());
    }

    @Override
    public String toString()
    {
        return new StringJoiner(", ", DirectoryEntry.class.getSimpleName() + "[", "]")
            .add("dn='" + dn + "'")
            .add("attributes=" + attributes.keySet())
            .toString();
    }
}
