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

/**
 * Outcome of a search which reached the server.
 * <p>
 * {@link #isSuccess()} is the server's verdict on the operation itself (bad base DN, invalid filter and the like
 * make it false) and is independent of how many entries matched: a successful search may return no entries.
 */
public final class SearchResponse
{

    private final boolean success;

    private final List<DirectoryEntry> entries;

    private final String diagnosticMessage;

    private SearchResponse(final boolean success, final List<DirectoryEntry> entries, final String diagnosticMessage)
    {
        this.success = success;
        this.entries = entries;
        this.diagnosticMessage = diagnosticMessage;
    }

    public static SearchResponse succeeded(final List<DirectoryEntry> entries)
    {
        return new SearchResponse(true, Collections.unmodifiableList(new ArrayList<>(entries)), null);
    }

    public static SearchResponse failed(final String diagnosticMessage)
    {
        return new SearchResponse(false, Collections.emptyList(), diagnosticMessage);
    }

    public boolean isSuccess()
    {
        return success;
    }

    public List<DirectoryEntry> getEntries()
    {
        return entries;
    }

    public boolean isEmpty()
    {
        return entries.isEmpty();
    }

    public String getDiagnosticMessage()
    {
        return diagnosticMessage;
    }

    @Override
    public String toString()
    {
        return success ? "SearchResponse[success, entries=" + entries.size() + "]" : "SearchResponse[failed: " + diagnosticMessage + "]";
    }
}
