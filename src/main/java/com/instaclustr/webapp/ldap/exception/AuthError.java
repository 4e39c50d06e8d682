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
package com.instaclustr.webapp.ldap.exception;

/**
 * Reasons a login attempt can fail.
 * <p>
 * Only {@link #getUserMessage()} may be shown to the person logging in, everything else belongs to operators.
 */
public enum AuthError
{
    /**
     * Bad username or password, unknown user or an unusable search match. These are deliberately not told apart.
     */
    INVALID_CREDENTIALS("Invalid username or password"),

    /**
     * Network, TLS or service account bind failure.
     */
    DIRECTORY_UNREACHABLE("Unable to log in at this time"),

    /**
     * Directory data could not be parsed, usually a search scope problem.
     */
    MALFORMED_DIRECTORY_RESPONSE("Unable to log in at this time"),

    /**
     * A required configuration key is absent.
     */
    CONFIGURATION_MISSING("Unable to log in at this time");

    private final String userMessage;

    AuthError(final String userMessage)
    {
        this.userMessage = userMessage;
    }

    public String getUserMessage()
    {
        return userMessage;
    }
}
