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

import java.util.Optional;

/**
 * Thrown when a login attempt or an identity lookup fails.
 * <p>
 * {@link #getMessage()} carries operator detail and must not be sent to the end user,
 * use {@link #getUserMessage()} for that.
 */
public class LDAPAuthFailedException extends RuntimeException
{

    private final AuthError error;

    private final String missingKey;

    public LDAPAuthFailedException(final AuthError error, final String message)
    {
        this(error, message, null, null);
    }

    public LDAPAuthFailedException(final AuthError error, final String message, final Throwable cause)
    {
        this(error, message, null, cause);
    }

    private LDAPAuthFailedException(final AuthError error, final String message, final String missingKey, final Throwable cause)
    {
        super(message, cause);
        this.error = error;
        this.missingKey = missingKey;
    }

    public static LDAPAuthFailedException invalidCredentials()
    {
        return new LDAPAuthFailedException(AuthError.INVALID_CREDENTIALS, AuthError.INVALID_CREDENTIALS.getUserMessage());
    }

    public static LDAPAuthFailedException invalidCredentials(final Throwable cause)
    {
        return new LDAPAuthFailedException(AuthError.INVALID_CREDENTIALS, AuthError.INVALID_CREDENTIALS.getUserMessage(), cause);
    }

    public static LDAPAuthFailedException configurationMissing(final ConfigurationException cause)
    {
        return new LDAPAuthFailedException(AuthError.CONFIGURATION_MISSING, cause.getMessage(), cause.getKey(), cause);
    }

    public AuthError getError()
    {
        return error;
    }

    /**
     * @return key whose absence caused {@link AuthError#CONFIGURATION_MISSING}, empty for every other error
     */
    public Optional<String> getMissingKey()
    {
        return Optional.ofNullable(missingKey);
    }

    public String getUserMessage()
    {
        return error.getUserMessage();
    }
}
