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

public class ConfigurationException extends RuntimeException
{

    private final String key;

    public ConfigurationException(final String message)
    {
        this(null, message, null);
    }

    public ConfigurationException(final String message, final Throwable cause)
    {
        this(null, message, cause);
    }

    public ConfigurationException(final String key, final String message, final Throwable cause)
    {
        super(message, cause);
        this.key = key;
    }

    /**
     * @return offending configuration key, null when the problem is not tied to a single key
     */
    public String getKey()
    {
        return key;
    }
}
