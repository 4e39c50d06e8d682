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

import java.util.List;

import com.instaclustr.webapp.ldap.conf.LdapAuthenticatorConfiguration;
import com.instaclustr.webapp.ldap.exception.ConfigurationException;
import com.instaclustr.webapp.ldap.exception.DirectoryException;
import com.instaclustr.webapp.ldap.exception.MalformedDirectoryResponseException;

/**
 * Bind, search and unbind against a directory server.
 * <p>
 * Implementations may be supplied through {@link java.util.ServiceLoader}, see
 * {@link LdapAuthenticatorConfiguration#LOAD_DIRECTORY_CLIENT_SERVICE_PROP}. Every blocking call has to be bounded by
 * the configured timeouts.
 */
public interface DirectoryClient
{

    DirectoryClient setup(LdapAuthenticatorConfiguration configuration) throws ConfigurationException;

    /**
     * @throws DirectoryException when the server can not be reached or rejects the credentials
     */
    DirectoryBinding bind(String dn, String credential) throws DirectoryException;

    /**
     * @param attributes attributes to return, an empty list returns none
     * @throws DirectoryException                  on transport failure or timeout
     * @throws MalformedDirectoryResponseException when returned data can not be decoded
     */
    SearchResponse search(DirectoryBinding binding,
                          String baseDn,
                          String filter,
                          SearchScope scope,
                          List<String> attributes) throws DirectoryException, MalformedDirectoryResponseException;

    default void unbind(final DirectoryBinding binding)
    {
        binding.close();
    }
}
