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

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;

import com.instaclustr.webapp.ldap.InMemoryUserStore;
import com.instaclustr.webapp.ldap.LdapAuthService;
import com.instaclustr.webapp.ldap.LdapIdentity;
import com.instaclustr.webapp.ldap.conf.LdapAuthenticatorConfiguration;
import com.instaclustr.webapp.ldap.conf.LdapConfigurations;
import com.instaclustr.webapp.ldap.exception.AuthError;
import com.instaclustr.webapp.ldap.exception.DirectoryException;
import com.instaclustr.webapp.ldap.exception.LDAPAuthFailedException;
import com.instaclustr.webapp.ldap.exception.MalformedDirectoryResponseException;
import com.unboundid.ldap.listener.InMemoryDirectoryServer;
import com.unboundid.ldap.listener.InMemoryDirectoryServerConfig;
import com.unboundid.ldap.listener.InMemoryListenerConfig;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

/**
 * Runs {@link JndiDirectoryClient} against an in-process directory loaded from directory.ldif.
 */
public class JndiDirectorySearchTest
{

    private static final String PEOPLE_DN = "ou=people,dc=example,dc=com";
    private static final String BOB_DN = "uid=bob,ou=people,dc=example,dc=com";
    private static final String BOB_FILTER = "(&(objectClass=person)(uid=bob))";

    private InMemoryDirectoryServer server;

    @BeforeClass
    public void startDirectory() throws Exception
    {
        server = startServer();
    }

    @AfterClass(alwaysRun = true)
    public void stopDirectory()
    {
        if (server != null)
        {
            server.shutDown(true);
        }
    }

    private static InMemoryDirectoryServer startServer() throws Exception
    {
        final InMemoryDirectoryServerConfig config = new InMemoryDirectoryServerConfig(LdapConfigurations.BASE_DN);
        config.addAdditionalBindCredentials(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD);
        config.setListenerConfigs(InMemoryListenerConfig.createLDAPConfig("default", 0));
        // memberOf is not part of the standard schema
        config.setSchema(null);

        final InMemoryDirectoryServer directory = new InMemoryDirectoryServer(config);
        directory.importFromLDIF(true, new File(JndiDirectorySearchTest.class.getClassLoader().getResource("directory.ldif").toURI()));
        directory.startListening();

        return directory;
    }

    private LdapAuthenticatorConfiguration configuration(final String... keyValues)
    {
        final String[] all = Arrays.copyOf(keyValues, keyValues.length + 4);

        all[keyValues.length] = LdapAuthenticatorConfiguration.URI_PROP;
        all[keyValues.length + 1] = "ldap://127.0.0.1:" + server.getListenPort();
        all[keyValues.length + 2] = LdapAuthenticatorConfiguration.READ_TIMEOUT_PROP;
        all[keyValues.length + 3] = "2000";

        return LdapConfigurations.configuration(all);
    }

    private JndiDirectoryClient client(final String... keyValues)
    {
        final JndiDirectoryClient client = new JndiDirectoryClient();
        client.setup(configuration(keyValues));
        return client;
    }

    @Test
    public void testSearchReturnsRequestedAttributes() throws Exception
    {
        final JndiDirectoryClient client = client();

        try (DirectoryBinding binding = client.bind(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD))
        {
            final SearchResponse response = client.search(binding, PEOPLE_DN, BOB_FILTER, SearchScope.ONE_LEVEL, Collections.singletonList("memberOf"));

            assertTrue(response.isSuccess());
            assertEquals(response.getEntries().size(), 1);

            final DirectoryEntry bob = response.getEntries().get(0);

            assertTrue(bob.getDn().equalsIgnoreCase(BOB_DN), bob.getDn());
            assertEquals(bob.getAttributes().get("memberOf"),
                         Arrays.asList("cn=admins,ou=groups,dc=example,dc=com", "cn=staff,ou=groups,dc=example,dc=com"));
        }
    }

    @Test
    public void testSearchWithoutMatchesSucceedsEmpty() throws Exception
    {
        final JndiDirectoryClient client = client();

        try (DirectoryBinding binding = client.bind(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD))
        {
            // bob lives one level further down
            final SearchResponse response = client.search(binding, LdapConfigurations.BASE_DN, BOB_FILTER, SearchScope.ONE_LEVEL, Collections.emptyList());

            assertTrue(response.isSuccess());
            assertTrue(response.isEmpty());

            assertEquals(client.search(binding, LdapConfigurations.BASE_DN, BOB_FILTER, SearchScope.SUBTREE, Collections.emptyList()).getEntries().size(), 1);
        }
    }

    @Test
    public void testSearchOfUnknownBaseFails() throws Exception
    {
        final JndiDirectoryClient client = client();

        try (DirectoryBinding binding = client.bind(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD))
        {
            final SearchResponse response = client.search(binding, "ou=nowhere,dc=example,dc=com", BOB_FILTER, SearchScope.SUBTREE, Collections.emptyList());

            assertFalse(response.isSuccess());
            assertTrue(response.isEmpty());
        }
    }

    @Test
    public void testInvalidFilterFails() throws Exception
    {
        final JndiDirectoryClient client = client();

        try (DirectoryBinding binding = client.bind(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD))
        {
            assertFalse(client.search(binding, PEOPLE_DN, "(uid=bob", SearchScope.SUBTREE, Collections.emptyList()).isSuccess());
        }
    }

    @Test
    public void testNonTextualValueIsMalformed() throws Exception
    {
        final JndiDirectoryClient client = client();

        try (DirectoryBinding binding = client.bind(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD))
        {
            final MalformedDirectoryResponseException ex = expectThrows(MalformedDirectoryResponseException.class,
                                                                        () -> client.search(binding,
                                                                                            PEOPLE_DN,
                                                                                            BOB_FILTER,
                                                                                            SearchScope.ONE_LEVEL,
                                                                                            Collections.singletonList("jpegPhoto")));

            assertTrue(ex.getMessage().contains("jpegPhoto"), ex.getMessage());
        }
    }

    @Test
    public void testNonTextualValueIsSkippedWhenIgnoringMalformedSchema() throws Exception
    {
        final JndiDirectoryClient client = client(LdapAuthenticatorConfiguration.IGNORE_MALFORMED_SCHEMA_PROP, "true");

        try (DirectoryBinding binding = client.bind(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD))
        {
            final SearchResponse response = client.search(binding, PEOPLE_DN, BOB_FILTER, SearchScope.ONE_LEVEL, Arrays.asList("jpegPhoto", "cn"));

            assertTrue(response.isSuccess());
            assertEquals(response.getEntries().get(0).getAttributes().get("jpegPhoto"), Collections.emptyList());
            assertEquals(response.getEntries().get(0).getAttributes().get("cn"), Collections.singletonList("Bob"));
        }
    }

    @Test
    public void testBindWithWrongPassword()
    {
        expectThrows(DirectoryException.class, () -> client().bind(BOB_DN, "wrong"));
    }

    @Test
    public void testSearchAfterServerStoppedIsTransportFailure() throws Exception
    {
        final InMemoryDirectoryServer stopping = startServer();

        try
        {
            final JndiDirectoryClient client = new JndiDirectoryClient();
            client.setup(LdapConfigurations.configuration(LdapAuthenticatorConfiguration.URI_PROP, "ldap://127.0.0.1:" + stopping.getListenPort(),
                                                          LdapAuthenticatorConfiguration.READ_TIMEOUT_PROP, "2000"));

            final DirectoryBinding binding = client.bind(LdapConfigurations.ADMIN_DN, LdapConfigurations.ADMIN_PASSWORD);

            stopping.shutDown(true);

            expectThrows(DirectoryException.class,
                         () -> client.search(binding, PEOPLE_DN, BOB_FILTER, SearchScope.SUBTREE, Collections.emptyList()));

            client.unbind(binding);
        } finally
        {
            stopping.shutDown(true);
        }
    }

    @Test
    public void testLoginAndIdentityAgainstDirectory()
    {
        final InMemoryUserStore userStore = new InMemoryUserStore();

        final LdapAuthService service = LdapAuthService.create(configuration(LdapAuthenticatorConfiguration.SEARCH_SCOPE_PROP, "SUBTREE",
                                                                             LdapAuthenticatorConfiguration.SUPERUSER_FILTER_PROP,
                                                                             "memberOf=cn=admins,ou=groups,dc=example,dc=com",
                                                                             LdapAuthenticatorConfiguration.DATA_PROFILER_FILTER_PROP,
                                                                             "memberOf=cn=profilers,ou=groups,dc=example,dc=com"),
                                                               userStore);

        final LdapIdentity bob = service.login("bob", "correct");

        assertTrue(bob.isSuperuser());
        assertFalse(bob.hasDataProfilingAccess());
        assertEquals(bob.getLdapGroups(), Arrays.asList("admins", "staff"));

        assertFalse(service.login("alice", "secret").isSuperuser());

        assertEquals(expectThrows(LDAPAuthFailedException.class, () -> service.tryLogin("bob", "wrong")).getError(), AuthError.INVALID_CREDENTIALS);
        assertEquals(expectThrows(LDAPAuthFailedException.class, () -> service.tryLogin("carol", "any")).getError(), AuthError.INVALID_CREDENTIALS);

        service.invalidateAll();
    }
}
