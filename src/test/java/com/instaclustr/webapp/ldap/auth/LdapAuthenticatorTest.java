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

import static com.instaclustr.webapp.ldap.auth.StubDirectoryClient.entry;
import static com.instaclustr.webapp.ldap.auth.StubDirectoryClient.found;
import static com.instaclustr.webapp.ldap.conf.LdapConfigurations.ADMIN_DN;
import static com.instaclustr.webapp.ldap.conf.LdapConfigurations.ADMIN_PASSWORD;
import static com.instaclustr.webapp.ldap.conf.LdapConfigurations.BASE_DN;
import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertTrue;
import static org.testng.Assert.expectThrows;

import java.time.Duration;
import java.util.List;
import java.util.Properties;

import com.google.common.base.Ticker;
import com.instaclustr.webapp.ldap.cache.ConnectionCache;
import com.instaclustr.webapp.ldap.conf.LdapAuthenticatorConfiguration;
import com.instaclustr.webapp.ldap.conf.LdapConfigurations;
import com.instaclustr.webapp.ldap.exception.AuthError;
import com.instaclustr.webapp.ldap.exception.DirectoryException;
import com.instaclustr.webapp.ldap.exception.LDAPAuthFailedException;
import com.instaclustr.webapp.ldap.exception.MalformedDirectoryResponseException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

public class LdapAuthenticatorTest
{

    private static final String BOB_DN = "uid=bob,dc=example,dc=com";
    private static final String BOB_FILTER = "(&(objectClass=person)(uid=bob))";

    private StubDirectoryClient directory;

    private ConnectionCache connectionCache;

    @BeforeMethod
    public void setUp()
    {
        directory = new StubDirectoryClient()
            .withAccount(ADMIN_DN, ADMIN_PASSWORD)
            .withAccount(BOB_DN, "correct")
            .onSearch(BOB_FILTER, found(entry(BOB_DN, null)));
    }

    private LdapAuthenticator authenticator(final LdapAuthenticatorConfiguration configuration)
    {
        connectionCache = new ConnectionCache(directory, 100, Ticker.systemTicker(), Duration.ofHours(24));

        return new LdapAuthenticator(configuration, directory, connectionCache);
    }

    private LdapAuthenticator authenticator()
    {
        return authenticator(LdapConfigurations.configuration());
    }

    @Test
    public void testLoginWithCorrectPassword()
    {
        authenticator().tryLogin("bob", "correct");

        final List<StubDirectoryClient.SearchCall> searches = directory.getSearches();

        assertEquals(searches.size(), 1);
        assertEquals(searches.get(0).boundDn, ADMIN_DN);
        assertEquals(searches.get(0).baseDn, BASE_DN);
        assertEquals(searches.get(0).filter, BOB_FILTER);
        assertEquals(searches.get(0).scope, SearchScope.ONE_LEVEL);
        assertTrue(searches.get(0).attributes.isEmpty());

        assertEquals(directory.getBindAttempts(), 2);
    }

    @Test
    public void testUserConnectionIsUnboundAfterLogin()
    {
        authenticator().tryLogin("bob", "correct");

        final List<StubDirectoryClient.StubBinding> bindings = directory.getBindings();

        assertEquals(bindings.size(), 2);
        assertEquals(bindings.get(0).getBoundDn(), ADMIN_DN);
        assertTrue(bindings.get(0).isBound());
        assertEquals(bindings.get(1).getBoundDn(), BOB_DN);
        assertFalse(bindings.get(1).isBound());

        // only the service account connection stays cached
        assertEquals(connectionCache.size(), 1);
    }

    @Test
    public void testServiceConnectionIsReusedAcrossLogins()
    {
        final LdapAuthenticator authenticator = authenticator();

        authenticator.tryLogin("bob", "correct");
        authenticator.tryLogin("bob", "correct");

        assertEquals(directory.getBindAttempts(), 3);
        assertEquals(directory.getSearches().size(), 2);
    }

    @Test
    public void testUnknownUserIsInvalidCredentials()
    {
        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("alice", "whatever"));

        assertEquals(ex.getError(), AuthError.INVALID_CREDENTIALS);
        assertEquals(ex.getUserMessage(), "Invalid username or password");
    }

    @Test
    public void testWrongPasswordIsInvalidCredentials()
    {
        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "wrong"));

        assertEquals(ex.getError(), AuthError.INVALID_CREDENTIALS);
    }

    @Test
    public void testFailedSearchIsInvalidCredentials()
    {
        directory.onSearch(BOB_FILTER, SearchResponse.failed("No Such Object"));

        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "correct"));

        assertEquals(ex.getError(), AuthError.INVALID_CREDENTIALS);
    }

    @Test
    public void testEntryWithoutDistinguishedNameIsInvalidCredentials()
    {
        directory.onSearch(BOB_FILTER, found(entry(null, "uid", "bob")));

        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "correct"));

        assertEquals(ex.getError(), AuthError.INVALID_CREDENTIALS);
        assertEquals(directory.getBindAttempts(), 1);
    }

    @Test
    public void testUnparsableDistinguishedNameIsMalformedResponse()
    {
        directory.onSearch(BOB_FILTER, found(entry("bob at example", null)));

        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "correct"));

        assertEquals(ex.getError(), AuthError.MALFORMED_DIRECTORY_RESPONSE);
        assertTrue(ex.getMessage().contains(LdapAuthenticatorConfiguration.SEARCH_SCOPE_PROP));
    }

    @Test
    public void testUndecodableSearchResultIsMalformedResponse()
    {
        directory.onSearchThrow(BOB_FILTER, new MalformedDirectoryResponseException("Unable to parse entry name"));

        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "correct"));

        assertEquals(ex.getError(), AuthError.MALFORMED_DIRECTORY_RESPONSE);
    }

    @Test
    public void testUnreachableDirectory()
    {
        directory.setUnreachable(true);

        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "correct"));

        assertEquals(ex.getError(), AuthError.DIRECTORY_UNREACHABLE);
        assertEquals(ex.getUserMessage(), "Unable to log in at this time");
    }

    @Test
    public void testSearchTransportFailure()
    {
        directory.onSearchThrow(BOB_FILTER, new DirectoryException("LDAP response read timed out"));

        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "correct"));

        assertEquals(ex.getError(), AuthError.DIRECTORY_UNREACHABLE);
        assertEquals(directory.getBindings().size(), 1);
        assertTrue(directory.getBindings().get(0).isBound());
    }

    @Test
    public void testEmptyPasswordNeverReachesDirectory()
    {
        assertEquals(expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("bob", "")).getError(),
                     AuthError.INVALID_CREDENTIALS);
        assertEquals(expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("", "correct")).getError(),
                     AuthError.INVALID_CREDENTIALS);
        assertEquals(expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin(null, null)).getError(),
                     AuthError.INVALID_CREDENTIALS);

        assertEquals(directory.getBindAttempts(), 0);
    }

    @Test
    public void testSubtreeScope()
    {
        authenticator(LdapConfigurations.configuration(LdapAuthenticatorConfiguration.SEARCH_SCOPE_PROP, "SUBTREE")).tryLogin("bob", "correct");

        assertEquals(directory.getSearches().get(0).scope, SearchScope.SUBTREE);
    }

    @Test
    public void testUnparenthesizedUserFilter()
    {
        authenticator(LdapConfigurations.configuration(LdapAuthenticatorConfiguration.USER_FILTER_PROP, "objectClass=person")).tryLogin("bob", "correct");

        assertEquals(directory.getSearches().get(0).filter, BOB_FILTER);
    }

    @Test
    public void testUsernameIsEscapedInFilter()
    {
        expectThrows(LDAPAuthFailedException.class, () -> authenticator().tryLogin("b*)(uid=*", "correct"));

        assertEquals(directory.getSearches().get(0).filter, "(&(objectClass=person)(uid=b\\2a\\29\\28uid=\\2a))");
    }

    @Test
    public void testMissingConfiguration()
    {
        final Properties properties = LdapConfigurations.defaults();
        properties.remove(LdapAuthenticatorConfiguration.BASE_DN_PROP);

        final LDAPAuthFailedException ex = expectThrows(LDAPAuthFailedException.class,
                                                        () -> authenticator(new LdapAuthenticatorConfiguration(properties)).tryLogin("bob", "correct"));

        assertEquals(ex.getError(), AuthError.CONFIGURATION_MISSING);
        assertEquals(ex.getMissingKey().orElse(null), LdapAuthenticatorConfiguration.BASE_DN_PROP);
        assertEquals(directory.getBindAttempts(), 0);
    }
}
