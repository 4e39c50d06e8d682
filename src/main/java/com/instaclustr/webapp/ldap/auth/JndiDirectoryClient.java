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

import static java.lang.String.format;

import javax.naming.CommunicationException;
import javax.naming.Context;
import javax.naming.InvalidNameException;
import javax.naming.NamingEnumeration;
import javax.naming.NamingException;
import javax.naming.ServiceUnavailableException;
import javax.naming.TimeLimitExceededException;
import javax.naming.directory.Attribute;
import javax.naming.directory.InitialDirContext;
import javax.naming.directory.SearchControls;
import javax.naming.directory.SearchResult;
import javax.naming.ldap.LdapName;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Hashtable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Stopwatch;
import com.instaclustr.webapp.ldap.conf.LdapAuthenticatorConfiguration;
import com.instaclustr.webapp.ldap.exception.ConfigurationException;
import com.instaclustr.webapp.ldap.exception.DirectoryException;
import com.instaclustr.webapp.ldap.exception.MalformedDirectoryResponseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DirectoryClient} on top of JNDI. Every binding owns its own {@link InitialDirContext}.
 */
public class JndiDirectoryClient implements DirectoryClient
{

    private static final Logger logger = LoggerFactory.getLogger(JndiDirectoryClient.class);

    static final String SOCKET_FACTORY_ENV = "java.naming.ldap.factory.socket";
    static final String CONNECT_TIMEOUT_ENV = "com.sun.jndi.ldap.connect.timeout";
    static final String READ_TIMEOUT_ENV = "com.sun.jndi.ldap.read.timeout";

    private LdapAuthenticatorConfiguration configuration;

    private SSLSocketFactory trustedSocketFactory;

    @Override
    public DirectoryClient setup(final LdapAuthenticatorConfiguration configuration) throws ConfigurationException
    {
        this.configuration = configuration;

        final Optional<String> caCertificate = configuration.getCaCertificate().filter(path -> !path.trim().isEmpty());

        if (caCertificate.isPresent())
        {
            try
            {
                trustedSocketFactory = TrustedCertificateSocketFactory.fromCaCertificate(Paths.get(caCertificate.get().trim()));
                logger.info("Directory server certificate will be validated against {}", caCertificate.get());
            } catch (final IOException | GeneralSecurityException ex)
            {
                throw new ConfigurationException(LdapAuthenticatorConfiguration.CACERT_PROP,
                                                 format("Unable to load CA certificate %s: %s", caCertificate.get(), ex.getMessage()),
                                                 ex);
            }
        } else
        {
            logger.debug("No {} configured, using the default trust store for TLS connections", LdapAuthenticatorConfiguration.CACERT_PROP);
        }

        return this;
    }

    @Override
    public DirectoryBinding bind(final String dn, final String credential) throws DirectoryException
    {
        checkSetUp();

        final Hashtable<String, String> env = getEnvironment(dn, credential);
        final Stopwatch stopwatch = Stopwatch.createStarted();

        try
        {
            final InitialDirContext context = TrustedCertificateSocketFactory.withSocketFactory(trustedSocketFactory,
                                                                                                 () -> new InitialDirContext(env));

            logger.debug("Bound to {} as {} in {} ms", configuration.getUri(), dn, stopwatch.elapsed(TimeUnit.MILLISECONDS));

            return new JndiBinding(dn, context);
        } catch (final NamingException ex)
        {
            logger.error("Cannot bind to LDAP server {} as {}: {}, explanation: {}",
                         configuration.getUri(),
                         dn,
                         ex.getMessage(),
                         ex.getExplanation() == null ? "unknown" : ex.getExplanation());

            throw new DirectoryException(format("Cannot bind to LDAP server %s as %s", configuration.getUri(), dn), ex);
        }
    }

    @Override
    public SearchResponse search(final DirectoryBinding binding,
                                 final String baseDn,
                                 final String filter,
                                 final SearchScope scope,
                                 final List<String> attributes) throws DirectoryException, MalformedDirectoryResponseException
    {
        if (!(binding instanceof JndiBinding))
        {
            throw new IllegalArgumentException("Binding was not created by " + JndiDirectoryClient.class.getName());
        }

        checkSetUp();

        final JndiBinding jndiBinding = (JndiBinding) binding;

        final SearchControls searchControls = new SearchControls();
        searchControls.setSearchScope(scope.getJndiScope());
        searchControls.setReturningAttributes(attributes.toArray(new String[0]));
        searchControls.setTimeLimit((int) Math.min(Integer.MAX_VALUE, configuration.getReadTimeout().toMillis()));

        logger.debug("Searching {} with filter {} and scope {}", baseDn, filter, scope);

        final Stopwatch stopwatch = Stopwatch.createStarted();

        // a DirContext is not safe for concurrent use
        synchronized (jndiBinding)
        {
            if (!jndiBinding.isBound())
            {
                throw new DirectoryException(format("Connection for %s was already unbound", jndiBinding.getBoundDn()));
            }

            NamingEnumeration<SearchResult> answer = null;

            try
            {
                answer = jndiBinding.context.search(baseDn, filter, searchControls);

                final List<DirectoryEntry> entries = new ArrayList<>();

                while (answer.hasMore())
                {
                    final DirectoryEntry entry = toEntry(answer.next());

                    if (entry != null)
                    {
                        entries.add(entry);
                    }
                }

                logger.debug("Search on {} returned {} entries in {} ms", baseDn, entries.size(), stopwatch.elapsed(TimeUnit.MILLISECONDS));

                return SearchResponse.succeeded(entries);
            } catch (final NamingException ex)
            {
                if (isTransportFailure(ex))
                {
                    logger.error("Error while searching {} with filter {}! {}", baseDn, filter, ex.toString(true), ex);

                    throw new DirectoryException(format("Search on %s failed: %s", baseDn, ex.getMessage()), ex);
                }

                logger.warn("Search on {} with filter {} failed: {}, explanation: {}", baseDn, filter, ex.getMessage(), ex.getExplanation());

                return SearchResponse.failed(ex.getExplanation() == null ? ex.getMessage() : ex.getExplanation());
            } finally
            {
                if (answer != null)
                {
                    try
                    {
                        answer.close();
                    } catch (NamingException closingException)
                    {
                        logger.warn("Failing to close search results from LDAP server.");
                    }
                }
            }
        }
    }

    private void checkSetUp()
    {
        if (configuration == null)
        {
            throw new IllegalStateException(format("%s was not set up, call setup(configuration) first", JndiDirectoryClient.class.getName()));
        }
    }

    Hashtable<String, String> getEnvironment(final String dn, final String credential)
    {
        final Hashtable<String, String> env = new Hashtable<>(11);

        env.put(Context.INITIAL_CONTEXT_FACTORY, configuration.getContextFactory());
        env.put(Context.PROVIDER_URL, configuration.getUri());
        env.put(Context.SECURITY_AUTHENTICATION, "simple");

        env.put(Context.SECURITY_PRINCIPAL, dn);
        env.put(Context.SECURITY_CREDENTIALS, credential);

        env.put(CONNECT_TIMEOUT_ENV, Long.toString(configuration.getConnectTimeout().toMillis()));
        env.put(READ_TIMEOUT_ENV, Long.toString(configuration.getReadTimeout().toMillis()));

        if (trustedSocketFactory != null)
        {
            env.put(SOCKET_FACTORY_ENV, TrustedCertificateSocketFactory.class.getName());
        }

        return env;
    }

    private DirectoryEntry toEntry(final SearchResult result) throws NamingException, MalformedDirectoryResponseException
    {
        final String dn = result.getNameInNamespace();

        try
        {
            new LdapName(dn);
        } catch (final InvalidNameException ex)
        {
            if (!configuration.isIgnoreMalformedSchema())
            {
                throw new MalformedDirectoryResponseException(format("Unable to parse entry name '%s'", dn), ex);
            }

            logger.warn("Skipping entry with unparsable name '{}'", dn);

            return null;
        }

        final Map<String, List<String>> attributes = new LinkedHashMap<>();

        if (result.getAttributes() != null)
        {
            final NamingEnumeration<? extends Attribute> all = result.getAttributes().getAll();

            while (all.hasMore())
            {
                final Attribute attribute = all.next();
                final List<String> values = new ArrayList<>();
                final NamingEnumeration<?> rawValues = attribute.getAll();

                while (rawValues.hasMore())
                {
                    final Object value = rawValues.next();

                    if (value instanceof String)
                    {
                        values.add((String) value);
                    } else if (!configuration.isIgnoreMalformedSchema())
                    {
                        throw new MalformedDirectoryResponseException(format("Attribute %s of %s has a non textual value", attribute.getID(), dn));
                    } else
                    {
                        logger.warn("Skipping non textual value of attribute {} of {}", attribute.getID(), dn);
                    }
                }

                attributes.put(attribute.getID(), values);
            }
        }

        return new DirectoryEntry(dn, attributes);
    }

    private static boolean isTransportFailure(final NamingException ex)
    {
        if (ex instanceof CommunicationException || ex instanceof ServiceUnavailableException || ex instanceof TimeLimitExceededException)
        {
            return true;
        }

        // JNDI reports an expired read timeout as a plain NamingException
        return ex.getRootCause() instanceof IOException || (ex.getMessage() != null && ex.getMessage().contains("timed out"));
    }

    static final class JndiBinding implements DirectoryBinding
    {

        private final String boundDn;

        private final InitialDirContext context;

        private boolean bound = true;

        JndiBinding(final String boundDn, final InitialDirContext context)
        {
            this.boundDn = boundDn;
            this.context = context;
        }

        @Override
        public String getBoundDn()
        {
            return boundDn;
        }

        @Override
        public synchronized boolean isBound()
        {
            return bound;
        }

        @Override
        public synchronized void close()
        {
            if (!bound)
            {
                return;
            }

            bound = false;

            try
            {
                context.close();
                logger.debug("Unbound {}", boundDn);
            } catch (final NamingException ex)
            {
                logger.warn("Failing to unbind {} from LDAP server: {}", boundDn, ex.getMessage());
            }
        }

        @Override
        public String toString()
        {
            return "JndiBinding[boundDn='" + boundDn + "', credentials=redacted, bound=" + isBound() + "]";
        }
    }
}
