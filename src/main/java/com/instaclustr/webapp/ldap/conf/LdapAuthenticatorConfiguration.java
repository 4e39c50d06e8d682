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
package com.instaclustr.webapp.ldap.conf;

import static java.lang.Boolean.parseBoolean;
import static java.lang.String.format;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

import com.instaclustr.webapp.ldap.auth.SearchScope;
import com.instaclustr.webapp.ldap.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings of the "ldap" section, loaded from ldap.properties file.
 * <p>
 * Optional settings are returned as {@link Optional}; a key which is present with an empty value is
 * {@code Optional.of("")}, not {@code Optional.empty()}.
 */
public final class LdapAuthenticatorConfiguration
{

    private static final Logger logger = LoggerFactory.getLogger(LdapAuthenticatorConfiguration.class);

    public static final String LDAP_PROPERTIES_FILE_PROP = "webapp.ldap.properties.file";
    public static final String LDAP_PROPERTIES_FILENAME = "ldap.properties";
    public static final String CONF_DIR_ENV = "WEBAPP_CONF";

    // ldap:// or ldaps:// URI of the directory server
    public static final String URI_PROP = "uri";

    // service account used for user and group searches
    public static final String BIND_USER_PROP = "bind_user";
    public static final String BIND_PASSWORD_PROP = "bind_password";

    public static final String BASE_DN_PROP = "basedn";
    public static final String USER_FILTER_PROP = "user_filter";
    public static final String USER_NAME_ATTR_PROP = "user_name_attr";

    public static final String SUPERUSER_FILTER_PROP = "superuser_filter";
    public static final String DATA_PROFILER_FILTER_PROP = "data_profiler_filter";

    public static final String CACERT_PROP = "cacert";

    public static final String SEARCH_SCOPE_PROP = "search_scope";

    public static final String GROUP_MEMBER_ATTR_PROP = "group_member_attr";
    public static final String DEFAULT_GROUP_MEMBER_ATTR = "memberOf";

    public static final String IGNORE_MALFORMED_SCHEMA_PROP = "ignore_malformed_schema";

    public static final String CONNECT_TIMEOUT_PROP = "connect_timeout_ms";
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 5000;

    public static final String READ_TIMEOUT_PROP = "read_timeout_ms";
    public static final long DEFAULT_READ_TIMEOUT_MS = 10000;

    public static final String CACHE_TTL_PROP = "cache_ttl_seconds";
    public static final long DEFAULT_CACHE_TTL_SECONDS = 86400;

    public static final String CACHE_MAX_ENTRIES_PROP = "cache_max_entries";
    public static final long DEFAULT_CACHE_MAX_ENTRIES = 1000;

    public static final String CONTEXT_FACTORY_PROP = "context_factory";
    public static final String DEFAULT_CONTEXT_FACTORY = "com.sun.jndi.ldap.LdapCtxFactory";

    public static final String LOAD_DIRECTORY_CLIENT_SERVICE_PROP = "load_directory_client_service";

    public static final List<String> REQUIRED_PROPS = Collections.unmodifiableList(Arrays.asList(URI_PROP,
                                                                                                 BIND_USER_PROP,
                                                                                                 BIND_PASSWORD_PROP,
                                                                                                 BASE_DN_PROP,
                                                                                                 USER_FILTER_PROP,
                                                                                                 USER_NAME_ATTR_PROP));

    private final Properties properties;

    private final String source;

    public LdapAuthenticatorConfiguration(final Properties properties)
    {
        this(properties, "<in-memory>");
    }

    private LdapAuthenticatorConfiguration(final Properties properties, final String source)
    {
        this.properties = new Properties();
        this.properties.putAll(properties);
        this.source = source;
    }

    /**
     * Loads the file named by system property {@value #LDAP_PROPERTIES_FILE_PROP}, falling back to
     * {@code $WEBAPP_CONF/ldap.properties}.
     */
    public static LdapAuthenticatorConfiguration load() throws ConfigurationException
    {
        final String confDirEnvProperty = System.getenv().get(CONF_DIR_ENV);

        File defaultLdapPropertyFile = null;

        if (confDirEnvProperty != null)
        {
            defaultLdapPropertyFile = new File(confDirEnvProperty, LDAP_PROPERTIES_FILENAME);
        }

        final File ldapPropertyFile = new File(System.getProperty(LDAP_PROPERTIES_FILE_PROP, LDAP_PROPERTIES_FILENAME));

        File finalLdapPropertyFile = null;

        if (ldapPropertyFile.exists() && ldapPropertyFile.canRead())
        {
            finalLdapPropertyFile = ldapPropertyFile;
        } else if (defaultLdapPropertyFile != null && defaultLdapPropertyFile.exists() && defaultLdapPropertyFile.canRead())
        {
            finalLdapPropertyFile = defaultLdapPropertyFile;
        }

        if (finalLdapPropertyFile == null)
        {
            throw new ConfigurationException(format(
                "Unable to locate readable LDAP configuration file from system property %s nor from $%s/%s.",
                LDAP_PROPERTIES_FILE_PROP,
                CONF_DIR_ENV,
                LDAP_PROPERTIES_FILENAME));
        } else
        {
            logger.info("LDAP configuration file: {}", finalLdapPropertyFile.getAbsoluteFile());
        }

        return load(finalLdapPropertyFile);
    }

    public static LdapAuthenticatorConfiguration load(final File file) throws ConfigurationException
    {
        final Properties properties = new Properties();

        try (FileInputStream input = new FileInputStream(file))
        {
            properties.load(input);
        } catch (IOException ex)
        {
            throw new ConfigurationException(format("Could not open ldap configuration file %s", file), ex);
        }

        return new LdapAuthenticatorConfiguration(properties, file.getAbsolutePath());
    }

    /**
     * Checks every key in {@link #REQUIRED_PROPS} is present.
     *
     * @return this configuration
     * @throws ConfigurationException naming the first missing key
     */
    public LdapAuthenticatorConfiguration validate() throws ConfigurationException
    {
        for (final String key : REQUIRED_PROPS)
        {
            getRequired(key);
        }

        return this;
    }

    public String getRequired(final String key) throws ConfigurationException
    {
        final String value = properties.getProperty(key);

        if (value == null)
        {
            throw new ConfigurationException(key, format("%s MUST be set in the configuration %s", key, source), null);
        }

        return value;
    }

    public Optional<String> getOptional(final String key)
    {
        return Optional.ofNullable(properties.getProperty(key));
    }

    public String getUri()
    {
        return getRequired(URI_PROP);
    }

    public String getBindUser()
    {
        return getRequired(BIND_USER_PROP);
    }

    public String getBindPassword()
    {
        return getRequired(BIND_PASSWORD_PROP);
    }

    public String getBaseDn()
    {
        return getRequired(BASE_DN_PROP);
    }

    public String getUserFilter()
    {
        return getRequired(USER_FILTER_PROP);
    }

    public String getUserNameAttribute()
    {
        return getRequired(USER_NAME_ATTR_PROP);
    }

    public Optional<String> getSuperuserFilter()
    {
        return getOptional(SUPERUSER_FILTER_PROP);
    }

    public Optional<String> getDataProfilerFilter()
    {
        return getOptional(DATA_PROFILER_FILTER_PROP);
    }

    public Optional<String> getCaCertificate()
    {
        return getOptional(CACERT_PROP);
    }

    /**
     * "SUBTREE" selects a subtree search, anything else, including an absent key, a single level one.
     */
    public SearchScope getSearchScope()
    {
        return getOptional(SEARCH_SCOPE_PROP)
            .map(String::trim)
            .filter("SUBTREE"::equalsIgnoreCase)
            .map(scope -> SearchScope.SUBTREE)
            .orElse(SearchScope.ONE_LEVEL);
    }

    public String getGroupMemberAttribute()
    {
        return getOptional(GROUP_MEMBER_ATTR_PROP).filter(attr -> !attr.trim().isEmpty()).orElse(DEFAULT_GROUP_MEMBER_ATTR);
    }

    public boolean isIgnoreMalformedSchema()
    {
        return parseBoolean(properties.getProperty(IGNORE_MALFORMED_SCHEMA_PROP, "false"));
    }

    public Duration getConnectTimeout()
    {
        return Duration.ofMillis(getPositiveLong(CONNECT_TIMEOUT_PROP, DEFAULT_CONNECT_TIMEOUT_MS));
    }

    public Duration getReadTimeout()
    {
        return Duration.ofMillis(getPositiveLong(READ_TIMEOUT_PROP, DEFAULT_READ_TIMEOUT_MS));
    }

    public Duration getCacheTtl()
    {
        return Duration.ofSeconds(getPositiveLong(CACHE_TTL_PROP, DEFAULT_CACHE_TTL_SECONDS));
    }

    public long getCacheMaxEntries()
    {
        return getPositiveLong(CACHE_MAX_ENTRIES_PROP, DEFAULT_CACHE_MAX_ENTRIES);
    }

    public String getContextFactory()
    {
        return properties.getProperty(CONTEXT_FACTORY_PROP, DEFAULT_CONTEXT_FACTORY);
    }

    public boolean isLoadDirectoryClientService()
    {
        return parseBoolean(properties.getProperty(LOAD_DIRECTORY_CLIENT_SERVICE_PROP, "false"));
    }

    private long getPositiveLong(final String key, final long defaultValue)
    {
        final String value = properties.getProperty(key);

        if (value == null)
        {
            return defaultValue;
        }

        try
        {
            final long parsed = Long.parseLong(value.trim());

            if (parsed <= 0)
            {
                logger.warn(format("Property %s has to be positive, setting it to %s", key, defaultValue));

                return defaultValue;
            }

            return parsed;
        } catch (final NumberFormatException e)
        {
            logger.warn(format("Unable to parse %s property, setting it to %s", key, defaultValue));
            return defaultValue;
        }
    }

    @Override
    public String toString()
    {
        return "LdapAuthenticatorConfiguration[" + source + "]";
    }
}
