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

import javax.naming.NamingException;
import javax.net.SocketFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.Socket;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;

/**
 * Socket factory handed to JNDI through {@code java.naming.ldap.factory.socket}.
 * <p>
 * JNDI only accepts a class name and calls its static {@link #getDefault()}, so the SSL factory built from the
 * configured CA certificate is passed on the calling thread for the duration of
 * {@link #withSocketFactory(SSLSocketFactory, NamingAction)}.
 */
public final class TrustedCertificateSocketFactory extends SocketFactory
{

    private static final ThreadLocal<SSLSocketFactory> CURRENT = new ThreadLocal<>();

    private final SSLSocketFactory delegate;

    private TrustedCertificateSocketFactory(final SSLSocketFactory delegate)
    {
        this.delegate = delegate;
    }

    public static SocketFactory getDefault()
    {
        final SSLSocketFactory factory = CURRENT.get();

        if (factory == null)
        {
            throw new IllegalStateException(TrustedCertificateSocketFactory.class.getName() + " used outside of a directory bind");
        }

        return new TrustedCertificateSocketFactory(factory);
    }

    public interface NamingAction<T>
    {
        T run() throws NamingException;
    }

    public static <T> T withSocketFactory(final SSLSocketFactory factory, final NamingAction<T> action) throws NamingException
    {
        if (factory == null)
        {
            return action.run();
        }

        CURRENT.set(factory);

        try
        {
            return action.run();
        } finally
        {
            CURRENT.remove();
        }
    }

    /**
     * Builds an SSL socket factory trusting only the certificates in the given PEM or DER file.
     */
    public static SSLSocketFactory fromCaCertificate(final Path caCertificate) throws IOException, GeneralSecurityException
    {
        final Collection<? extends Certificate> certificates;

        try (InputStream input = Files.newInputStream(caCertificate))
        {
            certificates = CertificateFactory.getInstance("X.509").generateCertificates(input);
        }

        if (certificates.isEmpty())
        {
            throw new GeneralSecurityException("No certificate found in " + caCertificate);
        }

        final KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);

        int i = 0;

        for (final Certificate certificate : certificates)
        {
            trustStore.setCertificateEntry("ldap-ca-" + i++, certificate);
        }

        final TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(trustStore);

        final SSLContext sslContext = SSLContext.getInstance("TLS");
        sslContext.init(null, trustManagerFactory.getTrustManagers(), null);

        return sslContext.getSocketFactory();
    }

    // JNDI creates an unconnected socket when a connect timeout is set
    @Override
    public Socket createSocket() throws IOException
    {
        return delegate.createSocket();
    }

    @Override
    public Socket createSocket(final String host, final int port) throws IOException
    {
        return delegate.createSocket(host, port);
    }

    @Override
    public Socket createSocket(final String host, final int port, final InetAddress localHost, final int localPort) throws IOException
    {
        return delegate.createSocket(host, port, localHost, localPort);
    }

    @Override
    public Socket createSocket(final InetAddress host, final int port) throws IOException
    {
        return delegate.createSocket(host, port);
    }

    @Override
    public Socket createSocket(final InetAddress address, final int port, final InetAddress localAddress, final int localPort) throws IOException
    {
        return delegate.createSocket(address, port, localAddress, localPort);
    }
}
