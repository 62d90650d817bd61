/*
 * Copyright 2009-2018 The Apache Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License. You may obtain a copy of
 * the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations under
 * the License.
 */
package io.github.ontology.registry.maven.plugin.internal;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ProxySelector;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import javax.annotation.concurrent.ThreadSafe;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHost;
import org.apache.http.HttpResponse;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.Credentials;
import org.apache.http.auth.NTCredentials;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.client.CredentialsProvider;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.conn.routing.HttpRoutePlanner;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.DefaultProxyRoutePlanner;
import org.apache.http.impl.conn.SystemDefaultRoutePlanner;
import org.apache.http.message.BasicHeader;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.shared.utils.StringUtils;

/**
 * Reads remote resources over HTTP using Apache HttpClient 4.x.
 * Use {@link HttpResourceRequester.Builder} to create an instance.
 * A new client is created for every request, instances hold configuration only.
 */
@ThreadSafe
@SuppressWarnings(
    {"checkstyle:JavadocVariable", "checkstyle:EmptyLineSeparator", "checkstyle:HiddenField"}
)
public final class HttpResourceRequester {

    /**
     * Buffer size used when reading response bodies.
     */
    private static final int BUFFER_SIZE = 8 * 1024;

    private int connectTimeout;
    private int socketTimeout;
    private boolean redirectsEnabled;
    private HttpRoutePlanner routePlanner;
    private CredentialsProvider credentialsProvider;
    private List<Header> headers;
    private Log log;

    /**
     * Private constructor.
     */
    private HttpResourceRequester() {
    }

    /**
     * Reads the resource with the given URI into memory.
     * @param uri Resource URI.
     * @return Response body; empty if the response has none.
     * @throws RemoteResourceException If the server answers with an error or an unfollowed redirect.
     * @throws IOException If the request fails.
     */
    public byte[] get(final URI uri) throws IOException {
        try (CloseableHttpClient httpClient = this.createHttpClient()) {
            final HttpClientContext clientContext = HttpClientContext.create();
            clientContext.setCredentialsProvider(this.credentialsProvider);
            final HttpGet httpGet = new HttpGet(uri);
            this.headers.forEach(httpGet::setHeader);
            this.log.debug(String.format("GET %s", uri));
            return httpClient.execute(
                httpGet,
                response -> this.handleResponse(uri, response),
                clientContext
            );
        }
    }

    /**
     * Handles response from the server.
     * @param uri Request uri.
     * @param response Response from the server.
     * @return Response body.
     * @throws IOException Thrown if the response is a failure or can't be read.
     */
    private byte[] handleResponse(final URI uri, final HttpResponse response) throws IOException {
        final int statusCode = response.getStatusLine().getStatusCode();
        if (HttpCodes.isError(statusCode)) {
            throw new RemoteResourceException(
                uri, statusCode, response.getStatusLine().getReasonPhrase()
            );
        }
        if (HttpCodes.isRedirect(statusCode)) {
            throw new RemoteResourceException(
                uri,
                statusCode,
                String.format(
                    "%s, not following the redirect because followRedirects is false.",
                    response.getStatusLine().getReasonPhrase()
                )
            );
        }
        final HttpEntity entity = response.getEntity();
        if (entity == null) {
            return new byte[0];
        }
        try (
            InputStream in = entity.getContent();
            ByteArrayOutputStream out = new ByteArrayOutputStream()
        ) {
            final byte[] tmp = new byte[BUFFER_SIZE];
            int bytesRead;
            while ((bytesRead = in.read(tmp)) != -1) {
                out.write(tmp, 0, bytesRead);
            }
            this.log.debug(String.format("%d bytes read from %s", out.size(), uri));
            return out.toByteArray();
        }
    }

    /**
     * Creates a client configured with timeouts, route planner and credentials.
     * @return HTTP client.
     */
    private CloseableHttpClient createHttpClient() {
        return HttpClients.custom()
            .setDefaultCredentialsProvider(this.credentialsProvider)
            .setRoutePlanner(this.routePlanner)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectTimeout(this.connectTimeout)
                .setSocketTimeout(this.socketTimeout)
                .setRedirectsEnabled(this.redirectsEnabled)
                .build())
            .build();
    }

    /**
     * Builder class for creating an instance of HttpResourceRequester.
     */
    @SuppressWarnings({"checkstyle:MissingJavadocMethod", "checkstyle:MagicNumber"})
    public static final class Builder {
        private int connectTimeout = 3000;
        private int socketTimeout = 3000;
        private boolean redirectsEnabled = true;
        private String proxyHost;
        private int proxyPort;
        private String proxyUserName;
        private String proxyPassword;
        private String proxyNtlmHost;
        private String proxyNtlmDomain;
        private final List<Header> headers = new ArrayList<>();
        private Log log;

        public HttpResourceRequester.Builder withConnectTimeout(final int connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public HttpResourceRequester.Builder withSocketTimeout(final int socketTimeout) {
            this.socketTimeout = socketTimeout;
            return this;
        }

        public HttpResourceRequester.Builder withRedirectsEnabled(final boolean followRedirects) {
            this.redirectsEnabled = followRedirects;
            return this;
        }

        public HttpResourceRequester.Builder withProxyHost(final String proxyHost) {
            this.proxyHost = proxyHost;
            return this;
        }

        public HttpResourceRequester.Builder withProxyPort(final int proxyPort) {
            this.proxyPort = proxyPort;
            return this;
        }

        public HttpResourceRequester.Builder withProxyUserName(final String proxyUserName) {
            this.proxyUserName = proxyUserName;
            return this;
        }

        public HttpResourceRequester.Builder withProxyPassword(final String proxyPassword) {
            this.proxyPassword = proxyPassword;
            return this;
        }

        public HttpResourceRequester.Builder withNtlmHost(final String proxyNtlmHost) {
            this.proxyNtlmHost = proxyNtlmHost;
            return this;
        }

        public HttpResourceRequester.Builder withNtlmDomain(final String proxyNtlmDomain) {
            this.proxyNtlmDomain = proxyNtlmDomain;
            return this;
        }

        public HttpResourceRequester.Builder withHeader(final String name, final String value) {
            this.headers.add(new BasicHeader(name, value));
            return this;
        }

        public HttpResourceRequester.Builder withLog(final Log log) {
            this.log = log;
            return this;
        }

        /**
         * Builds an instance of {@code HttpResourceRequester} using the configured properties.
         * Without a proxy host the system default proxy selector is used.
         * @return A newly constructed {@code HttpResourceRequester}
         */
        public HttpResourceRequester build() {
            final HttpResourceRequester instance = new HttpResourceRequester();
            instance.connectTimeout = this.connectTimeout;
            instance.socketTimeout = this.socketTimeout;
            instance.redirectsEnabled = this.redirectsEnabled;
            instance.headers = Collections.unmodifiableList(new ArrayList<>(this.headers));
            instance.log = Objects.requireNonNull(this.log, "log");
            instance.credentialsProvider = new BasicCredentialsProvider();
            if (StringUtils.isNotBlank(this.proxyHost)) {
                final HttpHost host = new HttpHost(this.proxyHost, this.proxyPort);
                instance.routePlanner = new DefaultProxyRoutePlanner(host);
                final boolean isProxyAuth = StringUtils.isNotBlank(this.proxyUserName)
                    && StringUtils.isNotBlank(this.proxyPassword);
                if (isProxyAuth) {
                    final Credentials credentials;
                    final boolean isNtlmProxy = StringUtils.isNotBlank(this.proxyNtlmHost)
                        && StringUtils.isNotBlank(this.proxyNtlmDomain);
                    if (isNtlmProxy) {
                        credentials = new NTCredentials(
                            this.proxyUserName, this.proxyPassword,
                            this.proxyNtlmHost, this.proxyNtlmDomain
                        );
                    } else {
                        credentials = new UsernamePasswordCredentials(
                            this.proxyUserName, this.proxyPassword
                        );
                    }
                    instance.credentialsProvider.setCredentials(
                        new AuthScope(host.getHostName(), host.getPort()), credentials
                    );
                }
            } else {
                instance.routePlanner = new SystemDefaultRoutePlanner(ProxySelector.getDefault());
            }
            return instance;
        }
    }
}
