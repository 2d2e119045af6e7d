package org.cobbzilla.swifts3mirror;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpStatus;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads a Swift container over the Swift REST API. The pooled HTTP client is shared by all workers.
 * An expired token (HTTP 401) is renewed once per request with the application credential.
 */
@Slf4j
public class SwiftSourceStore implements SourceStore, Closeable {

    public static final String AUTH_TOKEN_HEADER = "X-Auth-Token";

    private static final TypeReference<List<SwiftObject>> LISTING_TYPE = new TypeReference<List<SwiftObject>>() {};

    private final CloseableHttpClient httpClient;
    private final ObjectMapper mapper;
    private final KeystoneAuthenticator authenticator;
    private volatile SwiftSession session;

    public SwiftSourceStore(CloseableHttpClient httpClient, ObjectMapper mapper, KeystoneAuthenticator authenticator) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.authenticator = authenticator;
    }

    public static SwiftSourceStore create(SwiftCredentials credentials, MirrorOptions options) {
        final PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
        connectionManager.setMaxTotal(options.getMaxWorkers() + 2);
        connectionManager.setDefaultMaxPerRoute(options.getMaxWorkers() + 2);

        final int timeout = options.getRequestTimeoutMillis();
        final RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(timeout)
                .setConnectionRequestTimeout(timeout)
                .setSocketTimeout(timeout)
                .build();

        final CloseableHttpClient httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(requestConfig)
                .build();
        final ObjectMapper mapper = newObjectMapper();
        return new SwiftSourceStore(httpClient, mapper, new KeystoneAuthenticator(httpClient, mapper, credentials));
    }

    static ObjectMapper newObjectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public List<KeyObjectSummary> listObjects(String container, String marker) {
        try (CloseableHttpResponse response = execute(s -> {
            final URIBuilder builder = uriBuilder(s, Collections.singletonList(container))
                    .addParameter("format", "json");
            if (marker != null) builder.addParameter("marker", marker);
            return builder.build();
        })) {
            final int status = response.getStatusLine().getStatusCode();
            if (status == HttpStatus.SC_NO_CONTENT) return Collections.emptyList();
            if (status == HttpStatus.SC_NOT_FOUND) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new StoreException("Container '" + container + "' does not exist");
            }
            if (status != HttpStatus.SC_OK) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new StoreException("Listing container '" + container + "' failed with HTTP " + status);
            }
            try (InputStream in = response.getEntity().getContent()) {
                return parseListing(mapper, in);
            }
        } catch (IOException e) {
            throw new StoreException("Listing container '" + container + "' failed", e);
        }
    }

    @Override
    public void download(String container, String key, Path target) throws IOException {
        final List<String> segments = new ArrayList<String>();
        segments.add(container);
        segments.addAll(Arrays.asList(key.split("/", -1)));

        try (CloseableHttpResponse response = execute(s -> uriBuilder(s, segments).build())) {
            final int status = response.getStatusLine().getStatusCode();
            if (status != HttpStatus.SC_OK) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new StoreException("Downloading " + container + "/" + key + " failed with HTTP " + status);
            }
            try (InputStream in = response.getEntity().getContent()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    static List<KeyObjectSummary> parseListing(ObjectMapper mapper, InputStream in) throws IOException {
        final List<SwiftObject> objects = mapper.readValue(in, LISTING_TYPE);
        return objects == null ? Collections.<KeyObjectSummary>emptyList() : KeyObjectSummary.SwiftObjectToKeyObject(objects);
    }

    private interface UriFactory {
        URI create(SwiftSession session) throws URISyntaxException;
    }

    private CloseableHttpResponse execute(UriFactory uriFactory) throws IOException {
        SwiftSession current = currentSession();
        CloseableHttpResponse response = httpClient.execute(get(uriFactory, current));
        if (response.getStatusLine().getStatusCode() != HttpStatus.SC_UNAUTHORIZED) return response;

        EntityUtils.consumeQuietly(response.getEntity());
        response.close();
        log.warn("Swift token rejected, authenticating again.");
        current = renewSession(current);
        return httpClient.execute(get(uriFactory, current));
    }

    private HttpGet get(UriFactory uriFactory, SwiftSession current) {
        try {
            final HttpGet get = new HttpGet(uriFactory.create(current));
            get.setHeader(AUTH_TOKEN_HEADER, current.getToken());
            return get;
        } catch (URISyntaxException e) {
            throw new StoreException("Invalid Swift URL " + current.getStorageUrl(), e);
        }
    }

    private static URIBuilder uriBuilder(SwiftSession session, List<String> extraSegments) throws URISyntaxException {
        final URIBuilder builder = new URIBuilder(session.getStorageUrl());
        final List<String> segments = new ArrayList<String>();
        for (String segment : builder.getPathSegments()) {
            if (!segment.isEmpty()) segments.add(segment);
        }
        segments.addAll(extraSegments);
        return builder.setPathSegments(segments);
    }

    private synchronized SwiftSession currentSession() {
        if (session == null) session = authenticator.authenticate();
        return session;
    }

    private synchronized SwiftSession renewSession(SwiftSession rejected) {
        if (session == rejected) session = authenticator.authenticate();
        return session;
    }
}
