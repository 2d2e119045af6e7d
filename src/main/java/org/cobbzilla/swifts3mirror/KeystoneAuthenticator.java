package org.cobbzilla.swifts3mirror;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;

import java.io.IOException;
import java.io.InputStream;

/**
 * Obtains a Swift token and storage URL from Keystone v3 with an application credential.
 */
@Slf4j
public class KeystoneAuthenticator {

    public static final String SUBJECT_TOKEN_HEADER = "X-Subject-Token";
    public static final String OBJECT_STORE_TYPE = "object-store";
    public static final String PUBLIC_INTERFACE = "public";

    private final CloseableHttpClient httpClient;
    private final ObjectMapper mapper;
    private final SwiftCredentials credentials;

    public KeystoneAuthenticator(CloseableHttpClient httpClient, ObjectMapper mapper, SwiftCredentials credentials) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.credentials = credentials;
    }

    public SwiftSession authenticate() {
        final HttpPost post = new HttpPost(StringUtils.removeEnd(credentials.getAuthUrl(), "/") + "/auth/tokens");
        post.setEntity(new StringEntity(requestBody(), ContentType.APPLICATION_JSON));

        try (CloseableHttpResponse response = httpClient.execute(post)) {
            final int status = response.getStatusLine().getStatusCode();
            if (status != HttpStatus.SC_CREATED && status != HttpStatus.SC_OK) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new StoreException("Keystone authentication at " + credentials.getAuthUrl() + " failed with HTTP " + status);
            }
            if (response.getFirstHeader(SUBJECT_TOKEN_HEADER) == null) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new StoreException("Keystone response carries no " + SUBJECT_TOKEN_HEADER + " header");
            }
            final String token = response.getFirstHeader(SUBJECT_TOKEN_HEADER).getValue();
            final JsonNode body;
            try (InputStream in = response.getEntity().getContent()) {
                body = mapper.readTree(in);
            }
            final String storageUrl = findEndpoint(body, credentials.getRegion());
            log.info("Authenticated with Keystone, using Swift endpoint {}.", storageUrl);
            return new SwiftSession(storageUrl, token);

        } catch (IOException e) {
            throw new StoreException("Keystone authentication at " + credentials.getAuthUrl() + " failed", e);
        }
    }

    String requestBody() {
        final ObjectNode root = mapper.createObjectNode();
        final ObjectNode identity = root.putObject("auth").putObject("identity");
        identity.putArray("methods").add("application_credential");
        identity.putObject("application_credential")
                .put("id", credentials.getApplicationCredentialId())
                .put("secret", credentials.getApplicationCredentialSecret());
        return root.toString();
    }

    /**
     * Picks the public object-store endpoint out of a token's service catalog.
     *
     * @param region null to accept any region
     */
    static String findEndpoint(JsonNode tokenResponse, String region) {
        for (JsonNode service : tokenResponse.path("token").path("catalog")) {
            if (!OBJECT_STORE_TYPE.equals(service.path("type").asText())) continue;
            for (JsonNode endpoint : service.path("endpoints")) {
                if (!PUBLIC_INTERFACE.equals(endpoint.path("interface").asText())) continue;
                if (region != null
                        && !region.equals(endpoint.path("region_id").asText())
                        && !region.equals(endpoint.path("region").asText())) continue;
                return endpoint.path("url").asText();
            }
        }
        throw new StoreException("No public " + OBJECT_STORE_TYPE + " endpoint in the Keystone catalog"
                + (region == null ? "" : " for region " + region));
    }
}
