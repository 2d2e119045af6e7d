package org.cobbzilla.swifts3mirror;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * Keystone v3 application credential used to obtain a Swift token.
 */
@AllArgsConstructor
public class SwiftCredentials {

    public static final String ENV_AUTH_URL = "OS_AUTH_URL";
    public static final String ENV_CREDENTIAL_ID = "OS_APPLICATION_CREDENTIAL_ID";
    public static final String ENV_CREDENTIAL_SECRET = "OS_APPLICATION_CREDENTIAL_SECRET";
    public static final String ENV_REGION = "OS_REGION_NAME";

    @Getter private final String authUrl;
    @Getter private final String applicationCredentialId;
    @Getter private final String applicationCredentialSecret;
    /** Optional; narrows the object-store endpoint picked from the catalog. */
    @Getter private final String region;

    public static SwiftCredentials fromEnvironment(Map<String, String> env) {
        return new SwiftCredentials(env.get(ENV_AUTH_URL), env.get(ENV_CREDENTIAL_ID),
                env.get(ENV_CREDENTIAL_SECRET), env.get(ENV_REGION));
    }

    public boolean isComplete() {
        return authUrl != null && applicationCredentialId != null && applicationCredentialSecret != null;
    }

    @Override
    public String toString() {
        return "SwiftCredentials{authUrl='" + authUrl + "', applicationCredentialId='" + applicationCredentialId + "'}";
    }
}
