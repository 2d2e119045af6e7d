package org.cobbzilla.swifts3mirror;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

/**
 * AWS credentials for the destination, passed explicitly into client construction.
 */
@AllArgsConstructor @EqualsAndHashCode
public class MirrorCredentials implements AWSCredentials {

    public static final String ENV_ACCESS_KEY_ID = "AWS_ACCESS_KEY_ID";
    public static final String ENV_SECRET_ACCESS_KEY = "AWS_SECRET_ACCESS_KEY";
    public static final String ENV_SESSION_TOKEN = "AWS_SESSION_TOKEN";

    @Getter private final String aWSAccessKeyId;
    @Getter private final String aWSSecretKey;
    @Getter private final String sessionToken;

    public static MirrorCredentials fromEnvironment(Map<String, String> env) {
        return new MirrorCredentials(env.get(ENV_ACCESS_KEY_ID), env.get(ENV_SECRET_ACCESS_KEY), env.get(ENV_SESSION_TOKEN));
    }

    public boolean isComplete() { return StringUtils.isNotBlank(aWSAccessKeyId) && StringUtils.isNotBlank(aWSSecretKey); }

    public boolean hasSessionToken() { return StringUtils.isNotEmpty(sessionToken); }

    public AWSCredentialsProvider toProvider() {
        if (hasSessionToken()) {
            return new AWSStaticCredentialsProvider(new BasicSessionCredentials(aWSAccessKeyId, aWSSecretKey, sessionToken));
        }
        return new AWSStaticCredentialsProvider(new BasicAWSCredentials(aWSAccessKeyId, aWSSecretKey));
    }

    @Override
    public String toString() {
        return "MirrorCredentials{aWSAccessKeyId='" + aWSAccessKeyId + "', sessionToken=" + (hasSessionToken() ? "present" : "absent") + "}";
    }
}
