package org.cobbzilla.swifts3mirror;

import com.amazonaws.util.BinaryUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Decides whether a staged object differs from its destination copy. S3 reports the MD5 of the
 * content as ETag for single-request uploads, so that is the digest computed locally.
 */
public class ObjectDigest {

    public static final String ALGORITHM = "MD5";
    public static final int CHUNK_SIZE = 4096;

    /**
     * Streams the file in {@link #CHUNK_SIZE} chunks.
     *
     * @return lowercase hex MD5 of the file content
     */
    public static String localDigest(Path path) throws IOException {
        final MessageDigest digester = newDigester();
        final byte[] buffer = new byte[CHUNK_SIZE];
        try (InputStream in = Files.newInputStream(path)) {
            int numRead;
            while ((numRead = in.read(buffer)) != -1) {
                digester.update(buffer, 0, numRead);
            }
        }
        return BinaryUtils.toHex(digester.digest());
    }

    /**
     * Multipart ETags ({@code <hex>-<parts>}) never equal a plain MD5 and therefore always
     * lead to a re-upload.
     *
     * @param remoteETag null when the destination has no object for the key
     */
    public static DigestComparison decide(String localDigest, String remoteETag) {
        if (remoteETag == null) return DigestComparison.NEEDS_UPLOAD;
        return normalizeETag(remoteETag).equalsIgnoreCase(localDigest)
                ? DigestComparison.UP_TO_DATE
                : DigestComparison.NEEDS_UPLOAD;
    }

    static String normalizeETag(String eTag) {
        String value = eTag.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            value = value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static MessageDigest newDigester() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
