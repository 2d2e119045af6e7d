package org.cobbzilla.swifts3mirror;

import com.amazonaws.util.BinaryUtils;
import com.amazonaws.util.IOUtils;
import com.amazonaws.util.Md5Utils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicInteger;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * An S3 bucket held in memory. Failures can be injected per key, and views bound to expired
 * credentials reject every call with {@link CredentialsExpiredException}.
 */
class InMemoryDestinationStore implements DestinationStore {

    final String bucket;
    final int pageSize;
    final NavigableMap<String, byte[]> objects = new ConcurrentSkipListMap<String, byte[]>();

    /** Remaining number of failing upload calls per key; Integer.MAX_VALUE fails forever. */
    final Map<String, AtomicInteger> uploadFailures = new ConcurrentHashMap<String, AtomicInteger>();
    final Set<String> probeFailures = ConcurrentHashMap.newKeySet();
    final Set<MirrorCredentials> expiredCredentials = ConcurrentHashMap.newKeySet();

    final AtomicInteger uploadCalls = new AtomicInteger();
    final AtomicInteger markerCalls = new AtomicInteger();
    final AtomicInteger probeCalls = new AtomicInteger();
    final AtomicInteger listCalls = new AtomicInteger();

    volatile boolean bucketExists = true;

    InMemoryDestinationStore(String bucket, int pageSize) {
        this.bucket = bucket;
        this.pageSize = pageSize;
    }

    InMemoryDestinationStore put(String key, String data) {
        objects.put(key, data.getBytes(UTF_8));
        return this;
    }

    void failUploads(String key, int times) {
        uploadFailures.put(key, new AtomicInteger(times));
    }

    String content(String key) {
        final byte[] data = objects.get(key);
        return data == null ? null : new String(data, UTF_8);
    }

    static String md5Hex(byte[] data) {
        return BinaryUtils.toHex(Md5Utils.computeMD5Hash(data));
    }

    static String md5Hex(String data) {
        return md5Hex(data.getBytes(UTF_8));
    }

    DestinationStore withCredentials(MirrorCredentials credentials) {
        return new CredentialBoundView(credentials);
    }

    @Override
    public boolean bucketExists(String bucket) {
        return bucketExists && this.bucket.equals(bucket);
    }

    @Override
    public KeyListing listObjects(String bucket, String continuationToken) {
        listCalls.incrementAndGet();
        if (!bucketExists(bucket)) throw new StoreException("NoSuchBucket " + bucket);

        final NavigableMap<String, byte[]> tail = continuationToken == null ? objects : objects.tailMap(continuationToken, false);
        final List<KeyObjectSummary> page = new ArrayList<KeyObjectSummary>();
        String lastKey = null;
        boolean truncated = false;
        for (Map.Entry<String, byte[]> entry : tail.entrySet()) {
            if (page.size() == pageSize) {
                truncated = true;
                break;
            }
            page.add(new KeyObjectSummary(entry.getKey(), md5Hex(entry.getValue()), entry.getValue().length));
            lastKey = entry.getKey();
        }
        return new KeyListing(page, truncated ? lastKey : null);
    }

    @Override
    public String getObjectETag(String bucket, String key) throws ObjectNotFoundException {
        probeCalls.incrementAndGet();
        if (probeFailures.contains(key)) throw new StoreException("Simulated 500 on HEAD " + key);
        final byte[] data = objects.get(key);
        if (data == null) throw new ObjectNotFoundException(bucket, key);
        return "\"" + md5Hex(data) + "\"";
    }

    @Override
    public void upload(String bucket, String key, Path file, BandwidthThrottle throttle) {
        uploadCalls.incrementAndGet();
        failIfScheduled(key);
        try (InputStream in = throttle.throttle(Files.newInputStream(file))) {
            objects.put(key, IOUtils.toByteArray(in));
        } catch (IOException e) {
            throw new StoreException("Could not read " + file, e);
        }
    }

    @Override
    public void createMarker(String bucket, String key) {
        markerCalls.incrementAndGet();
        failIfScheduled(key);
        objects.put(key, new byte[0]);
    }

    private void failIfScheduled(String key) {
        final AtomicInteger remaining = uploadFailures.get(key);
        if (remaining != null && remaining.getAndDecrement() > 0) {
            throw new StoreException("Simulated upload failure for " + key);
        }
    }

    private class CredentialBoundView implements DestinationStore {

        private final MirrorCredentials credentials;

        CredentialBoundView(MirrorCredentials credentials) {
            this.credentials = credentials;
        }

        private void check() {
            if (expiredCredentials.contains(credentials)) {
                throw new CredentialsExpiredException("ExpiredToken for " + credentials.getAWSAccessKeyId(), null);
            }
        }

        @Override
        public boolean bucketExists(String bucket) {
            check();
            return InMemoryDestinationStore.this.bucketExists(bucket);
        }

        @Override
        public KeyListing listObjects(String bucket, String continuationToken) {
            check();
            return InMemoryDestinationStore.this.listObjects(bucket, continuationToken);
        }

        @Override
        public String getObjectETag(String bucket, String key) throws ObjectNotFoundException {
            check();
            return InMemoryDestinationStore.this.getObjectETag(bucket, key);
        }

        @Override
        public void upload(String bucket, String key, Path file, BandwidthThrottle throttle) {
            check();
            InMemoryDestinationStore.this.upload(bucket, key, file, throttle);
        }

        @Override
        public void createMarker(String bucket, String key) {
            check();
            InMemoryDestinationStore.this.createMarker(bucket, key);
        }
    }
}
