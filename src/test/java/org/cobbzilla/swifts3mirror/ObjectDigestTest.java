package org.cobbzilla.swifts3mirror;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.file.Files;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.*;

public class ObjectDigestTest {

    @Rule public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testDigestOfKnownContent() throws Exception {
        final File file = folder.newFile("hello.txt");
        Files.write(file.toPath(), "hello".getBytes(UTF_8));
        assertEquals("5d41402abc4b2a76b9719d911017c592", ObjectDigest.localDigest(file.toPath()));
    }

    @Test
    public void testDigestOfEmptyFile() throws Exception {
        final File file = folder.newFile("empty");
        assertEquals("d41d8cd98f00b204e9800998ecf8427e", ObjectDigest.localDigest(file.toPath()));
    }

    @Test
    public void testDigestSpanningSeveralChunks() throws Exception {
        final byte[] data = new byte[ObjectDigest.CHUNK_SIZE * 3 + 17];
        for (int i = 0; i < data.length; i++) data[i] = (byte) (i % 251);
        final File file = folder.newFile("large.bin");
        Files.write(file.toPath(), data);
        assertEquals(InMemoryDestinationStore.md5Hex(data), ObjectDigest.localDigest(file.toPath()));
    }

    @Test
    public void testAbsentRemoteNeedsUpload() {
        assertEquals(DigestComparison.NEEDS_UPLOAD, ObjectDigest.decide("5d41402abc4b2a76b9719d911017c592", null));
    }

    @Test
    public void testQuotedEqualETagIsUpToDate() {
        assertEquals(DigestComparison.UP_TO_DATE,
                ObjectDigest.decide("5d41402abc4b2a76b9719d911017c592", "\"5d41402abc4b2a76b9719d911017c592\""));
        assertEquals(DigestComparison.UP_TO_DATE,
                ObjectDigest.decide("5d41402abc4b2a76b9719d911017c592", "5D41402ABC4B2A76B9719D911017C592"));
    }

    @Test
    public void testDifferentETagNeedsUpload() {
        assertEquals(DigestComparison.NEEDS_UPLOAD,
                ObjectDigest.decide("5d41402abc4b2a76b9719d911017c592", "\"d41d8cd98f00b204e9800998ecf8427e\""));
    }

    @Test
    public void testMultipartETagNeedsUpload() {
        assertEquals(DigestComparison.NEEDS_UPLOAD,
                ObjectDigest.decide("5d41402abc4b2a76b9719d911017c592", "\"5d41402abc4b2a76b9719d911017c592-2\""));
    }
}
