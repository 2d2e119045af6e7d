package org.cobbzilla.swifts3mirror;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.cobbzilla.swifts3mirror.TestContexts.*;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.*;

public class TransferMasterTest {

    @Rule public TemporaryFolder folder = new TemporaryFolder();

    private InMemorySourceStore source;
    private InMemoryDestinationStore destination;
    private Path stagingRoot;

    @Before
    public void setUp() throws Exception {
        source = new InMemorySourceStore(CONTAINER, 3);
        destination = new InMemoryDestinationStore(BUCKET, 3);
        stagingRoot = folder.newFolder("staging").toPath();
    }

    private TransferSummary transfer(int maxWorkers) {
        final MirrorContext context = context(options(maxWorkers), source, destination, stagingRoot, new RecordingSleeper());
        final List<KeyObjectSummary> keys = new SwiftKeyLister(context, CONTAINER).listAll();
        return new TransferMaster(context).run(keys);
    }

    private long stagedFileCount() throws IOException {
        try (Stream<Path> paths = Files.walk(stagingRoot)) {
            return paths.filter(Files::isRegularFile).count();
        }
    }

    @Test
    public void testMixedContainer() throws Exception {
        source.put("a.txt", "alpha").put("dir/", "").put("b.txt", "bravo");
        destination.put("b.txt", "bravo");

        final TransferSummary summary = transfer(2);

        assertEquals(3, summary.size());
        assertEquals(TransferOutcome.UPLOADED, summary.getOutcome("a.txt"));
        assertEquals(TransferOutcome.MARKER_CREATED, summary.getOutcome("dir/"));
        assertEquals(TransferOutcome.SKIPPED_UP_TO_DATE, summary.getOutcome("b.txt"));
        assertFalse(summary.hasFailures());

        assertEquals("alpha", destination.content("a.txt"));
        assertEquals("", destination.content("dir/"));
        assertEquals(1, destination.uploadCalls.get());
        assertEquals(0, stagedFileCount());
    }

    @Test
    public void testSecondRunUploadsNothing() throws Exception {
        source.put("one", "1").put("two/", "").put("two/three", "3");

        final TransferSummary first = transfer(2);
        assertEquals(2, first.count(TransferOutcome.UPLOADED));
        assertEquals(1, first.count(TransferOutcome.MARKER_CREATED));
        final int uploadsAfterFirstRun = destination.uploadCalls.get();

        final TransferSummary second = transfer(2);
        assertEquals(2, second.count(TransferOutcome.SKIPPED_UP_TO_DATE));
        // markers are always recreated
        assertEquals(1, second.count(TransferOutcome.MARKER_CREATED));
        assertEquals(uploadsAfterFirstRun, destination.uploadCalls.get());
    }

    @Test
    public void testFailingKeyDoesNotStopOthers() throws Exception {
        source.put("good-1", "g1").put("bad", "b").put("good-2", "g2").put("unreadable", "u");
        destination.failUploads("bad", Integer.MAX_VALUE);
        source.failingDownloads.add("unreadable");

        final TransferSummary summary = transfer(3);

        assertEquals(4, summary.size());
        assertEquals(TransferOutcome.UPLOADED, summary.getOutcome("good-1"));
        assertEquals(TransferOutcome.UPLOADED, summary.getOutcome("good-2"));
        assertEquals(TransferOutcome.FAILED, summary.getOutcome("bad"));
        assertEquals(TransferOutcome.FAILED, summary.getOutcome("unreadable"));
        assertTrue(summary.hasFailures());
        assertThat(summary.getFailures().stream().map(TransferResult::getKey).collect(Collectors.toList()),
                contains("bad", "unreadable"));
        assertEquals(0, stagedFileCount());
    }

    @Test
    public void testManyKeysWithSeveralWorkers() throws Exception {
        for (int i = 0; i < 50; i++) {
            source.put("batch/" + i + "/object-" + i, "content of object " + i);
        }

        final TransferSummary summary = transfer(4);

        assertEquals(50, summary.size());
        assertEquals(50, summary.count(TransferOutcome.UPLOADED));
        assertEquals(50, source.totalDownloads());
        for (int i = 0; i < 50; i++) {
            assertEquals("content of object " + i, destination.content("batch/" + i + "/object-" + i));
        }
        assertEquals(0, stagedFileCount());
    }

    @Test
    public void testKeysNormalizingToSamePathKeepTheirContent() throws Exception {
        source.put("a/b", "content of a/b").put("a//b", "content of a//b").put("a/./b", "content of a/./b");

        // a/b is held after its download until a//b has been written to disk as well
        final CountDownLatch otherWritten = new CountDownLatch(1);
        final SourceStore interleaving = new SourceStore() {
            @Override
            public List<KeyObjectSummary> listObjects(String container, String marker) {
                return source.listObjects(container, marker);
            }

            @Override
            public void download(String container, String key, Path target) throws IOException {
                source.download(container, key, target);
                if (key.equals("a//b")) {
                    otherWritten.countDown();
                } else if (key.equals("a/b")) {
                    try {
                        otherWritten.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new InterruptedIOException("interrupted waiting for a//b");
                    }
                }
            }
        };
        final MirrorContext context = context(options(3), interleaving, destination, stagingRoot, new RecordingSleeper());

        final TransferSummary summary = new TransferMaster(context).run(new SwiftKeyLister(context, CONTAINER).listAll());

        assertEquals(3, summary.count(TransferOutcome.UPLOADED));
        assertEquals("content of a/b", destination.content("a/b"));
        assertEquals("content of a//b", destination.content("a//b"));
        assertEquals("content of a/./b", destination.content("a/./b"));
        assertEquals(0, stagedFileCount());
    }

    @Test
    public void testKeyThatIsPrefixOfAnotherKey() throws Exception {
        source.put("a", "file a").put("a/b", "file a/b").put("a/b/c", "file a/b/c");

        final TransferSummary summary = transfer(2);

        assertFalse(summary.hasFailures());
        assertEquals(3, summary.count(TransferOutcome.UPLOADED));
        assertEquals("file a", destination.content("a"));
        assertEquals("file a/b", destination.content("a/b"));
        assertEquals("file a/b/c", destination.content("a/b/c"));
        assertEquals(0, stagedFileCount());
    }

    @Test
    public void testEmptySnapshot() {
        final TransferSummary summary = transfer(2);
        assertEquals(0, summary.size());
        assertEquals(0, destination.uploadCalls.get());
    }
}
