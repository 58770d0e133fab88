package org.cobbzilla.s3fetch;

import org.apache.commons.lang3.StringUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.*;

public class DecompressSweepTest {

    @Rule public TemporaryFolder temp = new TemporaryFolder();

    private Path root;
    private FetchStats stats;

    @Before
    public void setUp() throws Exception {
        root = temp.newFolder("mirror").toPath();
        stats = new FetchStats();
    }

    private DecompressSweep sweep() {
        return new DecompressSweep(FetchOptions.DEFAULT_SUFFIX, stats, true);
    }

    private Path write(String relative, byte[] data) throws IOException {
        final Path path = root.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.write(path, data);
        return path;
    }

    private String read(String relative) throws IOException {
        return new String(Files.readAllBytes(root.resolve(relative)), UTF_8);
    }

    private List<String> tree() throws IOException {
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(Files::isRegularFile).map(p -> root.relativize(p).toString().replace('\\', '/'))
                    .sorted().collect(Collectors.toList());
        }
    }

    @Test
    public void testDecompressesAndRemovesOriginals() throws Exception {
        final TestObject x = TestObject.create("a/x.json.gz", 4096);
        final TestObject y = TestObject.create("a/b/y.json.gz", 100);
        write(x.key, x.compressed);
        write(y.key, y.compressed);

        final List<DecompressOutcome> outcomes = sweep().sweep(root);

        assertEquals(2, outcomes.size());
        for (DecompressOutcome outcome : outcomes) {
            assertEquals(DecompressOutcome.Status.DECOMPRESSED, outcome.getStatus());
            assertNull(outcome.getError());
        }
        assertEquals(x.data, read("a/x.json"));
        assertEquals(y.data, read("a/b/y.json"));
        assertFalse(Files.exists(root.resolve(x.key)));
        assertFalse(Files.exists(root.resolve(y.key)));
        assertEquals(2, stats.filesDecompressed.get());
    }

    @Test
    public void testLongLastSegment() throws Exception {
        final String name = StringUtils.repeat('x', 240);
        final TestObject x = TestObject.create("a/" + name + ".json.gz", 512);
        write(x.key, x.compressed);

        final List<DecompressOutcome> outcomes = sweep().sweep(root);

        assertEquals(1, outcomes.size());
        assertEquals(String.valueOf(outcomes.get(0).getError()), DecompressOutcome.Status.DECOMPRESSED, outcomes.get(0).getStatus());
        assertEquals(Arrays.asList("a/" + name + ".json"), tree());
        assertEquals(x.data, read("a/" + name + ".json"));
    }

    @Test
    public void testSecondSweepIsNoop() throws Exception {
        final TestObject x = TestObject.create("a/x.json.gz", 1000);
        write(x.key, x.compressed);
        sweep().sweep(root);
        final List<String> before = tree();

        final List<DecompressOutcome> outcomes = sweep().sweep(root);

        assertTrue(outcomes.isEmpty());
        assertEquals(before, tree());
        assertEquals(x.data, read("a/x.json"));
    }

    @Test
    public void testTruncatedFileIsLeftAlone() throws Exception {
        final TestObject good = TestObject.create("d/good.json.gz", 2000);
        final TestObject bad = TestObject.create("d/bad.json.gz", 20000);
        write(good.key, good.compressed);
        write(bad.key, bad.truncated());

        final List<DecompressOutcome> outcomes = sweep().sweep(root);

        assertEquals(2, outcomes.size());
        final DecompressOutcome badOutcome = outcomes.get(0);
        assertEquals(root.resolve(bad.key), badOutcome.getSource());
        assertEquals(DecompressOutcome.Status.FAILED, badOutcome.getStatus());
        assertNotNull(badOutcome.getError());
        assertEquals(DecompressOutcome.Status.DECOMPRESSED, outcomes.get(1).getStatus());

        assertArrayEquals(bad.truncated(), Files.readAllBytes(root.resolve(bad.key)));
        assertFalse(Files.exists(root.resolve("d/bad.json")));
        assertEquals(good.data, read("d/good.json"));
        assertEquals(1, stats.decompressErrors.get());
        assertEquals(Arrays.asList("d/bad.json.gz", "d/good.json"), tree());
    }

    @Test
    public void testNotCompressedAtAll() throws Exception {
        write("n/plain.json.gz", "{\"not\":\"gzip\"}".getBytes(UTF_8));

        final List<DecompressOutcome> outcomes = sweep().sweep(root);

        assertEquals(DecompressOutcome.Status.FAILED, outcomes.get(0).getStatus());
        assertEquals(Arrays.asList("n/plain.json.gz"), tree());
    }

    @Test
    public void testNonMatchingFilesUntouched() throws Exception {
        final byte[] gz = TestObject.gzip("zzz".getBytes(UTF_8));
        write("a/z.txt", "text".getBytes(UTF_8));
        write("a/archive.gz", gz);
        write("a/x.json", "already".getBytes(UTF_8));
        Files.createDirectories(root.resolve("empty/dir.json.gz"));

        final List<DecompressOutcome> outcomes = sweep().sweep(root);

        assertTrue(outcomes.isEmpty());
        assertEquals("text", read("a/z.txt"));
        assertArrayEquals(gz, Files.readAllBytes(root.resolve("a/archive.gz")));
        assertEquals("already", read("a/x.json"));
        assertTrue(Files.isDirectory(root.resolve("empty/dir.json.gz")));
    }

    @Test
    public void testDeleteFailureKeepsBothAndNextSweepFinishes() throws Exception {
        final TestObject x = TestObject.create("a/x.json.gz", 300);
        write(x.key, x.compressed);
        final DecompressSweep stubborn = new DecompressSweep(FetchOptions.DEFAULT_SUFFIX, stats, false) {
            @Override
            protected void deleteOriginal(Path source) throws IOException {
                throw new IOException("Simulated delete failure for " + source);
            }
        };

        final List<DecompressOutcome> first = stubborn.sweep(root);

        assertEquals(DecompressOutcome.Status.DELETE_FAILED, first.get(0).getStatus());
        assertTrue(first.get(0).isDecompressed());
        assertTrue(Files.exists(root.resolve(x.key)));
        assertEquals(x.data, read("a/x.json"));
        assertEquals(1, stats.deleteErrors.get());

        Files.write(root.resolve("a/x.json"), "stale".getBytes(UTF_8));
        final List<DecompressOutcome> second = sweep().sweep(root);

        assertEquals(DecompressOutcome.Status.DECOMPRESSED, second.get(0).getStatus());
        assertEquals(x.data, read("a/x.json"));
        assertEquals(Arrays.asList("a/x.json"), tree());
    }

    @Test
    public void testMissingRoot() throws Exception {
        assertTrue(sweep().sweep(root.resolve("does-not-exist")).isEmpty());
    }

    @Test
    public void testTargetNames() throws Exception {
        assertEquals(".gz", DecompressSweep.compressionExtension(".json.gz"));
        assertEquals(".gz", DecompressSweep.compressionExtension("json.gz"));
        assertEquals(".gz", DecompressSweep.compressionExtension(".gz"));
        assertEquals("gz", DecompressSweep.compressionExtension("gz"));

        assertEquals(root.resolve("a/x.json"), sweep().targetFor(root.resolve("a/x.json.gz")));
        assertEquals(root.resolve("a/x.csv"),
                new DecompressSweep(".csv.gz", stats, false).targetFor(root.resolve("a/x.csv.gz")));
    }
}
