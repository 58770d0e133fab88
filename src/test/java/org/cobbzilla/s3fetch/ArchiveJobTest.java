package org.cobbzilla.s3fetch;

import org.apache.commons.io.IOUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.*;

public class ArchiveJobTest {

    private static final String BUCKET = "archive-bucket";

    @Rule public TemporaryFolder temp = new TemporaryFolder();

    private static Map<String, String> unzip(byte[] zip) throws Exception {
        final Map<String, String> entries = new TreeMap<String, String>();
        try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(zip))) {
            ZipEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                entries.put(entry.getName(), IOUtils.toString(in, UTF_8));
            }
        }
        return entries;
    }

    @Test
    public void testArchiveUploadsZipOfTree() throws Exception {
        final Path root = temp.newFolder("mirror").toPath();
        Files.createDirectories(root.resolve("a/b"));
        Files.write(root.resolve("a/x.json"), "{\"x\":1}".getBytes(UTF_8));
        Files.write(root.resolve("a/b/y.json"), "{\"y\":2}".getBytes(UTF_8));
        Files.write(root.resolve("a/b/y.json.gz123.part"), "partial".getBytes(UTF_8));
        final InMemoryS3 s3 = new InMemoryS3(BUCKET);
        final FetchContext context = new FetchContext(TestObject.options(BUCKET, root.toString()), s3);

        final int entries = new ArchiveJob(context).archive(root, "new_folder/archive.zip");

        assertEquals(2, entries);
        assertEquals(1, context.getStats().s3putCount.get());
        final Map<String, String> unzipped = unzip(s3.get("new_folder/archive.zip"));
        assertEquals(2, unzipped.size());
        assertEquals("{\"x\":1}", unzipped.get("a/x.json"));
        assertEquals("{\"y\":2}", unzipped.get("a/b/y.json"));
    }

    @Test
    public void testUploadFailurePropagates() throws Exception {
        final Path root = temp.newFolder("mirror").toPath();
        Files.write(root.resolve("x.json"), "{}".getBytes(UTF_8));
        final FetchContext context = new FetchContext(TestObject.options("some-other-bucket", root.toString()),
                new InMemoryS3(BUCKET));

        try {
            new ArchiveJob(context).archive(root, "archive.zip");
            fail("expected the upload to fail");
        } catch (com.amazonaws.services.s3.model.AmazonS3Exception e) {
            assertEquals(404, e.getStatusCode());
        }
    }

    @Test
    public void testEntryNames() throws Exception {
        final Path root = temp.getRoot().toPath();
        assertEquals("a/b/c.json", ArchiveJob.entryName(root, root.resolve("a").resolve("b").resolve("c.json")));
    }
}
