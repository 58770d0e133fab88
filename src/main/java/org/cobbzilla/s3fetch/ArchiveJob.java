package org.cobbzilla.s3fetch;

import com.amazonaws.services.s3.model.ObjectMetadata;
import com.amazonaws.services.s3.model.PutObjectRequest;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Zips the local mirror and uploads the archive back to the bucket.
 */
@Slf4j
public class ArchiveJob {

    private static final String ZIP_CONTENT_TYPE = "application/zip";

    private final FetchContext context;

    public ArchiveJob(FetchContext context) {
        this.context = context;
    }

    /**
     * @return the number of files in the uploaded archive
     */
    public int archive(Path root, String archiveKey) throws IOException {
        final FetchOptions options = context.getOptions();
        final Path zip = Files.createTempFile("s3fetch-", ".zip");
        try {
            final int entries = zip(root, zip);
            log.info("Zipped {} files from {}, uploading to {}/{}.", entries, root, options.getBucket(), archiveKey);

            final ObjectMetadata metadata = new ObjectMetadata();
            metadata.setContentType(ZIP_CONTENT_TYPE);
            metadata.setContentLength(Files.size(zip));

            context.getStats().s3putCount.incrementAndGet();
            context.getClient().putObject(new PutObjectRequest(options.getBucket(), archiveKey, zip.toFile())
                    .withMetadata(metadata));
            return entries;
        } finally {
            Files.deleteIfExists(zip);
        }
    }

    static int zip(final Path root, Path zip) throws IOException {
        final int[] entries = {0};
        try (OutputStream out = Files.newOutputStream(zip);
             final ZipOutputStream zipOut = new ZipOutputStream(out)) {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    if (!attrs.isRegularFile() || file.getFileName().toString().endsWith(KeyFetchJob.PART_SUFFIX)) {
                        return FileVisitResult.CONTINUE;
                    }
                    zipOut.putNextEntry(new ZipEntry(entryName(root, file)));
                    Files.copy(file, zipOut);
                    zipOut.closeEntry();
                    entries[0]++;
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        return entries[0];
    }

    static String entryName(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), FetchOptions.DELIMITER);
    }
}
