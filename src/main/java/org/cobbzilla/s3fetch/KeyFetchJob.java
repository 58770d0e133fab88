package org.cobbzilla.s3fetch;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.model.GetObjectRequest;
import com.amazonaws.services.s3.model.S3Object;
import com.amazonaws.services.s3.model.S3ObjectInputStream;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.Callable;

/**
 * Fetches a single key into the local mirror. The object is streamed into a temporary file next to
 * its destination and moved into place once complete, so a failed fetch leaves nothing behind.
 * A download whose length differs from the size the listing reported is treated as failed.
 */
@Slf4j
public class KeyFetchJob implements Callable<TransferOutcome> {

    static final String PART_SUFFIX = ".part";
    // short and fixed, so a destination name close to the file system limit still gets a temp file
    static final String PART_PREFIX = ".s3fetch-";

    private final FetchContext context;
    private final KeyObjectSummary summary;
    private final String key;
    private final Path localRoot;
    private final Object notifyLock;

    public KeyFetchJob(FetchContext context, KeyObjectSummary summary, Path localRoot, Object notifyLock) {
        this.context = context;
        this.summary = summary;
        this.key = summary.getKey();
        this.localRoot = localRoot;
        this.notifyLock = notifyLock;
    }

    @Override public String toString() { return key; }

    /**
     * Maps a key onto the local root, one directory level per path segment.
     *
     * @throws IllegalArgumentException if the key would resolve outside of the local root
     */
    public static Path resolveLocalPath(Path localRoot, String key) {
        final Path root = localRoot.toAbsolutePath().normalize();
        String relative = key;
        while (relative.startsWith(FetchOptions.DELIMITER)) relative = relative.substring(1);
        if (relative.isEmpty()) throw new IllegalArgumentException("Key "+key+" does not name a file");

        final Path path = root.resolve(relative).normalize();
        if (!path.startsWith(root) || path.equals(root)) {
            throw new IllegalArgumentException("Key "+key+" resolves outside of "+root);
        }
        return path;
    }

    @Override
    public TransferOutcome call() {
        final FetchOptions options = context.getOptions();
        final FetchStats stats = context.getStats();
        Path destination = null;
        try {
            destination = resolveLocalPath(localRoot, key);

            if (options.isDryRun()) {
                log.info("Would have fetched {} to {}.", key, destination);
                return TransferOutcome.skipped(key, destination);
            }

            final long bytes = fetch(destination);
            stats.objectsFetched.incrementAndGet();
            stats.bytesFetched.addAndGet(bytes);
            if (options.isVerbose()) log.info("Fetched {} to {} ({} bytes).", key, destination, bytes);
            return TransferOutcome.fetched(key, destination, bytes);

        } catch (Exception e) {
            stats.fetchErrors.incrementAndGet();
            log.error("Error fetching {} to {}.", key, destination, e);
            return TransferOutcome.failed(key, destination, e);

        } finally {
            synchronized (notifyLock) {
                notifyLock.notifyAll();
            }
        }
    }

    private long fetch(Path destination) throws IOException {
        final FetchOptions options = context.getOptions();
        final Path parent = destination.getParent();
        Files.createDirectories(parent);

        final Path part = createPartFile(parent);
        S3ObjectInputStream objectStream = null;
        boolean moved = false;
        try {
            context.getStats().s3getCount.incrementAndGet();
            final S3Object object = context.getClient().getObject(new GetObjectRequest(options.getBucket(), key));
            objectStream = object.getObjectContent();

            final long bytes;
            try (OutputStream out = Files.newOutputStream(part)) {
                bytes = IOUtils.copyLarge(objectStream, out);
            }
            if (summary.hasSize() && bytes != summary.getSize()) {
                throw new IOException("Fetched "+bytes+" bytes of "+key+", listing reported "+summary.getSize());
            }
            Files.move(part, destination, StandardCopyOption.REPLACE_EXISTING);
            moved = true;
            return bytes;

        } catch (SdkClientException e) {
            throw new IOException("Error reading "+options.getBucket()+"/"+key+": "+e.getMessage(), e);

        } finally {
            if (objectStream != null) closeQuietly(objectStream);
            if (!moved) {
                try {
                    Files.deleteIfExists(part);
                } catch (IOException e) {
                    log.warn("Could not remove partial download {}.", part, e);
                }
            }
        }
    }

    static Path createPartFile(Path directory) throws IOException {
        return Files.createTempFile(directory, PART_PREFIX, PART_SUFFIX);
    }

    private void closeQuietly(S3ObjectInputStream objectStream) {
        try {
            objectStream.close();
        } catch (IOException e) {
            log.warn("Error closing object stream for {}.", key, e);
        }
    }
}
