package org.cobbzilla.s3fetch;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Replaces every compressed file below a directory with its decompressed sibling.
 * <p>
 * The tree is snapshotted before anything is touched, then each matching file is inflated into a
 * temporary file that is moved onto the target name. The original is removed only after the move
 * succeeded. A file that cannot be decompressed is left as it is; a leftover original whose delete
 * failed is decompressed again on the next sweep and its target replaced.
 */
@Slf4j
public class DecompressSweep {

    private static final int BUFFER_SIZE = 64 * 1024;

    private final String suffix;
    private final String compressionExtension;
    private final FetchStats stats;
    private final boolean verbose;

    public DecompressSweep(String suffix, FetchStats stats, boolean verbose) {
        this.suffix = suffix;
        this.compressionExtension = compressionExtension(suffix);
        this.stats = stats;
        this.verbose = verbose;
    }

    public DecompressSweep(FetchContext context) {
        this(context.getOptions().getSuffix(), context.getStats(), context.getOptions().isVerbose());
    }

    /**
     * The part of the suffix that names the compression, e.g. ".gz" for ".json.gz".
     */
    static String compressionExtension(String suffix) {
        final int dot = suffix.lastIndexOf('.');
        return dot <= 0 ? suffix : suffix.substring(dot);
    }

    public Path targetFor(Path source) {
        final String name = source.getFileName().toString();
        return source.resolveSibling(name.substring(0, name.length() - compressionExtension.length()));
    }

    public List<DecompressOutcome> sweep(Path root) {
        final List<Path> snapshot = snapshot(root);
        if (verbose) log.info("Found {} compressed files below {}.", snapshot.size(), root);

        final List<DecompressOutcome> outcomes = new ArrayList<DecompressOutcome>(snapshot.size());
        for (Path source : snapshot) {
            outcomes.add(decompress(source));
        }
        return outcomes;
    }

    List<Path> snapshot(Path root) {
        if (!Files.isDirectory(root)) {
            log.warn("{} is not a directory, nothing to decompress.", root);
            return Collections.emptyList();
        }
        final List<Path> matches = new ArrayList<Path>();
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    final String name = file.getFileName().toString();
                    if (attrs.isRegularFile() && name.endsWith(suffix) && name.length() > compressionExtension.length()) {
                        matches.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.error("Cannot visit {}, skipping it.", file, e);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.error("Error walking {}.", root, e);
        }
        Collections.sort(matches);
        return matches;
    }

    public DecompressOutcome decompress(Path source) {
        final Path target = targetFor(source);
        Path part = null;
        try {
            part = KeyFetchJob.createPartFile(source.getParent());
            try (InputStream raw = Files.newInputStream(source);
                 InputStream in = new GZIPInputStream(raw, BUFFER_SIZE);
                 OutputStream out = Files.newOutputStream(part)) {
                IOUtils.copyLarge(in, out);
            }
            move(part, target);
            part = null;

        } catch (IOException e) {
            stats.decompressErrors.incrementAndGet();
            log.error("Error decompressing {}, leaving it in place.", source, e);
            deletePart(part);
            return new DecompressOutcome(source, target, DecompressOutcome.Status.FAILED, e);
        }

        try {
            deleteOriginal(source);
        } catch (IOException e) {
            stats.deleteErrors.incrementAndGet();
            log.warn("Decompressed {} to {} but could not remove the original.", source, target, e);
            return new DecompressOutcome(source, target, DecompressOutcome.Status.DELETE_FAILED, e);
        }

        stats.filesDecompressed.incrementAndGet();
        if (verbose) log.info("Decompressed {} to {}.", source, target);
        return new DecompressOutcome(source, target, DecompressOutcome.Status.DECOMPRESSED, null);
    }

    protected void deleteOriginal(Path source) throws IOException {
        Files.delete(source);
    }

    private static void move(Path part, Path target) throws IOException {
        try {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deletePart(Path part) {
        if (part == null) return;
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}.", part, e);
        }
    }
}
