package org.cobbzilla.s3fetch;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
public class FetchStats {

    private final Thread shutdownHook = new Thread(this::logStats, "s3fetch-stats");
    public Thread getShutdownHook() { return shutdownHook; }

    private final long start = System.currentTimeMillis();

    public final AtomicLong objectsFound = new AtomicLong(0);
    public final AtomicLong listingErrors = new AtomicLong(0);
    public final AtomicLong objectsFetched = new AtomicLong(0);
    public final AtomicLong fetchErrors = new AtomicLong(0);
    public final AtomicLong bytesFetched = new AtomicLong(0);
    public final AtomicLong filesDecompressed = new AtomicLong(0);
    public final AtomicLong decompressErrors = new AtomicLong(0);
    public final AtomicLong deleteErrors = new AtomicLong(0);

    public final AtomicLong s3listCount = new AtomicLong(0);
    public final AtomicLong s3getCount = new AtomicLong(0);
    public final AtomicLong s3putCount = new AtomicLong(0);

    public void logStats() {
        log.info("STATS BEGIN\n" + toString() + "STATS END");
    }

    @Override
    public String toString() {
        final long durationMillis = System.currentTimeMillis() - start;
        final double durationMinutes = durationMillis / 60000.0d;
        final String duration = String.format("%.2f", durationMillis / 1000.0d) + " seconds";
        final double rate = durationMinutes == 0 ? 0 : objectsFetched.get() / durationMinutes;
        return "found: " + objectsFound + "\n"
                + "fetched: " + objectsFetched + "\n"
                + "fetch errors: " + fetchErrors + "\n"
                + "listing errors: " + listingErrors + "\n"
                + "decompressed: " + filesDecompressed + "\n"
                + "decompress errors: " + decompressErrors + "\n"
                + "delete errors: " + deleteErrors + "\n"
                + "duration: " + duration + "\n"
                + "fetch rate: " + String.format("%.2f", rate) + " objects/minute\n"
                + "bytes fetched: " + formatBytes(bytesFetched.get()) + "\n"
                + "LIST operations: " + s3listCount + "\n"
                + "GET operations: " + s3getCount + "\n"
                + "PUT operations: " + s3putCount + "\n";
    }

    private static final long KB = 1024;
    private static final long MB = KB * 1024;
    private static final long GB = MB * 1024;

    static String formatBytes(long bytes) {
        if (bytes >= GB) return String.format("%.2f GB", (double) bytes / GB);
        if (bytes >= MB) return String.format("%.2f MB", (double) bytes / MB);
        if (bytes >= KB) return String.format("%.2f KB", (double) bytes / KB);
        return bytes + " bytes";
    }
}
