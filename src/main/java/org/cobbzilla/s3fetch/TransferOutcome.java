package org.cobbzilla.s3fetch;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

@AllArgsConstructor @ToString
public class TransferOutcome {

    public enum Status { FETCHED, FAILED, SKIPPED }

    @Getter private final String key;
    @Getter private final Path path;
    @Getter private final Status status;
    @Getter private final long bytes;
    @Getter private final Exception error;

    public static TransferOutcome fetched(String key, Path path, long bytes) {
        return new TransferOutcome(key, path, Status.FETCHED, bytes, null);
    }

    public static TransferOutcome failed(String key, Path path, Exception error) {
        return new TransferOutcome(key, path, Status.FAILED, 0, error);
    }

    public static TransferOutcome skipped(String key, Path path) {
        return new TransferOutcome(key, path, Status.SKIPPED, 0, null);
    }

    public boolean isFetched() { return status == Status.FETCHED; }
    public boolean isFailed() { return status == Status.FAILED; }
}
