package org.cobbzilla.s3fetch;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;

@AllArgsConstructor @ToString
public class DecompressOutcome {

    public enum Status {
        /** target written, original removed */
        DECOMPRESSED,
        /** original left untouched, no target written */
        FAILED,
        /** target written, original could not be removed */
        DELETE_FAILED
    }

    @Getter private final Path source;
    @Getter private final Path target;
    @Getter private final Status status;
    @Getter private final Exception error;

    public boolean isDecompressed() { return status != Status.FAILED; }
}
