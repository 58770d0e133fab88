package org.cobbzilla.s3fetch;

import com.amazonaws.services.s3.model.S3ObjectSummary;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Date;

/**
 * A listed key with the size and modification time the listing reported for it.
 */
@AllArgsConstructor @ToString
public class KeyObjectSummary {

    public static final long UNKNOWN_SIZE = -1;

    @Getter private final String key;
    @Getter private final long size;
    @Getter private final Date lastModified;

    public static KeyObjectSummary of(S3ObjectSummary input) {
        return new KeyObjectSummary(input.getKey(), input.getSize(), input.getLastModified());
    }

    public static KeyObjectSummary of(String key) {
        return new KeyObjectSummary(key, UNKNOWN_SIZE, null);
    }

    public boolean hasSize() { return size != UNKNOWN_SIZE; }

    public boolean isOlderThan(long cutoff) {
        return lastModified != null && lastModified.getTime() < cutoff;
    }
}
