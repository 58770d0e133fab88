package org.cobbzilla.s3fetch;

import lombok.Getter;
import lombok.Setter;

import java.util.Collections;
import java.util.List;

/**
 * Per-item results of one run. Item failures do not fail the run, this is where they show up.
 */
public class FetchReport {

    @Getter @Setter private KeyListing listing;
    @Getter @Setter private List<TransferOutcome> transfers = Collections.emptyList();
    @Getter @Setter private List<DecompressOutcome> decompressions = Collections.emptyList();
    @Getter @Setter private int archivedFiles = -1;
    @Getter @Setter private Exception archiveError;

    public long countTransfers(TransferOutcome.Status status) {
        return transfers.stream().filter(t -> t.getStatus() == status).count();
    }

    public long countDecompressions(DecompressOutcome.Status status) {
        return decompressions.stream().filter(d -> d.getStatus() == status).count();
    }

    public boolean isArchived() { return archivedFiles >= 0; }

    public boolean hasFailures() {
        return (listing != null && !listing.isComplete())
                || countTransfers(TransferOutcome.Status.FAILED) > 0
                || countDecompressions(DecompressOutcome.Status.FAILED) > 0
                || countDecompressions(DecompressOutcome.Status.DELETE_FAILED) > 0
                || archiveError != null;
    }
}
