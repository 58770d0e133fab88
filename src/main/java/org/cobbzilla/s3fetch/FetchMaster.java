package org.cobbzilla.s3fetch;

import com.amazonaws.SdkClientException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs the three phases one after the other: list the keys, fetch them, decompress the local tree.
 * An archive of the result is uploaded afterwards when an archive key was given.
 */
@Slf4j
public class FetchMaster {

    private final FetchContext context;

    public FetchMaster(FetchContext context) {
        this.context = context;
    }

    public FetchReport fetch() {
        final FetchOptions options = context.getOptions();
        final Path localRoot = options.getLocalRoot();
        final FetchReport report = new FetchReport();

        log.info("Listing {}/{} for keys ending with {}.", options.getBucket(),
                options.hasPrefix() ? options.getPrefix() : "", options.getSuffix());
        final KeyListing listing = new KeyPrefixLister(context).list(options.getPrefix());
        report.setListing(listing);
        if (!listing.isComplete()) {
            log.warn("Listing incomplete, could not list {}.", listing.getFailedPrefixes());
        }

        log.info("Fetching {} keys into {} ({} threads).", listing.size(), localRoot, options.getMaxThreads());
        report.setTransfers(new TransferMaster(context).fetchAll(listing.getSummaries(), localRoot));

        if (options.isDryRun()) {
            logSummary(report);
            return report;
        }

        if (!options.isNoDecompress()) {
            log.info("Decompressing files below {}.", localRoot);
            report.setDecompressions(new DecompressSweep(context).sweep(localRoot));
        }

        if (options.hasArchiveKey()) {
            try {
                report.setArchivedFiles(new ArchiveJob(context).archive(localRoot, options.getArchiveKey()));
            } catch (IOException | SdkClientException e) {
                log.error("Error archiving {} to {}/{}.", localRoot, options.getBucket(), options.getArchiveKey(), e);
                report.setArchiveError(e);
            }
        }

        logSummary(report);
        return report;
    }

    private void logSummary(FetchReport report) {
        log.info("Done: {} keys listed ({} prefixes failed), {} fetched, {} failed, {} skipped, "
                        + "{} decompressed, {} not decompressed, {} originals left behind{}.",
                report.getListing().size(),
                report.getListing().getFailedPrefixes().size(),
                report.countTransfers(TransferOutcome.Status.FETCHED),
                report.countTransfers(TransferOutcome.Status.FAILED),
                report.countTransfers(TransferOutcome.Status.SKIPPED),
                report.countDecompressions(DecompressOutcome.Status.DECOMPRESSED),
                report.countDecompressions(DecompressOutcome.Status.FAILED),
                report.countDecompressions(DecompressOutcome.Status.DELETE_FAILED),
                report.isArchived() ? ", archived " + report.getArchivedFiles() + " files" : "");
        if (report.hasFailures()) log.warn("Some items failed, see the errors above.");
    }
}
