package org.cobbzilla.s3fetch;

import com.amazonaws.SdkClientException;
import com.amazonaws.services.s3.AmazonS3;
import com.amazonaws.services.s3.model.ListObjectsRequest;
import com.amazonaws.services.s3.model.ObjectListing;
import com.amazonaws.services.s3.model.S3ObjectSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Walks the virtual directory tree below a prefix, depth first, using delimited listings.
 * Common prefixes are pushed onto a frontier instead of being recursed into, so deep or wide
 * trees do not grow the call stack. Leaf keys ending with the configured suffix are collected.
 */
@Slf4j
public class KeyPrefixLister {

    static final String NO_ENCODING_TYPE = "none";

    private final FetchContext context;
    private final AmazonS3 client;
    private final String bucket;

    public KeyPrefixLister(FetchContext context) {
        this.context = context;
        this.client = context.getClient();
        this.bucket = context.getOptions().getBucket();
    }

    public KeyListing list(String prefix) {
        final FetchOptions options = context.getOptions();
        final boolean verbose = options.isVerbose();

        final KeyListing result = new KeyListing();
        final Deque<String> frontier = new ArrayDeque<String>();
        frontier.push(prefix == null ? "" : prefix);

        while (!frontier.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Interrupted while listing {}, {} prefixes left unexplored.", bucket, frontier.size());
                for (String unexplored : frontier) result.addFailedPrefix(unexplored);
                break;
            }
            final String current = frontier.pop();
            try {
                listPrefix(current, frontier, result);
            } catch (SdkClientException e) {
                context.getStats().listingErrors.incrementAndGet();
                result.addFailedPrefix(current);
                log.error("Error listing {}/{}, skipping its subtree.", bucket, current, e);
            }
        }

        if (verbose) log.info("Found {} keys below {}/{} ({} prefixes failed).",
                result.size(), bucket, prefix, result.getFailedPrefixes().size());
        return result;
    }

    private void listPrefix(String prefix, Deque<String> frontier, KeyListing result) {
        final FetchOptions options = context.getOptions();
        final boolean verbose = options.isVerbose();

        final ListObjectsRequest request = new ListObjectsRequest()
                .withBucketName(bucket)
                .withPrefix(prefix)
                .withDelimiter(FetchOptions.DELIMITER)
                .withMaxKeys(options.getMaxKeys());
        if (options.getProfile().hasOption(FetchProfileOptions.NO_ENCODING_TYPE))
            request.setEncodingType(NO_ENCODING_TYPE);

        context.getStats().s3listCount.incrementAndGet();
        ObjectListing listing = client.listObjects(request);
        int pages = 1;
        while (true) {
            final List<String> commonPrefixes = listing.getCommonPrefixes();
            // pushed in reverse so they are popped in listing order
            for (int i = commonPrefixes.size() - 1; i >= 0; i--) {
                frontier.push(commonPrefixes.get(i));
            }
            for (S3ObjectSummary s3Summary : listing.getObjectSummaries()) {
                final KeyObjectSummary summary = KeyObjectSummary.of(s3Summary);
                if (accept(summary)) {
                    result.add(summary);
                    context.getStats().objectsFound.incrementAndGet();
                    if (verbose) log.info("Found {}.", summary.getKey());
                }
            }
            if (!listing.isTruncated()) break;

            context.getStats().s3listCount.incrementAndGet();
            listing = client.listNextBatchOfObjects(listing);
            pages++;
        }
        if (verbose) log.info("Listed {} in {} page(s).", prefix, pages);
    }

    private boolean accept(KeyObjectSummary summary) {
        final FetchOptions options = context.getOptions();
        if (!summary.getKey().endsWith(options.getSuffix())) return false;

        if (options.hasCtime() && summary.isOlderThan(options.getMaxAge())) {
            if (options.isVerbose()) log.info("Key {} (last modified {}) is older than {} (cutoff {}), not fetching.",
                    summary.getKey(), summary.getLastModified(), options.getCtime(), options.getMaxAgeDate());
            return false;
        }
        return true;
    }
}
