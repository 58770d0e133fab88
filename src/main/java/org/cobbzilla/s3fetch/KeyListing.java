package org.cobbzilla.s3fetch;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of walking a prefix tree: the matching leaf keys, plus the prefixes whose
 * subtrees could not be listed. Keys below a failed prefix are missing from {@link #getSummaries()}.
 */
public class KeyListing {

    private final List<KeyObjectSummary> summaries = new ArrayList<KeyObjectSummary>();
    private final List<String> failedPrefixes = new ArrayList<String>();

    void add(KeyObjectSummary summary) { summaries.add(summary); }
    void addFailedPrefix(String prefix) { failedPrefixes.add(prefix); }

    public List<KeyObjectSummary> getSummaries() { return Collections.unmodifiableList(summaries); }
    public List<String> getFailedPrefixes() { return Collections.unmodifiableList(failedPrefixes); }

    public List<String> getKeys() {
        return summaries.stream().map(KeyObjectSummary::getKey).collect(Collectors.toList());
    }

    public boolean isComplete() { return failedPrefixes.isEmpty(); }

    public int size() { return summaries.size(); }
}
