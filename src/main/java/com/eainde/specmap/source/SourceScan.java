package com.eainde.specmap.source;

import com.eainde.specmap.model.DocumentFragment;
import com.eainde.specmap.model.FragmentIssue;

import java.util.List;
import java.util.Map;

/**
 * Result of scanning an input folder: fragments per document (in file name order) and the
 * files that could not be parsed.
 */
public record SourceScan(Map<String, List<DocumentFragment>> fragmentsByDocument, List<FragmentIssue> issues) {

    public int documentCount() {
        return fragmentsByDocument.size();
    }
}
