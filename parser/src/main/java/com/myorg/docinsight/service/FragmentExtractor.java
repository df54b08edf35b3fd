package com.myorg.docinsight.service;

import com.myorg.docinsight.model.TextFragment;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Turns a document file into positioned text fragments in reading order.
 */
public interface FragmentExtractor {
    List<TextFragment> extract(File file, String documentId) throws IOException;
}
