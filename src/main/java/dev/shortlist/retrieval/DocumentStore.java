package dev.shortlist.retrieval;

import java.io.IOException;
import java.util.Collection;
import java.util.List;

/**
 * Read access to the stored candidate documents. Documents are addressed by
 * their file name.
 */
public interface DocumentStore {

    /**
     * Names of the stored documents with one of the given extensions, sorted.
     */
    List<String> list(Collection<String> extensions);

    String readText(String name) throws IOException;

    String readPdfText(String name) throws IOException;

    /**
     * Text of a document, read according to its extension.
     */
    String read(String name) throws IOException;
}
