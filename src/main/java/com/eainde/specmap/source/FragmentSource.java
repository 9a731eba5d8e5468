package com.eainde.specmap.source;

import com.eainde.specmap.exception.DocumentParseException;
import com.eainde.specmap.model.DocumentFragment;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns one document format into {@link DocumentFragment}s.
 */
public interface FragmentSource {

    /** Lower-case file extensions without the dot, e.g. "pdf". */
    List<String> extensions();

    /**
     * @return fragments in document order; blank units (empty pages, slides, rows) are skipped
     * @throws DocumentParseException if the file cannot be read
     */
    List<DocumentFragment> read(Path file);
}
