package com.eainde.specmap.provenance;

import com.eainde.specmap.model.CanonicalSpec;
import com.eainde.specmap.model.ExtractedSpecInstance;
import com.eainde.specmap.model.FragmentKey;
import com.eainde.specmap.model.MappingResult;
import com.eainde.specmap.model.ReferenceRecord;
import com.eainde.specmap.model.TranslatedFragment;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the audit trail: one {@link ReferenceRecord} per contributing instance of every
 * canonical spec, merged or not.
 */
public class ProvenanceTracker {

    /**
     * @param specs     canonical specs of the run
     * @param mappings  exactly one mapping result per spec
     * @param fragments every fragment of the run by key
     * @throws IllegalStateException if an instance points at an unknown fragment or a spec has no mapping
     */
    public List<ReferenceRecord> track(List<CanonicalSpec> specs,
                                       List<MappingResult> mappings,
                                       Map<FragmentKey, TranslatedFragment> fragments) {
        Map<CanonicalSpec, MappingResult> bySpec = new IdentityHashMap<>();
        mappings.forEach(m -> bySpec.put(m.canonicalSpec(), m));

        List<ReferenceRecord> records = new ArrayList<>();
        for (CanonicalSpec spec : specs) {
            MappingResult mapping = bySpec.get(spec);
            if (mapping == null) {
                throw new IllegalStateException("No mapping result for spec '" + spec.standardName() + "'");
            }
            for (ExtractedSpecInstance instance : spec.contributingInstances()) {
                TranslatedFragment fragment = fragments.get(instance.fragmentKey());
                if (fragment == null) {
                    throw new IllegalStateException("Instance '" + instance.rawSpecName()
                            + "' refers to unknown fragment " + instance.fragmentKey());
                }
                records.add(new ReferenceRecord(
                        spec.standardName(),
                        instance,
                        fragment.fragment().sourceFile(),
                        fragment.fragment().locator(),
                        originalText(instance, fragment),
                        translatedText(instance, fragment),
                        instance.confidence(),
                        mapping.status(),
                        fragment.translationStatus()));
            }
        }
        return records;
    }

    /** The excerpt when it literally occurs in the source, otherwise the whole fragment text. */
    static String originalText(ExtractedSpecInstance instance, TranslatedFragment fragment) {
        String raw = fragment.fragment().rawText();
        String excerpt = instance.sourceExcerpt();
        return !excerpt.isBlank() && raw.contains(excerpt) ? excerpt : raw;
    }

    static String translatedText(ExtractedSpecInstance instance, TranslatedFragment fragment) {
        return instance.sourceExcerpt().isBlank() ? fragment.translatedText() : instance.sourceExcerpt();
    }
}
