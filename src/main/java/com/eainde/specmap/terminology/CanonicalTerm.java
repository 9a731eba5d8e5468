package com.eainde.specmap.terminology;

import com.eainde.specmap.model.UnitFamily;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Entry of the canonical terminology table.
 *
 * @param standardName   the standard English name
 * @param unitFamily     expected unit family of values under this name
 * @param aliases        curated locale aliases
 * @param learnedAliases raw names accepted through similarity during a run
 */
public record CanonicalTerm(String standardName, UnitFamily unitFamily, Set<String> aliases, Set<String> learnedAliases) {

    public CanonicalTerm {
        Objects.requireNonNull(standardName, "standardName");
        unitFamily = unitFamily == null ? UnitFamily.UNKNOWN : unitFamily;
        aliases = Set.copyOf(aliases);
        learnedAliases = Set.copyOf(learnedAliases);
    }

    public CanonicalTerm(String standardName, UnitFamily unitFamily, Set<String> aliases) {
        this(standardName, unitFamily, aliases, Set.of());
    }

    public CanonicalTerm withLearnedAlias(String alias) {
        Set<String> learned = new LinkedHashSet<>(learnedAliases);
        learned.add(alias);
        return new CanonicalTerm(standardName, unitFamily, aliases, learned);
    }

    /** Standard name first, then curated aliases in sorted order. Learned aliases are excluded. */
    public List<String> curatedNames() {
        List<String> names = new ArrayList<>();
        names.add(standardName);
        aliases.stream().sorted().forEach(names::add);
        return names;
    }
}
