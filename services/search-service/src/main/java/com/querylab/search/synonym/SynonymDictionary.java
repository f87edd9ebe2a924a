package com.querylab.search.synonym;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named, immutable set of synonym groups with a term index. Instances are built through
 * {@link Builder} and never change afterwards, so they can be shared across request threads.
 */
public final class SynonymDictionary {
    private static final Pattern PHRASE = Pattern.compile("[\"']([^\"']+)[\"']");
    private static final String PLACEHOLDER_PREFIX = "__PHRASE_";
    private static final Set<String> OPERATORS = Set.of("AND", "OR", "NOT");

    private final String name;
    private final List<SynonymGroup> groups;
    private final Map<String, SynonymGroup> index;

    private SynonymDictionary(String name, List<SynonymGroup> groups, Map<String, SynonymGroup> index) {
        this.name = name;
        this.groups = List.copyOf(groups);
        this.index = Collections.unmodifiableMap(new HashMap<>(index));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static SynonymDictionary empty(String name) {
        return builder(name).build();
    }

    public static SynonymDictionary fromMap(String name, Map<String, ? extends Collection<String>> data) {
        Builder builder = builder(name);
        for (Map.Entry<String, ? extends Collection<String>> entry : data.entrySet()) {
            List<String> terms = new ArrayList<>();
            terms.add(entry.getKey());
            if (entry.getValue() != null) {
                terms.addAll(entry.getValue());
            }
            builder.addGroup(terms, entry.getKey(), true, 1.0);
        }
        return builder.build();
    }

    public String getName() {
        return name;
    }

    public List<SynonymGroup> getGroups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    public List<String> getSynonyms(String term) {
        String normalized = normalize(term);
        SynonymGroup group = index.get(normalized);
        if (group != null) {
            return group.getTerms();
        }
        return List.of(normalized);
    }

    public String getCanonical(String term) {
        String normalized = normalize(term);
        SynonymGroup group = index.get(normalized);
        return group == null ? normalized : group.getCanonical();
    }

    public String expandTerm(String term) {
        List<String> synonyms = getSynonyms(term);
        if (synonyms.size() > 1) {
            return "(" + String.join(" OR ", synonyms) + ")";
        }
        return term;
    }

    public String expandQuery(String query) {
        if (query == null || query.isBlank()) {
            return query == null ? "" : query;
        }

        Map<String, String> phrases = new LinkedHashMap<>();
        Matcher matcher = PHRASE.matcher(query);
        StringBuilder protectedQuery = new StringBuilder();
        while (matcher.find()) {
            String placeholder = PLACEHOLDER_PREFIX + phrases.size() + "__";
            phrases.put(placeholder, matcher.group());
            matcher.appendReplacement(protectedQuery, Matcher.quoteReplacement(placeholder));
        }
        matcher.appendTail(protectedQuery);

        List<String> expanded = new ArrayList<>();
        for (String word : protectedQuery.toString().trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            if (OPERATORS.contains(word.toUpperCase(Locale.ROOT))
                || word.startsWith(PLACEHOLDER_PREFIX)
                || word.startsWith("-")
                || word.contains(":")) {
                expanded.add(word);
            } else {
                expanded.add(expandTerm(word));
            }
        }

        String result = String.join(" ", expanded);
        for (Map.Entry<String, String> phrase : phrases.entrySet()) {
            result = result.replace(phrase.getKey(), phrase.getValue());
        }
        return result;
    }

    /**
     * Flattens the dictionary into {@code term -> group terms}.
     */
    public Map<String, List<String>> toMap() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (SynonymGroup group : groups) {
            for (String term : group.getTerms()) {
                result.put(term, group.getTerms());
            }
        }
        return result;
    }

    private static String normalize(String term) {
        return term == null ? "" : term.strip().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final String name;
        private final List<SynonymGroup> groups = new ArrayList<>();
        private final Map<String, SynonymGroup> index = new HashMap<>();

        private Builder(String name) {
            this.name = name == null || name.isBlank() ? "default" : name;
        }

        public Builder addGroup(List<String> terms) {
            return addGroup(terms, null, true, 1.0);
        }

        /**
         * Adds a group. Terms are trimmed, lower-cased and de-duplicated; fewer than two distinct
         * terms and the group is ignored. Terms shared with an earlier group are re-indexed here.
         */
        public Builder addGroup(List<String> terms, String canonical, boolean bidirectional, double weight) {
            if (terms == null) {
                return this;
            }
            Set<String> normalized = new LinkedHashSet<>();
            for (String term : terms) {
                if (term != null && !term.isBlank()) {
                    normalized.add(normalize(term));
                }
            }
            if (normalized.size() < 2) {
                return this;
            }

            String canonicalTerm = canonical == null || canonical.isBlank() ? null : normalize(canonical);
            SynonymGroup group = new SynonymGroup(new ArrayList<>(normalized), canonicalTerm, bidirectional, weight);
            groups.add(group);
            for (String term : group.getTerms()) {
                index.put(term, group);
            }
            return this;
        }

        public Builder addPair(String first, String second) {
            return addGroup(Arrays.asList(first, second), null, true, 1.0);
        }

        public Builder addAlias(String alias, String canonical) {
            return addGroup(Arrays.asList(canonical, alias), canonical, false, 1.0);
        }

        public SynonymDictionary build() {
            return new SynonymDictionary(name, groups, index);
        }
    }
}
