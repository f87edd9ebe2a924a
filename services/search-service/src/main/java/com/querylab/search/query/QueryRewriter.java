package com.querylab.search.query;

import com.querylab.search.synonym.SynonymService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class QueryRewriter {
    private final SynonymService synonymService;
    private final Set<String> stopWords;
    private final int minWordLength;

    public QueryRewriter(QueryParserProperties properties, SynonymService synonymService) {
        this.synonymService = synonymService;
        this.minWordLength = Math.max(0, properties.getMinWordLength());
        Set<String> words = new HashSet<>();
        if (properties.getStopWords() != null) {
            for (String word : properties.getStopWords()) {
                if (word != null && !word.isBlank()) {
                    words.add(word.strip().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.stopWords = Set.copyOf(words);
    }

    /**
     * Collapses whitespace and drops words shorter than the configured minimum. Quoted text is
     * kept whole regardless of length.
     */
    public String normalize(String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        String collapsed = String.join(" ", query.strip().split("\\s+"));

        List<String> words = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        for (int i = 0; i < collapsed.length(); i++) {
            char c = collapsed.charAt(i);
            if (c == '"' || c == '\'') {
                inQuote = !inQuote;
                current.append(c);
            } else if (c == ' ' && !inQuote) {
                keepIfLongEnough(current, words);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        keepIfLongEnough(current, words);
        return String.join(" ", words);
    }

    public String removeStopWords(String query) {
        if (query == null || query.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String word : query.strip().split("\\s+")) {
            if (!stopWords.contains(word.toLowerCase(Locale.ROOT))) {
                kept.add(word);
            }
        }
        return String.join(" ", kept);
    }

    public String expandSynonyms(String query) {
        return synonymService.expandSynonyms(query);
    }

    private void keepIfLongEnough(StringBuilder current, List<String> words) {
        if (current.length() == 0) {
            return;
        }
        String word = current.toString();
        if (word.length() >= minWordLength || word.startsWith("\"")) {
            words.add(word);
        }
    }
}
