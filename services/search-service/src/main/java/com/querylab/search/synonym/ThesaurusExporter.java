package com.querylab.search.synonym;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a dictionary as a thesaurus file that maps every non-canonical term to its canonical term.
 */
public final class ThesaurusExporter {
    private ThesaurusExporter() {
    }

    public static String render(SynonymDictionary dictionary) {
        List<String> lines = new ArrayList<>();
        lines.add("# Thesaurus File");
        lines.add("# Dictionary: " + dictionary.getName());
        lines.add("");
        for (SynonymGroup group : dictionary.getGroups()) {
            String canonical = group.getCanonical();
            for (String term : group.getTerms()) {
                if (!term.equals(canonical)) {
                    lines.add(term + " : " + canonical);
                }
            }
        }
        return String.join("\n", lines);
    }

    public static int write(SynonymDictionary dictionary, Path path) throws IOException {
        String content = render(dictionary);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
        return content.split("\n", -1).length;
    }
}
