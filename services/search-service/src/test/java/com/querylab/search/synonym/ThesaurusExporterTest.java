package com.querylab.search.synonym;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ThesaurusExporterTest {

    private final SynonymDictionary dictionary = SynonymDictionary.builder("langs")
        .addGroup(List.of("python", "py", "python3"))
        .addAlias("k8s", "kubernetes")
        .build();

    @Test
    void rendersNonCanonicalTermsAgainstTheirCanonical() {
        String rendered = ThesaurusExporter.render(dictionary);

        assertThat(rendered.split("\n")).containsExactly(
            "# Thesaurus File",
            "# Dictionary: langs",
            "",
            "py : python",
            "python3 : python",
            "k8s : kubernetes"
        );
    }

    @Test
    void writesFileAndCreatesParentDirectories(@TempDir Path dir) throws Exception {
        Path target = dir.resolve("nested/out.ths");

        int lines = ThesaurusExporter.write(dictionary, target);

        assertThat(lines).isEqualTo(6);
        assertThat(Files.readString(target)).startsWith("# Thesaurus File").endsWith("k8s : kubernetes");
    }
}
