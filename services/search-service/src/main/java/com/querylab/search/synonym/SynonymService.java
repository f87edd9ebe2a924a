package com.querylab.search.synonym;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class SynonymService {
    private static final Logger log = LoggerFactory.getLogger(SynonymService.class);

    private final SynonymProperties properties;
    private final SynonymDictionaryLoader loader;
    private final AtomicReference<SynonymDictionary> active = new AtomicReference<>();

    @Autowired
    public SynonymService(SynonymProperties properties, ObjectMapper objectMapper) {
        this(properties, new SynonymDictionaryLoader(objectMapper));
    }

    public SynonymService(SynonymProperties properties, SynonymDictionaryLoader loader) {
        this.properties = properties;
        this.loader = loader;
        this.active.set(loadInitial());
    }

    public SynonymDictionary getDictionary() {
        return active.get();
    }

    public String expandSynonyms(String query) {
        if (!properties.isEnabled()) {
            return query;
        }
        return active.get().expandQuery(query);
    }

    public List<String> getSynonyms(String term) {
        return active.get().getSynonyms(term);
    }

    public SynonymReloadResult reload() {
        String location = properties.getPath();
        try {
            SynonymDictionary next = loader.load(location);
            SynonymDictionary previous = active.getAndSet(next);
            log.info(
                "synonym dictionary reloaded name={} groups={} previous_groups={}",
                next.getName(),
                next.size(),
                previous == null ? 0 : previous.size()
            );
            return new SynonymReloadResult(true, next.getName(), next.size(), null);
        } catch (IOException | RuntimeException e) {
            SynonymDictionary current = active.get();
            log.warn("synonym reload failed location={}, keeping dictionary {}", location, current.getName(), e);
            return new SynonymReloadResult(false, current.getName(), current.size(), e.getMessage());
        }
    }

    /**
     * Writes the active dictionary under {@code search.synonyms.export-dir}. {@code fileName} is
     * relative to that directory; the configured file name is used when it is blank.
     */
    public ThesaurusExport exportThesaurus(String fileName) {
        Path target = resolveExportTarget(fileName);
        SynonymDictionary dictionary = active.get();
        try {
            int lines = ThesaurusExporter.write(dictionary, target);
            log.info("thesaurus written path={} dictionary={} lines={}", target, dictionary.getName(), lines);
            return new ThesaurusExport(target.toString(), dictionary.getName(), lines);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write thesaurus to " + target, e);
        }
    }

    Path resolveExportTarget(String fileName) {
        String name = fileName == null || fileName.isBlank() ? properties.getExportFileName() : fileName.trim();
        Path directory = Path.of(properties.getExportDir()).toAbsolutePath().normalize();
        Path relative;
        try {
            relative = Path.of(name);
        } catch (InvalidPathException e) {
            throw new InvalidExportPathException("invalid export path: " + e.getReason());
        }
        if (relative.isAbsolute() || relative.getRoot() != null) {
            throw new InvalidExportPathException("export path must be relative to the export directory");
        }
        Path target = directory.resolve(relative).normalize();
        if (!target.startsWith(directory) || target.equals(directory)) {
            throw new InvalidExportPathException("export path must stay inside the export directory");
        }
        return target;
    }

    private SynonymDictionary loadInitial() {
        String location = properties.getPath();
        try {
            SynonymDictionary dictionary = loader.load(location);
            log.info("synonym dictionary loaded name={} groups={}", dictionary.getName(), dictionary.size());
            return dictionary;
        } catch (IOException | RuntimeException e) {
            log.warn("synonym source {} unavailable, using built-in dictionary", location, e);
        }
        try {
            return loader.load(SynonymProperties.DEFAULT_PATH);
        } catch (IOException | RuntimeException e) {
            log.warn("built-in synonym dictionary unavailable", e);
            return SynonymDictionary.empty("default");
        }
    }

    public record ThesaurusExport(String path, String dictionary, int lines) {
    }
}
