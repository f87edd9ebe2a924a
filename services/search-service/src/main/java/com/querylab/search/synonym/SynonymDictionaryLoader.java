package com.querylab.search.synonym;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

/**
 * Reads synonym dictionaries from {@code classpath:} resources or file paths.
 *
 * <p>A {@code .json} source is an object of {@code canonical -> [aliases]}. Any other source is
 * line based: {@code alias : canonical}, comma separated groups, or whitespace separated groups.
 */
public class SynonymDictionaryLoader {
    private static final TypeReference<LinkedHashMap<String, List<String>>> JSON_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public SynonymDictionaryLoader(ObjectMapper objectMapper) {
        this(objectMapper, new DefaultResourceLoader());
    }

    public SynonymDictionaryLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public SynonymDictionary load(String location) throws IOException {
        return load(location, null);
    }

    public SynonymDictionary load(String location, String name) throws IOException {
        if (location == null || location.isBlank()) {
            throw new IOException("synonym source location is empty");
        }
        Resource resource = resourceLoader.getResource(toResourceLocation(location));
        if (!resource.exists()) {
            throw new IOException("synonym source not found: " + location);
        }

        String filename = resource.getFilename() == null ? location : resource.getFilename();
        String dictionaryName = name == null || name.isBlank() ? stem(filename) : name;
        String content = StreamUtils.copyToString(resource.getInputStream(), StandardCharsets.UTF_8);

        if (filename.endsWith(".json")) {
            LinkedHashMap<String, List<String>> data = objectMapper.readValue(content, JSON_TYPE);
            return SynonymDictionary.fromMap(dictionaryName, data);
        }
        return parseLines(dictionaryName, content);
    }

    public static SynonymDictionary parseLines(String name, String content) {
        SynonymDictionary.Builder builder = SynonymDictionary.builder(name);
        for (String raw : content.split("\\R")) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }

            if (line.contains(":")) {
                String[] parts = line.split(":", -1);
                if (parts.length == 2) {
                    builder.addAlias(parts[0].strip(), parts[1].strip());
                }
            } else if (line.contains(",")) {
                builder.addGroup(Arrays.asList(line.split(",")));
            } else {
                String[] terms = line.split("\\s+");
                if (terms.length >= 2) {
                    builder.addGroup(Arrays.asList(terms));
                }
            }
        }
        return builder.build();
    }

    private static String toResourceLocation(String location) {
        if (location.startsWith("classpath:") || location.startsWith("file:")) {
            return location;
        }
        return "file:" + location;
    }

    private static String stem(String filename) {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String base = slash >= 0 ? filename.substring(slash + 1) : filename;
        int dot = base.lastIndexOf('.');
        return dot > 0 ? base.substring(0, dot) : base;
    }
}
