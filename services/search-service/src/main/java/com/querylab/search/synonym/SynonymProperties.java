package com.querylab.search.synonym;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "search.synonyms")
public class SynonymProperties {
    public static final String DEFAULT_PATH = "classpath:synonyms/programming.json";

    private boolean enabled = true;
    private String path = DEFAULT_PATH;
    private String exportDir = "build/thesaurus";
    private String exportFileName = "search_thesaurus.ths";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public String getExportDir() {
        return exportDir;
    }

    public void setExportDir(String exportDir) {
        this.exportDir = exportDir;
    }

    public String getExportFileName() {
        return exportFileName;
    }

    public void setExportFileName(String exportFileName) {
        this.exportFileName = exportFileName;
    }
}
