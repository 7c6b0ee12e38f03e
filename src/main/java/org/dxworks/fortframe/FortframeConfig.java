package org.dxworks.fortframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.fortframe.model.Permission;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable settings shared by the reader, the parser and the correlator.
 */
public class FortframeConfig {

    private static final String CONFIG_FILE_NAME = "fortframe-config.yml";

    private static final List<String> DEFAULT_FIXED_EXTENSIONS = List.of("f", "for", "fpp", "ftn");
    private static final List<String> DEFAULT_FPP_EXTENSIONS = List.of("F90", "F95", "F03", "F08", "F", "FOR", "FPP");
    private static final List<String> DEFAULT_PREPROCESSOR = List.of("cpp", "-traditional-nocomment", "-E", "-P");

    private final String docmark;
    private final String predocmark;
    private final String docmarkAlt;
    private final String predocmarkAlt;
    private final Set<Permission> display;
    private final boolean hideUndoc;
    private final boolean procInternals;
    private final boolean warn;
    private final boolean strict;
    private final String encoding;
    private final boolean fixedLengthLimit;
    private final List<String> fixedExtensions;
    private final List<String> fppExtensions;
    private final List<String> preprocessor;
    private final List<String> macros;
    private final List<Path> includeDirs;
    private final Map<String, String> extraModules;
    private final int workers;

    private FortframeConfig(Builder builder) {
        this.docmark = builder.docmark;
        this.predocmark = builder.predocmark;
        this.docmarkAlt = builder.docmarkAlt;
        this.predocmarkAlt = builder.predocmarkAlt;
        this.display = Collections.unmodifiableSet(EnumSet.copyOf(builder.display));
        this.hideUndoc = builder.hideUndoc;
        this.procInternals = builder.procInternals;
        this.warn = builder.warn;
        this.strict = builder.strict;
        this.encoding = builder.encoding;
        this.fixedLengthLimit = builder.fixedLengthLimit;
        this.fixedExtensions = List.copyOf(builder.fixedExtensions);
        this.fppExtensions = List.copyOf(builder.fppExtensions);
        this.preprocessor = List.copyOf(builder.preprocessor);
        this.macros = List.copyOf(builder.macros);
        this.includeDirs = List.copyOf(builder.includeDirs);
        this.extraModules = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraModules));
        this.workers = builder.workers;
        validate();
    }

    private void validate() {
        if (docmark == null || docmark.isEmpty()) {
            throw new ConfigurationException("docmark must not be empty");
        }
        String[][] marks = {
                {"docmark", docmark},
                {"predocmark", predocmark},
                {"docmark_alt", docmarkAlt},
                {"predocmark_alt", predocmarkAlt}
        };
        for (int i = 0; i < marks.length; i++) {
            for (int j = i + 1; j < marks.length; j++) {
                if (!marks[i][1].isEmpty() && marks[i][1].equals(marks[j][1])) {
                    throw new ConfigurationException(marks[i][0] + " ('" + marks[i][1] + "') and "
                            + marks[j][0] + " ('" + marks[j][1] + "') are the same");
                }
            }
        }
        if (preprocessor.isEmpty() || preprocessor.get(0).isBlank()) {
            throw new ConfigurationException("preprocessor command must not be empty");
        }
        if (workers < 1) {
            throw new ConfigurationException("workers must be at least 1, got " + workers);
        }
    }

    public String getDocmark() {
        return docmark;
    }

    public String getPredocmark() {
        return predocmark;
    }

    public String getDocmarkAlt() {
        return docmarkAlt;
    }

    public String getPredocmarkAlt() {
        return predocmarkAlt;
    }

    public Set<Permission> getDisplay() {
        return display;
    }

    public boolean isHideUndoc() {
        return hideUndoc;
    }

    public boolean isProcInternals() {
        return procInternals;
    }

    public boolean isWarn() {
        return warn;
    }

    public boolean isStrict() {
        return strict;
    }

    public String getEncoding() {
        return encoding;
    }

    public boolean isFixedLengthLimit() {
        return fixedLengthLimit;
    }

    public List<String> getFixedExtensions() {
        return fixedExtensions;
    }

    public List<String> getFppExtensions() {
        return fppExtensions;
    }

    public List<String> getPreprocessor() {
        return preprocessor;
    }

    public List<String> getMacros() {
        return macros;
    }

    public List<Path> getIncludeDirs() {
        return includeDirs;
    }

    public Map<String, String> getExtraModules() {
        return extraModules;
    }

    public int getWorkers() {
        return workers;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.docmark = docmark;
        builder.predocmark = predocmark;
        builder.docmarkAlt = docmarkAlt;
        builder.predocmarkAlt = predocmarkAlt;
        builder.display = EnumSet.noneOf(Permission.class);
        builder.display.addAll(display);
        builder.hideUndoc = hideUndoc;
        builder.procInternals = procInternals;
        builder.warn = warn;
        builder.strict = strict;
        builder.encoding = encoding;
        builder.fixedLengthLimit = fixedLengthLimit;
        builder.fixedExtensions = new ArrayList<>(fixedExtensions);
        builder.fppExtensions = new ArrayList<>(fppExtensions);
        builder.preprocessor = new ArrayList<>(preprocessor);
        builder.macros = new ArrayList<>(macros);
        builder.includeDirs = new ArrayList<>(includeDirs);
        builder.extraModules = new LinkedHashMap<>(extraModules);
        builder.workers = workers;
        return builder;
    }

    public static FortframeConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FortframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static FortframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        YamlConfig yamlConfig;
        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
        } catch (IOException e) {
            synchronized (System.err) {
                System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
            }
            return defaults();
        }
        if (yamlConfig == null) {
            return defaults();
        }

        Builder builder = builder();
        if (yamlConfig.docmark != null) builder.docmark(yamlConfig.docmark);
        if (yamlConfig.predocmark != null) builder.predocmark(yamlConfig.predocmark);
        if (yamlConfig.docmarkAlt != null) builder.docmarkAlt(yamlConfig.docmarkAlt);
        if (yamlConfig.predocmarkAlt != null) builder.predocmarkAlt(yamlConfig.predocmarkAlt);
        if (yamlConfig.display != null) {
            EnumSet<Permission> display = EnumSet.noneOf(Permission.class);
            for (String permission : yamlConfig.display) {
                display.add(Permission.parse(permission));
            }
            builder.display(display);
        }
        if (yamlConfig.hideUndoc != null) builder.hideUndoc(yamlConfig.hideUndoc);
        if (yamlConfig.procInternals != null) builder.procInternals(yamlConfig.procInternals);
        if (yamlConfig.warn != null) builder.warn(yamlConfig.warn);
        if (yamlConfig.strict != null) builder.strict(yamlConfig.strict);
        if (yamlConfig.encoding != null) builder.encoding(yamlConfig.encoding);
        if (yamlConfig.fixedLengthLimit != null) builder.fixedLengthLimit(yamlConfig.fixedLengthLimit);
        if (yamlConfig.fixedExtensions != null) builder.fixedExtensions(yamlConfig.fixedExtensions);
        if (yamlConfig.fppExtensions != null) builder.fppExtensions(yamlConfig.fppExtensions);
        if (yamlConfig.preprocessor != null) builder.preprocessor(yamlConfig.preprocessor);
        if (yamlConfig.macros != null) builder.macros(yamlConfig.macros);
        if (yamlConfig.includeDirs != null) {
            List<Path> dirs = new ArrayList<>();
            for (String dir : yamlConfig.includeDirs) {
                dirs.add(Paths.get(dir));
            }
            builder.includeDirs(dirs);
        }
        if (yamlConfig.extraModules != null) builder.extraModules(yamlConfig.extraModules);
        if (yamlConfig.workers != null && yamlConfig.workers > 0) builder.workers(yamlConfig.workers);
        return builder.build();
    }

    public static class Builder {
        private String docmark = "!";
        private String predocmark = ">";
        private String docmarkAlt = "*";
        private String predocmarkAlt = "|";
        private EnumSet<Permission> display = EnumSet.of(Permission.PUBLIC, Permission.PROTECTED);
        private boolean hideUndoc = false;
        private boolean procInternals = false;
        private boolean warn = false;
        private boolean strict = false;
        private String encoding = "UTF-8";
        private boolean fixedLengthLimit = true;
        private List<String> fixedExtensions = new ArrayList<>(DEFAULT_FIXED_EXTENSIONS);
        private List<String> fppExtensions = new ArrayList<>(DEFAULT_FPP_EXTENSIONS);
        private List<String> preprocessor = new ArrayList<>(DEFAULT_PREPROCESSOR);
        private List<String> macros = new ArrayList<>();
        private List<Path> includeDirs = new ArrayList<>();
        private Map<String, String> extraModules = new LinkedHashMap<>();
        private int workers = Runtime.getRuntime().availableProcessors();

        private Builder() {
        }

        public Builder docmark(String docmark) {
            this.docmark = docmark;
            return this;
        }

        public Builder predocmark(String predocmark) {
            this.predocmark = predocmark;
            return this;
        }

        public Builder docmarkAlt(String docmarkAlt) {
            this.docmarkAlt = docmarkAlt;
            return this;
        }

        public Builder predocmarkAlt(String predocmarkAlt) {
            this.predocmarkAlt = predocmarkAlt;
            return this;
        }

        public Builder display(Set<Permission> display) {
            this.display = EnumSet.noneOf(Permission.class);
            this.display.addAll(display);
            return this;
        }

        public Builder hideUndoc(boolean hideUndoc) {
            this.hideUndoc = hideUndoc;
            return this;
        }

        public Builder procInternals(boolean procInternals) {
            this.procInternals = procInternals;
            return this;
        }

        public Builder warn(boolean warn) {
            this.warn = warn;
            return this;
        }

        public Builder strict(boolean strict) {
            this.strict = strict;
            return this;
        }

        public Builder encoding(String encoding) {
            this.encoding = encoding;
            return this;
        }

        public Builder fixedLengthLimit(boolean fixedLengthLimit) {
            this.fixedLengthLimit = fixedLengthLimit;
            return this;
        }

        public Builder fixedExtensions(List<String> fixedExtensions) {
            this.fixedExtensions = new ArrayList<>(fixedExtensions);
            return this;
        }

        public Builder fppExtensions(List<String> fppExtensions) {
            this.fppExtensions = new ArrayList<>(fppExtensions);
            return this;
        }

        public Builder preprocessor(List<String> preprocessor) {
            this.preprocessor = new ArrayList<>(preprocessor);
            return this;
        }

        public Builder macros(List<String> macros) {
            this.macros = new ArrayList<>(macros);
            return this;
        }

        public Builder includeDirs(List<Path> includeDirs) {
            this.includeDirs = new ArrayList<>(includeDirs);
            return this;
        }

        public Builder extraModules(Map<String, String> extraModules) {
            this.extraModules = new LinkedHashMap<>(extraModules);
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public FortframeConfig build() {
            return new FortframeConfig(this);
        }
    }

    private static class YamlConfig {
        public String docmark;
        public String predocmark;
        public String docmarkAlt;
        public String predocmarkAlt;
        public List<String> display;
        public Boolean hideUndoc;
        public Boolean procInternals;
        public Boolean warn;
        public Boolean strict;
        public String encoding;
        public Boolean fixedLengthLimit;
        public List<String> fixedExtensions;
        public List<String> fppExtensions;
        public List<String> preprocessor;
        public List<String> macros;
        public List<String> includeDirs;
        public Map<String, String> extraModules;
        public Integer workers;
    }
}
