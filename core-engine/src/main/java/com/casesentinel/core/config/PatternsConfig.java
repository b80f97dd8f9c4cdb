package com.casesentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Top-level POJO for the detection-patterns YAML configuration.
 *
 * <p>
 * Holds every fixed table the engine consults: the three suspicion rule
 * families, the conventional column aliases used by the finding normalizer,
 * and the ordered artifact-type rules.
 * </p>
 *
 * <pre>
 * executableExtensions: [".exe", ".dll"]
 * suspiciousKeywords: [malware, backdoor]
 * suspiciousPaths: ["temp", "windows.*system32"]
 * timestampColumns: [timestamp, time]
 * deviceColumns: [hostname]
 * accountColumns: [user]
 * eventIdColumns: [event_id]
 * artifactTypes:
 *   - label: Prefetch
 *     keywords: [prefetch]
 *     matchColumns: true
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Lists handed out by the getters
 * are unmodifiable.
 * </p>
 *
 * @since 1.0.0
 */
public class PatternsConfig {

    private List<String> executableExtensions = new ArrayList<>();
    private List<String> suspiciousKeywords = new ArrayList<>();
    private List<String> suspiciousPaths = new ArrayList<>();

    private List<String> timestampColumns = new ArrayList<>();
    private List<String> deviceColumns = new ArrayList<>();
    private List<String> accountColumns = new ArrayList<>();
    private List<String> eventIdColumns = new ArrayList<>();

    private List<ArtifactTypeRule> artifactTypes = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every table. All problems are collected and reported in one
     * exception.
     *
     * @throws IllegalStateException if any table is empty, contains a blank
     *                               entry, or a path pattern does not compile
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        requireEntries("executableExtensions", executableExtensions, errors);
        requireEntries("suspiciousKeywords", suspiciousKeywords, errors);
        requireEntries("suspiciousPaths", suspiciousPaths, errors);
        requireEntries("timestampColumns", timestampColumns, errors);
        requireEntries("deviceColumns", deviceColumns, errors);
        requireEntries("accountColumns", accountColumns, errors);
        requireEntries("eventIdColumns", eventIdColumns, errors);

        for (String path : suspiciousPaths) {
            if (path == null || path.isBlank()) {
                continue;
            }
            try {
                Pattern.compile(path);
            } catch (PatternSyntaxException e) {
                errors.add("Path pattern '" + path + "' does not compile: " + e.getDescription());
            }
        }

        for (int i = 0; i < artifactTypes.size(); i++) {
            ArtifactTypeRule rule = artifactTypes.get(i);
            if (rule == null) {
                errors.add("Artifact type at index " + i + " is null");
                continue;
            }
            if (rule.getLabel() == null || rule.getLabel().isBlank()) {
                errors.add("Artifact type at index " + i + " requires 'label'");
            }
            if (rule.getKeywords().isEmpty() || rule.getKeywords().stream().anyMatch(k -> k == null || k.isBlank())) {
                errors.add("Artifact type '" + rule.getLabel() + "' requires non-blank 'keywords'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Patterns configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void requireEntries(String name, List<String> values, List<String> errors) {
        if (values.isEmpty()) {
            errors.add("'" + name + "' must not be empty");
            return;
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null || values.get(i).isBlank()) {
                errors.add("'" + name + "' entry " + i + " is blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public List<String> getExecutableExtensions() {
        return Collections.unmodifiableList(executableExtensions);
    }

    /**
     * Set the extension list, normalised to lowercase.
     *
     * @param executableExtensions extensions such as {@code .exe}
     */
    public void setExecutableExtensions(List<String> executableExtensions) {
        this.executableExtensions = lowercase(executableExtensions);
    }

    public List<String> getSuspiciousKeywords() {
        return Collections.unmodifiableList(suspiciousKeywords);
    }

    /**
     * Set the keyword list, normalised to lowercase.
     *
     * @param suspiciousKeywords keywords such as {@code backdoor}
     */
    public void setSuspiciousKeywords(List<String> suspiciousKeywords) {
        this.suspiciousKeywords = lowercase(suspiciousKeywords);
    }

    public List<String> getSuspiciousPaths() {
        return Collections.unmodifiableList(suspiciousPaths);
    }

    /**
     * @param suspiciousPaths regular expressions evaluated against lowercased
     *                        cell text
     */
    public void setSuspiciousPaths(List<String> suspiciousPaths) {
        this.suspiciousPaths = copy(suspiciousPaths);
    }

    public List<String> getTimestampColumns() {
        return Collections.unmodifiableList(timestampColumns);
    }

    public void setTimestampColumns(List<String> timestampColumns) {
        this.timestampColumns = copy(timestampColumns);
    }

    public List<String> getDeviceColumns() {
        return Collections.unmodifiableList(deviceColumns);
    }

    public void setDeviceColumns(List<String> deviceColumns) {
        this.deviceColumns = copy(deviceColumns);
    }

    public List<String> getAccountColumns() {
        return Collections.unmodifiableList(accountColumns);
    }

    public void setAccountColumns(List<String> accountColumns) {
        this.accountColumns = copy(accountColumns);
    }

    public List<String> getEventIdColumns() {
        return Collections.unmodifiableList(eventIdColumns);
    }

    public void setEventIdColumns(List<String> eventIdColumns) {
        this.eventIdColumns = copy(eventIdColumns);
    }

    public List<ArtifactTypeRule> getArtifactTypes() {
        return Collections.unmodifiableList(artifactTypes);
    }

    public void setArtifactTypes(List<ArtifactTypeRule> artifactTypes) {
        this.artifactTypes = artifactTypes != null ? new ArrayList<>(artifactTypes) : new ArrayList<>();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static List<String> lowercase(List<String> values) {
        List<String> result = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                result.add(value != null ? value.toLowerCase(Locale.ROOT) : null);
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return "PatternsConfig{" +
                "executableExtensions=" + executableExtensions +
                ", suspiciousKeywords=" + suspiciousKeywords +
                ", suspiciousPaths=" + suspiciousPaths +
                ", artifactTypes=" + artifactTypes.size() +
                '}';
    }
}
