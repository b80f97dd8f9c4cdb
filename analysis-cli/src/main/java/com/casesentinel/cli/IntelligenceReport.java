package com.casesentinel.cli;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Open-source threat intelligence about one threat actor.
 *
 * <pre>
 * {
 *   "threat_actor": "APT29",
 *   "ttps": [{"tactic": "...", "technique": "T1059", "description": "..."}],
 *   "iocs": {"ip_addresses": ["1.2.3.4"], "domains": ["evil.example.com"], "other": "x"},
 *   "sources": ["https://..."]
 * }
 * </pre>
 *
 * <p>
 * Each {@code iocs} category holds a list of strings or a single string.
 * TTPs are carried as context only.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntelligenceReport {

    @JsonProperty("threat_actor")
    private String threatActor;

    @JsonProperty("ttps")
    private List<Ttp> ttps = new ArrayList<>();

    @JsonProperty("iocs")
    private Map<String, Object> iocs = new LinkedHashMap<>();

    @JsonProperty("sources")
    private List<String> sources = new ArrayList<>();

    /** No-arg constructor required by Jackson. */
    public IntelligenceReport() {
    }

    /**
     * Flatten every indicator category, in document order.
     *
     * @return the indicators; non-string entries are skipped
     */
    public List<String> allIndicators() {
        List<String> all = new ArrayList<>();
        for (Object value : iocs.values()) {
            if (value instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof String s) {
                        all.add(s);
                    }
                }
            } else if (value instanceof String s) {
                all.add(s);
            }
        }
        return all;
    }

    public String getThreatActor() {
        return threatActor;
    }

    public void setThreatActor(String threatActor) {
        this.threatActor = threatActor;
    }

    public List<Ttp> getTtps() {
        return Collections.unmodifiableList(ttps);
    }

    public void setTtps(List<Ttp> ttps) {
        this.ttps = ttps != null ? new ArrayList<>(ttps) : new ArrayList<>();
    }

    public Map<String, Object> getIocs() {
        return Collections.unmodifiableMap(iocs);
    }

    public void setIocs(Map<String, Object> iocs) {
        this.iocs = iocs != null ? new LinkedHashMap<>(iocs) : new LinkedHashMap<>();
    }

    public List<String> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public void setSources(List<String> sources) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "IntelligenceReport{threatActor='" + threatActor + '\''
                + ", ttps=" + ttps.size()
                + ", iocCategories=" + iocs.keySet() + '}';
    }

    /**
     * One tactic, technique or procedure.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ttp {
        private String tactic;
        private String technique;
        private String description;

        public String getTactic() {
            return tactic;
        }

        public void setTactic(String tactic) {
            this.tactic = tactic;
        }

        public String getTechnique() {
            return technique;
        }

        public void setTechnique(String technique) {
            this.technique = technique;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }
    }
}
