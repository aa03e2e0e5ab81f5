package io.ontregistry.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One physical sequencing run as currently known to the registry.
 *
 * <p>Fields not modelled here (enrichment metadata written by other tools) are kept in
 * {@link #extras()} and written back unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
        "run_id", "flowcell", "device", "experiment_name", "date", "time",
        "total_reads", "total_bases", "has_pod5", "has_summary", "is_canonical", "num_merged",
        "pod5_files", "fast5_files", "fastq_files", "bam_files",
        "canonical_path", "current_path", "all_paths",
        "status", "archived_reason", "archived_at", "registered_at", "updated_at"
})
public final class ExperimentRecord {
    public static final String STATUS_ARCHIVED = "archived";

    @JsonProperty("run_id")
    private String runId;
    private String flowcell;
    private String device;
    @JsonProperty("experiment_name")
    @JsonAlias({"experiment", "harmonized_name"})
    private String experimentName;
    private String date;
    private String time;

    @JsonProperty("total_reads")
    private Long totalReads;
    @JsonProperty("total_bases")
    private Long totalBases;
    @JsonProperty("has_pod5")
    private Boolean hasPod5;
    @JsonProperty("has_summary")
    private Boolean hasSummary;
    @JsonProperty("is_canonical")
    private Boolean canonical;
    @JsonProperty("num_merged")
    private Integer numMerged;

    @JsonProperty("pod5_files")
    private Integer pod5Files;
    @JsonProperty("fast5_files")
    private Integer fast5Files;
    @JsonProperty("fastq_files")
    private Integer fastqFiles;
    @JsonProperty("bam_files")
    private Integer bamFiles;

    @JsonProperty("canonical_path")
    private String canonicalPath;
    @JsonProperty("current_path")
    private String currentPath;
    @JsonProperty("all_paths")
    private List<String> allPaths = new ArrayList<>();

    private String status;
    @JsonProperty("archived_reason")
    private String archivedReason;
    @JsonProperty("archived_at")
    private String archivedAt;
    @JsonProperty("registered_at")
    @JsonAlias("registered")
    private String registeredAt;
    @JsonProperty("updated_at")
    @JsonAlias("updated")
    private String updatedAt;

    private final Map<String, Object> extras = new LinkedHashMap<>();

    public ExperimentRecord() {
    }

    public ExperimentRecord(String runId) {
        this.runId = runId;
    }

    public ExperimentRecord copy() {
        ExperimentRecord c = new ExperimentRecord(runId);
        c.flowcell = flowcell;
        c.device = device;
        c.experimentName = experimentName;
        c.date = date;
        c.time = time;
        c.totalReads = totalReads;
        c.totalBases = totalBases;
        c.hasPod5 = hasPod5;
        c.hasSummary = hasSummary;
        c.canonical = canonical;
        c.numMerged = numMerged;
        c.pod5Files = pod5Files;
        c.fast5Files = fast5Files;
        c.fastqFiles = fastqFiles;
        c.bamFiles = bamFiles;
        c.canonicalPath = canonicalPath;
        c.currentPath = currentPath;
        c.allPaths = new ArrayList<>(allPaths);
        c.status = status;
        c.archivedReason = archivedReason;
        c.archivedAt = archivedAt;
        c.registeredAt = registeredAt;
        c.updatedAt = updatedAt;
        c.extras.putAll(extras);
        return c;
    }

    /**
     * Paths this record was observed at in the order they should be merged onto another record:
     * canonical path, current path, then everything already in {@code all_paths}.
     */
    @JsonIgnore
    public List<String> observedPaths() {
        List<String> out = new ArrayList<>();
        addIfPresent(out, canonicalPath);
        addIfPresent(out, currentPath);
        for (String path : allPaths) {
            addIfPresent(out, path);
        }
        return out;
    }

    /**
     * Appends {@code path} to {@code all_paths} unless it is blank or already present.
     *
     * @return true when the list grew
     */
    public boolean addPath(String path) {
        if (path == null || path.isBlank() || allPaths.contains(path)) {
            return false;
        }
        allPaths.add(path);
        return true;
    }

    @JsonIgnore
    public boolean isArchived() {
        return STATUS_ARCHIVED.equals(status);
    }

    @JsonIgnore
    public String dateTimeKey() {
        return nullToEmpty(date) + "_" + nullToEmpty(time);
    }

    @JsonIgnore
    public long totalReadsOrZero() {
        return totalReads == null ? 0L : totalReads;
    }

    @JsonIgnore
    public int numMergedOrOne() {
        return numMerged == null ? 1 : numMerged;
    }

    @JsonIgnore
    public boolean hasPod5OrFalse() {
        return Boolean.TRUE.equals(hasPod5);
    }

    @JsonIgnore
    public boolean canonicalOrFalse() {
        return Boolean.TRUE.equals(canonical);
    }

    /**
     * Value of a file-count field by its wire name; absent counts read as zero.
     */
    public int fileCount(String field) {
        Integer value = switch (field) {
            case "pod5_files" -> pod5Files;
            case "fast5_files" -> fast5Files;
            case "fastq_files" -> fastqFiles;
            case "bam_files" -> bamFiles;
            default -> throw new IllegalArgumentException("Not a file-count field: " + field);
        };
        return value == null ? 0 : value;
    }

    /**
     * Sets a field by its wire name. Known scalar fields are converted to their declared type;
     * anything else lands in {@link #extras()}.
     */
    public void applyField(String field, Object value) {
        switch (field) {
            case "run_id", "all_paths" ->
                    throw new IllegalArgumentException("Field " + field + " cannot be changed on run_id " + runId);
            case "pod5_files" -> pod5Files = toInteger(field, value);
            case "fast5_files" -> fast5Files = toInteger(field, value);
            case "fastq_files" -> fastqFiles = toInteger(field, value);
            case "bam_files" -> bamFiles = toInteger(field, value);
            case "num_merged" -> numMerged = toInteger(field, value);
            case "total_reads" -> totalReads = toLong(field, value);
            case "total_bases" -> totalBases = toLong(field, value);
            case "has_pod5" -> hasPod5 = toBoolean(value);
            case "has_summary" -> hasSummary = toBoolean(value);
            case "is_canonical" -> canonical = toBoolean(value);
            case "flowcell" -> flowcell = toText(value);
            case "device" -> device = toText(value);
            case "experiment_name" -> experimentName = toText(value);
            case "date" -> date = toText(value);
            case "time" -> time = toText(value);
            case "canonical_path" -> canonicalPath = toText(value);
            case "current_path" -> currentPath = toText(value);
            default -> extras.put(field, value);
        }
    }

    private Integer toInteger(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException("Field " + field + " on run_id " + runId + " expects an int count, got: " + value, e);
            }
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + field + " on run_id " + runId + " expects a number, got: " + value, e);
        }
    }

    private Long toLong(String field, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString()).longValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException("Field " + field + " on run_id " + runId + " expects a whole number, got: " + value, e);
            }
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Field " + field + " on run_id " + runId + " expects a number, got: " + value, e);
        }
    }

    private static Boolean toBoolean(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString().trim());
    }

    private static String toText(Object value) {
        return value == null ? null : value.toString();
    }

    private static void addIfPresent(List<String> out, String path) {
        if (path != null && !path.isBlank() && !out.contains(path)) {
            out.add(path);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> extras() {
        return extras;
    }

    public String getRunId() {
        return runId;
    }

    public void setRunId(String runId) {
        this.runId = runId;
    }

    public String getFlowcell() {
        return flowcell;
    }

    public void setFlowcell(String flowcell) {
        this.flowcell = flowcell;
    }

    public String getDevice() {
        return device;
    }

    public void setDevice(String device) {
        this.device = device;
    }

    public String getExperimentName() {
        return experimentName;
    }

    public void setExperimentName(String experimentName) {
        this.experimentName = experimentName;
    }

    public String getDate() {
        return date;
    }

    public void setDate(String date) {
        this.date = date;
    }

    public String getTime() {
        return time;
    }

    public void setTime(String time) {
        this.time = time;
    }

    public Long getTotalReads() {
        return totalReads;
    }

    public void setTotalReads(Long totalReads) {
        this.totalReads = totalReads;
    }

    public Long getTotalBases() {
        return totalBases;
    }

    public void setTotalBases(Long totalBases) {
        this.totalBases = totalBases;
    }

    public Boolean getHasPod5() {
        return hasPod5;
    }

    public void setHasPod5(Boolean hasPod5) {
        this.hasPod5 = hasPod5;
    }

    public Boolean getHasSummary() {
        return hasSummary;
    }

    public void setHasSummary(Boolean hasSummary) {
        this.hasSummary = hasSummary;
    }

    public Boolean getCanonical() {
        return canonical;
    }

    public void setCanonical(Boolean canonical) {
        this.canonical = canonical;
    }

    public Integer getNumMerged() {
        return numMerged;
    }

    public void setNumMerged(Integer numMerged) {
        this.numMerged = numMerged;
    }

    public Integer getPod5Files() {
        return pod5Files;
    }

    public void setPod5Files(Integer pod5Files) {
        this.pod5Files = pod5Files;
    }

    public Integer getFast5Files() {
        return fast5Files;
    }

    public void setFast5Files(Integer fast5Files) {
        this.fast5Files = fast5Files;
    }

    public Integer getFastqFiles() {
        return fastqFiles;
    }

    public void setFastqFiles(Integer fastqFiles) {
        this.fastqFiles = fastqFiles;
    }

    public Integer getBamFiles() {
        return bamFiles;
    }

    public void setBamFiles(Integer bamFiles) {
        this.bamFiles = bamFiles;
    }

    public String getCanonicalPath() {
        return canonicalPath;
    }

    public void setCanonicalPath(String canonicalPath) {
        this.canonicalPath = canonicalPath;
    }

    public String getCurrentPath() {
        return currentPath;
    }

    public void setCurrentPath(String currentPath) {
        this.currentPath = currentPath;
    }

    public List<String> getAllPaths() {
        return allPaths;
    }

    public void setAllPaths(List<String> allPaths) {
        this.allPaths = allPaths == null ? new ArrayList<>() : new ArrayList<>(allPaths);
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getArchivedReason() {
        return archivedReason;
    }

    public void setArchivedReason(String archivedReason) {
        this.archivedReason = archivedReason;
    }

    public String getArchivedAt() {
        return archivedAt;
    }

    public void setArchivedAt(String archivedAt) {
        this.archivedAt = archivedAt;
    }

    public String getRegisteredAt() {
        return registeredAt;
    }

    public void setRegisteredAt(String registeredAt) {
        this.registeredAt = registeredAt;
    }

    public String getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(String updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public String toString() {
        return "ExperimentRecord{run_id=" + runId + ", flowcell=" + flowcell + ", device=" + device
                + ", experiment_name=" + experimentName + ", date=" + date + ", time=" + time + "}";
    }
}
