package io.ontregistry.storage;

import io.ontregistry.config.RegistryConfig;
import io.ontregistry.model.ExperimentEntry;
import io.ontregistry.model.ExperimentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * SQLite table of experiment directories, keyed by path. Serves as a second "current" source for
 * reconciliation next to the registry document.
 */
public final class ExperimentDatabase {
    private static final Logger log = LoggerFactory.getLogger(ExperimentDatabase.class);

    private final Path dbFile;
    private final String jdbcUrl;
    private final Clock clock;

    public ExperimentDatabase(RegistryConfig config) {
        this(config.dbFile(), Clock.systemUTC());
    }

    public ExperimentDatabase(Path dbFile, Clock clock) {
        this.dbFile = dbFile;
        this.jdbcUrl = "jdbc:sqlite:" + dbFile.toString();
        this.clock = clock;
    }

    public Path dbFile() {
        return dbFile;
    }

    public void init() {
        initDirectories();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    public int upsert(List<ExperimentEntry> entries) {
        int written = 0;
        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO experiments(experiment_path,sample_id,flow_cell_id,protocol_group_id,instrument,
                                            started,pod5_files,fast5_files,fastq_files,bam_files,updated_at)
                    VALUES(?,?,?,?,?,?,?,?,?,?,?)
                    ON CONFLICT(experiment_path) DO UPDATE SET
                        sample_id=excluded.sample_id,
                        flow_cell_id=excluded.flow_cell_id,
                        protocol_group_id=excluded.protocol_group_id,
                        instrument=excluded.instrument,
                        started=excluded.started,
                        pod5_files=excluded.pod5_files,
                        fast5_files=excluded.fast5_files,
                        fastq_files=excluded.fastq_files,
                        bam_files=excluded.bam_files,
                        updated_at=excluded.updated_at
                    """)) {
                String now = Instant.now(clock).toString();
                for (ExperimentEntry e : entries) {
                    if (e.path().isBlank()) {
                        continue;
                    }
                    ps.setString(1, e.path());
                    ps.setString(2, e.sampleId());
                    ps.setString(3, e.flowCellId());
                    ps.setString(4, e.protocolGroupId());
                    ps.setString(5, e.instrument());
                    ps.setString(6, e.started());
                    ps.setInt(7, e.pod5Files());
                    ps.setInt(8, e.fast5Files());
                    ps.setInt(9, e.fastqFiles());
                    ps.setInt(10, e.bamFiles());
                    ps.setString(11, now);
                    ps.executeUpdate();
                    written++;
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RegistryIoException("Failed to write experiments to " + dbFile, e);
        }
        log.info("[DB] Upserted {} experiments into {}", written, dbFile);
        return written;
    }

    /**
     * Every row as a record keyed by path. A missing database file or table yields an empty map.
     */
    public Map<String, ExperimentRecord> loadByPath() {
        Map<String, ExperimentRecord> out = new LinkedHashMap<>();
        if (!Files.exists(dbFile)) {
            return out;
        }
        try (Connection conn = openConnection()) {
            Set<String> columns = columns(conn);
            if (columns.isEmpty()) {
                log.warn("[DB] {} has no experiments table", dbFile);
                return out;
            }
            String fast5 = columns.contains("fast5_files") ? "fast5_files" : "0 AS fast5_files";
            try (Statement st = conn.createStatement();
                 ResultSet rs = st.executeQuery(
                         "SELECT experiment_path, sample_id, flow_cell_id, protocol_group_id, instrument, started, "
                                 + "pod5_files, " + fast5 + ", fastq_files, bam_files "
                                 + "FROM experiments ORDER BY experiment_path")) {
                while (rs.next()) {
                    ExperimentRecord record = new ExperimentRecord();
                    String path = rs.getString("experiment_path");
                    record.setCurrentPath(path);
                    record.setFlowcell(rs.getString("flow_cell_id"));
                    record.setDevice(rs.getString("instrument"));
                    String group = rs.getString("protocol_group_id");
                    record.setExperimentName(group == null || group.isBlank() ? rs.getString("sample_id") : group);
                    record.setPod5Files(rs.getInt("pod5_files"));
                    record.setFast5Files(rs.getInt("fast5_files"));
                    record.setFastqFiles(rs.getInt("fastq_files"));
                    record.setBamFiles(rs.getInt("bam_files"));
                    out.put(path, record);
                }
            }
        } catch (SQLException e) {
            throw new RegistryIoException("Failed to read experiments from " + dbFile, e);
        }
        return out;
    }

    private void initDirectories() {
        try {
            Path parent = dbFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new RegistryIoException("Failed to create directory for " + dbFile, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS experiments (
                        experiment_path TEXT PRIMARY KEY,
                        sample_id TEXT NOT NULL DEFAULT '',
                        flow_cell_id TEXT NOT NULL DEFAULT '',
                        protocol_group_id TEXT NOT NULL DEFAULT '',
                        instrument TEXT NOT NULL DEFAULT '',
                        started TEXT NOT NULL DEFAULT '',
                        pod5_files INTEGER NOT NULL DEFAULT 0,
                        fast5_files INTEGER NOT NULL DEFAULT 0,
                        fastq_files INTEGER NOT NULL DEFAULT 0,
                        bam_files INTEGER NOT NULL DEFAULT 0,
                        updated_at TEXT
                    )
                    """);
            ensureExperimentColumns(conn);
            st.execute("CREATE INDEX IF NOT EXISTS idx_experiments_flow_cell ON experiments(flow_cell_id)");
        } catch (SQLException e) {
            throw new RegistryIoException("Failed to initialize SQLite schema in " + dbFile, e);
        }
    }

    // Databases written by older discoverers lack the fast5 column.
    private void ensureExperimentColumns(Connection conn) throws SQLException {
        Set<String> columns = columns(conn);
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("fast5_files")) {
                st.execute("ALTER TABLE experiments ADD COLUMN fast5_files INTEGER NOT NULL DEFAULT 0");
            }
            if (!columns.contains("updated_at")) {
                st.execute("ALTER TABLE experiments ADD COLUMN updated_at TEXT");
            }
        }
    }

    private static Set<String> columns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(experiments)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }
}
