package com.ryuqq.controlplane.adapter.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.controlplane.core.spi.BackingStore;
import com.ryuqq.controlplane.core.spi.BackingStoreException;
import com.ryuqq.controlplane.core.state.EntityCollection;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.util.Jsons;
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
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 컬렉션마다 테이블 하나를 두는 정규화 SQLite {@link BackingStore}.
 *
 * <p><strong>테이블 구조 (컬렉션별):</strong></p>
 * <pre>
 * cp_&lt;collection&gt; (
 *   row_key      TEXT PRIMARY KEY,   -- 컬렉션별 키 함수 결과
 *   position     INTEGER NOT NULL,   -- 배열 순서
 *   workspace_id TEXT,               -- 인덱스용 스칼라 컬럼
 *   status       TEXT,
 *   payload_json TEXT NOT NULL,
 *   updated_at   TEXT NOT NULL
 * )
 * </pre>
 *
 * <p><strong>저장 (최소 diff):</strong></p>
 * <ul>
 *   <li>키, 위치, 페이로드가 모두 같은 행 → 건너뜀</li>
 *   <li>변경되었거나 위치가 바뀐 행 → upsert</li>
 *   <li>다음 상태에 없는 행 → 삭제</li>
 * </ul>
 * <p>비교 기준은 테이블에 저장된 현재 행이며, 모든 변경은 하나의 JDBC 트랜잭션으로 커밋됩니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class NormalizedJdbcStore implements BackingStore {

    private static final Logger log = LoggerFactory.getLogger(NormalizedJdbcStore.class);

    public static final int SCHEMA_VERSION = 1;
    private static final String META_TABLE = "cp_state_meta";

    private final String jdbcUrl;
    private final ObjectMapper mapper = Jsons.mapper();
    private volatile SaveStats lastSaveStats = SaveStats.NONE;

    /**
     * SQLite 파일 경로로 생성하고 스키마를 초기화합니다.
     *
     * @param dbFile 데이터베이스 파일 (상위 디렉토리는 생성됨)
     */
    public NormalizedJdbcStore(Path dbFile) {
        if (dbFile == null) {
            throw new IllegalArgumentException("dbFile cannot be null");
        }
        Path absolute = dbFile.toAbsolutePath();
        try {
            Files.createDirectories(absolute.getParent());
        } catch (IOException e) {
            throw new BackingStoreException("Failed to create database directory: " + absolute.getParent(), e);
        }
        this.jdbcUrl = "jdbc:sqlite:" + absolute;
        initSchema();
    }

    /**
     * 모든 컬렉션을 담는 키 함수.
     *
     * <p>memberships는 (workspaceId, userId), authTokens는 토큰 문자열,
     * deviceCodes는 코드 문자열, 나머지는 id를 키로 사용합니다.</p>
     */
    static String rowKey(EntityCollection collection, JsonNode row) {
        switch (collection) {
            case MEMBERSHIPS:
                return row.path("workspaceId").asText() + ":" + row.path("userId").asText();
            case AUTH_TOKENS:
                return row.path("token").asText();
            case DEVICE_CODES:
                return row.path("code").asText();
            default:
                return row.path("id").asText();
        }
    }

    static String tableName(EntityCollection collection) {
        return "cp_" + collection.name().toLowerCase();
    }

    @Override
    public boolean supportsScopedLoad() {
        return true;
    }

    @Override
    public StateDocument load() {
        return loadCollections(EntityCollection.all());
    }

    @Override
    public StateDocument loadCollections(Set<EntityCollection> collections) {
        if (collections == null) {
            throw new IllegalArgumentException("collections cannot be null");
        }
        ObjectNode root = mapper.createObjectNode();
        try (Connection conn = openConnection()) {
            for (EntityCollection collection : collections) {
                ArrayNode rows = root.putArray(collection.fieldName());
                try (Statement st = conn.createStatement();
                     ResultSet rs = st.executeQuery(
                         "SELECT payload_json FROM " + tableName(collection) + " ORDER BY position, row_key")) {
                    while (rs.next()) {
                        rows.add(mapper.readTree(rs.getString(1)));
                    }
                }
            }
            return mapper.treeToValue(root, StateDocument.class);
        } catch (SQLException | JsonProcessingException e) {
            throw new BackingStoreException("Failed to load state from " + jdbcUrl, e);
        }
    }

    @Override
    public void save(StateDocument next, StateDocument previous, Set<EntityCollection> collections) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (collections == null) {
            throw new IllegalArgumentException("collections cannot be null");
        }
        JsonNode document = mapper.valueToTree(next);
        String updatedAt = Instant.now().toString();
        int upserted = 0;
        int deleted = 0;
        int skipped = 0;

        try (Connection conn = openConnection()) {
            conn.setAutoCommit(false);
            try {
                for (EntityCollection collection : collections) {
                    CollectionDiff diff = saveCollection(conn, collection, document.path(collection.fieldName()), updatedAt);
                    upserted += diff.upserted();
                    deleted += diff.deleted();
                    skipped += diff.skipped();
                }
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new BackingStoreException("Failed to save state to " + jdbcUrl, e);
        }

        lastSaveStats = new SaveStats(upserted, deleted, skipped);
        log.debug("Saved state: upserted={}, deleted={}, skipped={}", upserted, deleted, skipped);
    }

    /**
     * 마지막 성공한 save의 행 통계.
     */
    public SaveStats lastSaveStats() {
        return lastSaveStats;
    }

    /**
     * 메타 테이블에 기록된 스키마 버전.
     */
    public int schemaVersion() {
        try (Connection conn = openConnection()) {
            return readSchemaVersion(conn);
        } catch (SQLException e) {
            throw new BackingStoreException("Failed to read schema version", e);
        }
    }

    // ========================================
    // Diff
    // ========================================

    private CollectionDiff saveCollection(Connection conn, EntityCollection collection, JsonNode rows, String updatedAt)
            throws SQLException {
        Map<String, StoredRow> existing = readRows(conn, collection);
        Set<String> seen = new HashSet<>();
        int upserted = 0;
        int skipped = 0;

        String upsertSql = "INSERT INTO " + tableName(collection)
            + " (row_key, position, workspace_id, status, payload_json, updated_at) VALUES (?, ?, ?, ?, ?, ?)"
            + " ON CONFLICT(row_key) DO UPDATE SET position=excluded.position, workspace_id=excluded.workspace_id,"
            + " status=excluded.status, payload_json=excluded.payload_json, updated_at=excluded.updated_at";

        try (PreparedStatement upsert = conn.prepareStatement(upsertSql)) {
            int position = 0;
            for (JsonNode row : rows) {
                String key = rowKey(collection, row);
                if (key.isEmpty()) {
                    throw new BackingStoreException("Row without key in " + collection.fieldName(), null);
                }
                if (!seen.add(key)) {
                    throw new BackingStoreException("Duplicate row key '" + key + "' in " + collection.fieldName(), null);
                }
                String payload = serialize(row);
                StoredRow stored = existing.get(key);
                if (stored != null && stored.position() == position && stored.payload().equals(payload)) {
                    skipped++;
                } else {
                    upsert.setString(1, key);
                    upsert.setInt(2, position);
                    upsert.setString(3, textOrNull(row, "workspaceId"));
                    upsert.setString(4, textOrNull(row, "status"));
                    upsert.setString(5, payload);
                    upsert.setString(6, updatedAt);
                    upsert.addBatch();
                    upserted++;
                }
                position++;
            }
            if (upserted > 0) {
                upsert.executeBatch();
            }
        }

        int deleted = 0;
        try (PreparedStatement delete = conn.prepareStatement(
                "DELETE FROM " + tableName(collection) + " WHERE row_key = ?")) {
            for (String key : existing.keySet()) {
                if (!seen.contains(key)) {
                    delete.setString(1, key);
                    delete.addBatch();
                    deleted++;
                }
            }
            if (deleted > 0) {
                delete.executeBatch();
            }
        }
        return new CollectionDiff(upserted, deleted, skipped);
    }

    private Map<String, StoredRow> readRows(Connection conn, EntityCollection collection) throws SQLException {
        Map<String, StoredRow> rows = new HashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT row_key, position, payload_json FROM " + tableName(collection))) {
            while (rs.next()) {
                rows.put(rs.getString(1), new StoredRow(rs.getInt(2), rs.getString(3)));
            }
        }
        return rows;
    }

    private String serialize(JsonNode row) {
        try {
            return mapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new BackingStoreException("Failed to serialize row", e);
        }
    }

    private static String textOrNull(JsonNode row, String field) {
        JsonNode value = row.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    // ========================================
    // Schema
    // ========================================

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("""
                CREATE TABLE IF NOT EXISTS cp_state_meta (
                    meta_key TEXT PRIMARY KEY,
                    meta_value TEXT NOT NULL
                )
                """);
            for (EntityCollection collection : EntityCollection.all()) {
                String table = tableName(collection);
                st.execute("""
                    CREATE TABLE IF NOT EXISTS %s (
                        row_key TEXT PRIMARY KEY,
                        position INTEGER NOT NULL,
                        workspace_id TEXT,
                        status TEXT,
                        payload_json TEXT NOT NULL,
                        updated_at TEXT NOT NULL
                    )
                    """.formatted(table));
                st.execute("CREATE INDEX IF NOT EXISTS idx_%s_position ON %s(position)".formatted(table, table));
                st.execute("CREATE INDEX IF NOT EXISTS idx_%s_workspace ON %s(workspace_id)".formatted(table, table));
            }
            st.execute("INSERT OR IGNORE INTO " + META_TABLE + "(meta_key, meta_value) VALUES('schema_version', '"
                + SCHEMA_VERSION + "')");

            int version = readSchemaVersion(conn);
            if (version != SCHEMA_VERSION) {
                throw new BackingStoreException(
                    "Unsupported schema version " + version + " (expected " + SCHEMA_VERSION + ")", null);
            }
            log.info("Normalized store ready: url={}, schemaVersion={}", jdbcUrl, version);
        } catch (SQLException e) {
            throw new BackingStoreException("Failed to initialize schema at " + jdbcUrl, e);
        }
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT meta_value FROM " + META_TABLE + " WHERE meta_key = 'schema_version'");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? Integer.parseInt(rs.getString(1)) : 0;
        }
    }

    private record StoredRow(int position, String payload) {
    }

    private record CollectionDiff(int upserted, int deleted, int skipped) {
    }

    /**
     * save 한 번의 행 단위 통계.
     *
     * @param upserted 새로 쓰거나 갱신한 행 수
     * @param deleted 삭제한 행 수
     * @param skipped 변경이 없어 건너뛴 행 수
     */
    public record SaveStats(int upserted, int deleted, int skipped) {

        public static final SaveStats NONE = new SaveStats(0, 0, 0);
    }
}
