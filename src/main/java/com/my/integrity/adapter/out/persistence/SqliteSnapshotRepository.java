package com.my.integrity.adapter.out.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.integrity.config.AppConfig;
import com.my.integrity.domain.exception.SnapshotCorruptedException;
import com.my.integrity.domain.model.ManifestEntry;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.port.out.SnapshotRepositoryPort;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import javax.sql.DataSource;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 아카이브는 파일로, 메타데이터는 SQLite로 추가 전용 보관하고, 아카이브를 먼저 확정한 뒤에만 버전을 기록하기 위함.
 */
@ApplicationScoped
public class SqliteSnapshotRepository implements SnapshotRepositoryPort {

    private static final Logger log = Logger.getLogger(SqliteSnapshotRepository.class);

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS snapshots (
                container TEXT NOT NULL,
                version INTEGER NOT NULL,
                created_at TEXT NOT NULL,
                digest TEXT NOT NULL,
                algorithm TEXT NOT NULL,
                exclusions TEXT NOT NULL,
                archive TEXT NOT NULL,
                entry_count INTEGER NOT NULL,
                PRIMARY KEY (container, version)
            )
            """;

    private static final String COLUMNS = "container, version, created_at, digest, algorithm, exclusions, archive, entry_count";
    private static final String NEXT_VERSION_SQL = "SELECT COALESCE(MAX(version), 0) + 1 FROM snapshots WHERE container = ?";
    private static final String INSERT_SQL = "INSERT INTO snapshots(" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
    private static final String SELECT_LATEST_SQL = "SELECT " + COLUMNS + " FROM snapshots WHERE container = ? ORDER BY version DESC LIMIT 1";
    private static final String SELECT_VERSION_SQL = "SELECT " + COLUMNS + " FROM snapshots WHERE container = ? AND version = ?";
    private static final String SELECT_ALL_SQL = "SELECT " + COLUMNS + " FROM snapshots WHERE container = ? ORDER BY version";
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Path storeRoot;

    @Inject
    public SqliteSnapshotRepository(DataSource dataSource, AppConfig appConfig, ObjectMapper objectMapper) {
        this(dataSource, Path.of(appConfig.store().path()), objectMapper);
    }

    SqliteSnapshotRepository(DataSource dataSource, Path storeRoot, ObjectMapper objectMapper) {
        this.dataSource = dataSource;
        this.storeRoot = storeRoot;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    void init() {
        try {
            Files.createDirectories(storeRoot.resolve("archives"));
            Files.createDirectories(storeRoot.resolve("staging"));
        } catch (IOException e) {
            throw new IllegalStateException("스냅샷 저장소 경로 생성 실패: " + storeRoot, e);
        }
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("스냅샷 테이블 초기화 실패", e);
        }
    }

    @Override
    public Path stagingFile(String container) {
        try {
            Path staging = Files.createDirectories(storeRoot.resolve("staging"));
            return Files.createTempFile(staging, container + "-", ".tar");
        } catch (IOException e) {
            throw new IllegalStateException("임시 아카이브 생성 실패: " + container, e);
        }
    }

    @Override
    public Snapshot append(String container, OffsetDateTime createdAt, String digest, String algorithm,
                           List<String> exclusions, int entryCount, Path stagedArchive) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            int version = nextVersion(conn, container);
            String archive = "archives/" + container + "/v" + version + ".tar";
            Path target = storeRoot.resolve(archive);
            moveIntoPlace(stagedArchive, target);
            Snapshot snapshot = new Snapshot(container, version, createdAt, digest, algorithm, exclusions, archive, entryCount);
            try (PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
                ps.setString(1, container);
                ps.setInt(2, version);
                ps.setString(3, createdAt.toString());
                ps.setString(4, digest);
                ps.setString(5, algorithm);
                ps.setString(6, objectMapper.writeValueAsString(exclusions));
                ps.setString(7, archive);
                ps.setInt(8, entryCount);
                ps.executeUpdate();
                conn.commit();
            } catch (SQLException | JsonProcessingException e) {
                conn.rollback();
                Files.deleteIfExists(target);
                throw new IllegalStateException("스냅샷 기록 실패: " + container + " v" + version, e);
            }
            target.toFile().setReadOnly();
            return snapshot;
        } catch (SQLException | IOException e) {
            throw new IllegalStateException("스냅샷 기록 실패: " + container, e);
        }
    }

    private int nextVersion(Connection conn, String container) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(NEXT_VERSION_SQL)) {
            ps.setString(1, container);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private void moveIntoPlace(Path staged, Path target) throws IOException {
        Files.createDirectories(target.getParent());
        if (Files.exists(target)) {
            // 기록되지 않은 이전 시도의 잔여물. 메타데이터가 없으므로 참조되지 않는다.
            log.warnf("참조되지 않는 아카이브를 교체합니다: %s", target);
            target.toFile().setWritable(true);
        }
        try {
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Optional<Snapshot> findLatest(String container) {
        return querySingle(SELECT_LATEST_SQL, container, null);
    }

    @Override
    public Optional<Snapshot> findVersion(String container, int version) {
        return querySingle(SELECT_VERSION_SQL, container, version);
    }

    @Override
    public List<Snapshot> findAll(String container) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_ALL_SQL)) {
            ps.setString(1, container);
            try (ResultSet rs = ps.executeQuery()) {
                List<Snapshot> snapshots = new ArrayList<>();
                while (rs.next()) {
                    snapshots.add(map(rs));
                }
                return snapshots;
            }
        } catch (SQLException e) {
            throw new IllegalStateException("스냅샷 목록 조회 실패: " + container, e);
        }
    }

    private Optional<Snapshot> querySingle(String sql, String container, Integer version) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, container);
            if (version != null) {
                ps.setInt(2, version);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("스냅샷 조회 실패: " + container, e);
        }
    }

    private Snapshot map(ResultSet rs) throws SQLException {
        String container = rs.getString("container");
        int version = rs.getInt("version");
        List<String> exclusions;
        try {
            exclusions = objectMapper.readValue(rs.getString("exclusions"), STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new SnapshotCorruptedException("스냅샷 제외 규칙을 해석할 수 없습니다: " + container + " v" + version, e);
        }
        return new Snapshot(
                container,
                version,
                OffsetDateTime.parse(rs.getString("created_at")),
                rs.getString("digest"),
                rs.getString("algorithm"),
                exclusions,
                rs.getString("archive"),
                rs.getInt("entry_count")
        );
    }

    @Override
    public InputStream openArchive(Snapshot snapshot) {
        Path path = storeRoot.resolve(snapshot.archive());
        try {
            return new BufferedInputStream(Files.newInputStream(path));
        } catch (NoSuchFileException e) {
            throw new SnapshotCorruptedException("스냅샷 아카이브가 없습니다: " + path, e);
        } catch (IOException e) {
            throw new SnapshotCorruptedException("스냅샷 아카이브를 열 수 없습니다: " + path, e);
        }
    }

    @Override
    public void saveManifest(String container, String label, List<ManifestEntry> manifest) {
        Path path = storeRoot.resolve("manifests").resolve(container).resolve(label + ".json");
        try {
            Files.createDirectories(path.getParent());
            try (OutputStream out = Files.newOutputStream(path)) {
                objectMapper.writeValue(out, manifest);
            }
        } catch (IOException e) {
            throw new IllegalStateException("매니페스트 기록 실패: " + path, e);
        }
    }
}
