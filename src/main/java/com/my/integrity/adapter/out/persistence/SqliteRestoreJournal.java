package com.my.integrity.adapter.out.persistence;

import com.my.integrity.domain.model.RestoreJournalEntry;
import com.my.integrity.domain.model.RestorePhase;
import com.my.integrity.domain.port.out.ClockPort;
import com.my.integrity.domain.port.out.RestoreJournalPort;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;

import javax.sql.DataSource;
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
 * 왜: 복구 단계를 실행 전에 기록해 두어, 재시작한 프로세스가 중단된 복구와 운영자 조치가 필요한 실패를 알아볼 수 있게 하기 위함.
 */
@ApplicationScoped
public class SqliteRestoreJournal implements RestoreJournalPort {

    private static final String TABLE_DDL = """
            CREATE TABLE IF NOT EXISTS restore_journal (
                container TEXT PRIMARY KEY,
                snapshot_version INTEGER NOT NULL,
                phase TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                detail TEXT
            )
            """;

    private static final String UPSERT_SQL = """
            INSERT INTO restore_journal(container, snapshot_version, phase, updated_at, detail) VALUES (?, ?, ?, ?, ?)
            ON CONFLICT(container) DO UPDATE SET
                snapshot_version = excluded.snapshot_version,
                phase = excluded.phase,
                updated_at = excluded.updated_at,
                detail = excluded.detail
            """;
    private static final String SELECT_SQL = "SELECT container, snapshot_version, phase, updated_at, detail FROM restore_journal WHERE container = ?";
    private static final String SELECT_ALL_SQL = "SELECT container, snapshot_version, phase, updated_at, detail FROM restore_journal ORDER BY container";
    private static final String DELETE_SQL = "DELETE FROM restore_journal WHERE container = ?";

    private final DataSource dataSource;
    private final ClockPort clockPort;

    public SqliteRestoreJournal(DataSource dataSource, ClockPort clockPort) {
        this.dataSource = dataSource;
        this.clockPort = clockPort;
    }

    @PostConstruct
    void init() {
        try (Connection conn = dataSource.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute(TABLE_DDL);
        } catch (SQLException e) {
            throw new IllegalStateException("복구 저널 테이블 초기화 실패", e);
        }
    }

    @Override
    public void record(String container, int snapshotVersion, RestorePhase phase, String detail) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(UPSERT_SQL)) {
            ps.setString(1, container);
            ps.setInt(2, snapshotVersion);
            ps.setString(3, phase.name());
            ps.setString(4, clockPort.now().toString());
            ps.setString(5, detail);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("복구 저널 기록 실패: " + container + " " + phase, e);
        }
    }

    @Override
    public Optional<RestoreJournalEntry> find(String container) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(SELECT_SQL)) {
            ps.setString(1, container);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("복구 저널 조회 실패: " + container, e);
        }
    }

    @Override
    public List<RestoreJournalEntry> findAll() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(SELECT_ALL_SQL)) {
            List<RestoreJournalEntry> entries = new ArrayList<>();
            while (rs.next()) {
                entries.add(map(rs));
            }
            return entries;
        } catch (SQLException e) {
            throw new IllegalStateException("복구 저널 목록 조회 실패", e);
        }
    }

    @Override
    public void clear(String container) {
        try (Connection conn = dataSource.getConnection(); PreparedStatement ps = conn.prepareStatement(DELETE_SQL)) {
            ps.setString(1, container);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("복구 저널 삭제 실패: " + container, e);
        }
    }

    private RestoreJournalEntry map(ResultSet rs) throws SQLException {
        return new RestoreJournalEntry(
                rs.getString("container"),
                rs.getInt("snapshot_version"),
                RestorePhase.valueOf(rs.getString("phase")),
                OffsetDateTime.parse(rs.getString("updated_at")),
                rs.getString("detail")
        );
    }
}
