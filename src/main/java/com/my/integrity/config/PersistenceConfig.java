package com.my.integrity.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 왜: 스냅샷 메타데이터와 복구 저널을 컨테이너 밖의 로컬 SQLite 파일 하나에 보관하기 위함.
 */
@ApplicationScoped
public class PersistenceConfig {

    static final String DATABASE_FILE = "integrity.db";

    @Produces
    @ApplicationScoped
    public DataSource dataSource(AppConfig appConfig) {
        return sqlite(Path.of(appConfig.store().path()).resolve(DATABASE_FILE));
    }

    public static DataSource sqlite(Path databaseFile) {
        try {
            Path parent = databaseFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new IllegalStateException("SQLite 경로 생성 실패: " + databaseFile, e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(5000);
        // 버전 번호 부여(최대값 조회 후 삽입)가 다른 프로세스와 겹치지 않도록 쓰기 잠금을 먼저 잡는다
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        return dataSource;
    }
}
