package com.my.integrity.domain.port.out;

import com.my.integrity.domain.model.ManifestEntry;
import com.my.integrity.domain.model.Snapshot;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 왜: 기준선 아카이브와 메타데이터를 컨테이너와 분리된 저장소에 추가 전용으로 보관해, 컨테이너가 침해되어도 기준선이 오염되지 않게 하기 위함.
 */
public interface SnapshotRepositoryPort {

    /** 아카이브를 기록할 임시 파일. {@link #append}로 확정하거나 호출자가 삭제한다. */
    Path stagingFile(String container);

    /**
     * 다음 버전 번호를 부여하고 임시 아카이브를 확정 위치로 옮긴 뒤 메타데이터를 기록한다.
     */
    Snapshot append(String container, OffsetDateTime createdAt, String digest, String algorithm,
                    List<String> exclusions, int entryCount, Path stagedArchive);

    Optional<Snapshot> findLatest(String container);

    Optional<Snapshot> findVersion(String container, int version);

    List<Snapshot> findAll(String container);

    InputStream openArchive(Snapshot snapshot);

    void saveManifest(String container, String label, List<ManifestEntry> manifest);
}
