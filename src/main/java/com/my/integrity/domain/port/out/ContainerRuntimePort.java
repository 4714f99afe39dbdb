package com.my.integrity.domain.port.out;

import java.io.InputStream;
import java.util.List;

/**
 * 왜: Docker 등 런타임 종류를 코어 로직에서 분기하지 않고, 시작/정지/export/교체 능력 하나로 다루기 위함.
 *
 * <p>구현체는 연결 실패를 {@link com.my.integrity.domain.exception.RuntimeUnavailableException}으로 알린다.
 * 일시적 실패에 대한 재시도는 구현체 안에서 끝낸다.
 */
public interface ContainerRuntimePort {
    void start(String container);
    void stop(String container);
    boolean isRunning(String container);
    List<String> listRunning();

    /** 컨테이너 파일시스템 전체를 tar 스트림으로 읽는다. 호출자가 스트림을 닫는다. */
    InputStream exportFilesystem(String container);

    /** 정지된 컨테이너의 파일시스템을 tar 아카이브 내용으로 교체한다. 복구에서만 사용한다. */
    void replaceFilesystem(String container, InputStream archive);
}
