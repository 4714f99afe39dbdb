package com.my.integrity.config;

import com.my.integrity.domain.hash.DigestAlgorithm;
import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;

@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        validate(LaunchMode.current() == LaunchMode.NORMAL);
    }

    /** 운영 모드(strict)에서는 경고 대신 기동을 실패시킨다. */
    void validate(boolean strict) {
        validateStorePath(appConfig.store().path(), strict);
        validateExclusions(strict);
        validateAlgorithm(appConfig.hash().algorithm());
        validateZone(appConfig.clock().zone());
        validatePositive("integrity.hash.max-concurrent", appConfig.hash().maxConcurrent());
        validatePositive("integrity.monitor.workers", appConfig.monitor().workers());
        validatePositive("integrity.monitor.interval-seconds", appConfig.monitor().intervalSeconds());
        validatePositive("integrity.monitor.operation-timeout-seconds", appConfig.monitor().operationTimeoutSeconds());
        validatePositive("integrity.docker.read-timeout-seconds", appConfig.docker().readTimeoutSeconds());
    }

    private void validateStorePath(String path, boolean strict) {
        Path resolved = Path.of(path);
        try {
            Files.createDirectories(resolved);
        } catch (IOException e) {
            String message = "스냅샷 저장소 경로를 만들 수 없습니다: integrity.store.path=" + path;
            if (strict) {
                throw new IllegalStateException(message, e);
            }
            log.warn(message);
        }
    }

    private void validateExclusions(boolean strict) {
        if (appConfig.hash().exclusions().isEmpty()) {
            String message = "제외 목록이 비어 있습니다. /proc, /tmp 등 휘발성 경로 때문에 오탐이 발생합니다: integrity.hash.exclusions";
            if (strict) {
                throw new IllegalStateException(message);
            }
            log.warn(message);
        }
    }

    private void validateAlgorithm(String algorithm) {
        try {
            DigestAlgorithm.of(algorithm);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("지원하지 않는 다이제스트 알고리즘입니다: integrity.hash.algorithm=" + algorithm, e);
        }
    }

    private void validateZone(String zone) {
        try {
            ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new IllegalStateException("알 수 없는 시간대입니다: integrity.clock.zone=" + zone, e);
        }
    }

    private void validatePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalStateException("1 이상이어야 합니다: " + name + "=" + value);
        }
    }
}
