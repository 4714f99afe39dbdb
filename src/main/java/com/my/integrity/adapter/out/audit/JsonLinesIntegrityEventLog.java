package com.my.integrity.adapter.out.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.my.integrity.config.AppConfig;
import com.my.integrity.domain.model.IntegrityEvent;
import com.my.integrity.domain.port.out.IntegrityEventPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Stream;

/**
 * 왜: 감사 기록을 한 줄에 하나씩 추가만 하는 파일로 남겨, 기존 기록을 고치지 않고 외부 도구가 그대로 수집할 수 있게 하기 위함.
 */
@ApplicationScoped
public class JsonLinesIntegrityEventLog implements IntegrityEventPort {

    private static final Logger log = Logger.getLogger(JsonLinesIntegrityEventLog.class);
    static final String FILE_NAME = "events.jsonl";
    private static final int INITIAL_WINDOW = 1024;

    private final Path logPath;
    private final ObjectMapper objectMapper;

    @Inject
    public JsonLinesIntegrityEventLog(AppConfig appConfig, ObjectMapper objectMapper) {
        this(Path.of(appConfig.store().path()).resolve(FILE_NAME), objectMapper);
    }

    public JsonLinesIntegrityEventLog(Path logPath, ObjectMapper objectMapper) {
        this.logPath = logPath;
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
        try {
            Path parent = logPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(logPath)) {
                Files.createFile(logPath);
            }
        } catch (IOException e) {
            throw new IllegalStateException("감사 로그 파일 초기화 실패: " + logPath, e);
        }
    }

    @Override
    public synchronized void append(IntegrityEvent event) {
        try {
            String entry = objectMapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(logPath, entry, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new IllegalStateException("감사 로그 기록 실패: " + event.container(), e);
        }
    }

    @Override
    public List<IntegrityEvent> recent(String container, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Deque<IntegrityEvent> window = new ArrayDeque<>(Math.min(limit, INITIAL_WINDOW));
        try (Stream<String> lines = Files.lines(logPath)) {
            lines.filter(line -> !line.isBlank())
                    .map(this::parse)
                    .filter(event -> event != null && event.container().equals(container))
                    .forEachOrdered(event -> {
                        if (window.size() == limit) {
                            window.removeFirst();
                        }
                        window.addLast(event);
                    });
        } catch (IOException e) {
            throw new IllegalStateException("감사 로그 조회 실패", e);
        }
        return List.copyOf(window);
    }

    private IntegrityEvent parse(String line) {
        try {
            return objectMapper.readValue(line, IntegrityEvent.class);
        } catch (JsonProcessingException e) {
            log.warnf("해석할 수 없는 감사 로그 줄을 건너뜁니다: %s", e.getOriginalMessage());
            return null;
        }
    }
}
