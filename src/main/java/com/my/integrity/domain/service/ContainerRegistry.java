package com.my.integrity.domain.service;

import com.my.integrity.domain.model.ContainerState;
import com.my.integrity.domain.model.MonitoredContainer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * 왜: 감시 대상 목록을 전역 상태가 아닌 스케줄러 인스턴스가 소유하는 스레드 안전 맵으로 두고, 항목 단위로만 갱신하기 위함.
 */
public class ContainerRegistry {

    private final ConcurrentMap<String, MonitoredContainer> entries = new ConcurrentHashMap<>();

    public void register(MonitoredContainer container) {
        if (entries.putIfAbsent(container.name(), container) != null) {
            throw new IllegalArgumentException("이미 감시 중인 컨테이너입니다: " + container.name());
        }
    }

    public Optional<MonitoredContainer> find(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public MonitoredContainer require(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("감시 대상이 아닙니다: " + name));
    }

    /**
     * 상태 전이 규칙을 검사한 뒤 항목을 교체한다. 규칙 위반이면 항목을 바꾸지 않고 {@link IllegalStateException}을 던진다.
     */
    public Transition transition(String name, ContainerState next, UnaryOperator<MonitoredContainer> update) {
        AtomicReference<ContainerState> previous = new AtomicReference<>();
        MonitoredContainer updated = entries.compute(name, (key, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("감시 대상이 아닙니다: " + name);
            }
            if (!current.state().canTransitionTo(next)) {
                throw new IllegalStateException("허용되지 않은 상태 전이: " + name + " " + current.state() + " -> " + next);
            }
            previous.set(current.state());
            return update.apply(current.withState(next));
        });
        return new Transition(previous.get(), updated);
    }

    /** 상태는 그대로 두고 부가 정보(마지막 점검 시각 등)만 갱신한다. */
    public MonitoredContainer update(String name, UnaryOperator<MonitoredContainer> update) {
        return entries.computeIfPresent(name, (key, current) -> {
            MonitoredContainer next = update.apply(current);
            if (next.state() != current.state()) {
                throw new IllegalStateException("상태 변경은 transition으로만 가능합니다: " + name);
            }
            return next;
        });
    }

    public List<MonitoredContainer> all() {
        List<MonitoredContainer> list = new ArrayList<>(entries.values());
        list.sort(Comparator.comparing(MonitoredContainer::name));
        return list;
    }

    public record Transition(ContainerState from, MonitoredContainer current) {
        public boolean changed() {
            return from != current.state();
        }
    }
}
