package com.my.integrity.domain.service;

import com.my.integrity.domain.exception.IntegrityException;
import com.my.integrity.domain.exception.RestoreInProgressException;
import com.my.integrity.domain.model.CheckResult;
import com.my.integrity.domain.model.ContainerState;
import com.my.integrity.domain.model.MonitorPolicy;
import com.my.integrity.domain.model.MonitoredContainer;
import com.my.integrity.domain.model.RestoreJournalEntry;
import com.my.integrity.domain.model.RestoreOutcome;
import com.my.integrity.domain.model.Snapshot;
import com.my.integrity.domain.port.in.BaselineUseCase;
import com.my.integrity.domain.port.in.CheckIntegrityUseCase;
import com.my.integrity.domain.port.in.RestoreUseCase;
import com.my.integrity.domain.port.out.ClockPort;
import com.my.integrity.domain.port.out.RestoreJournalPort;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * 왜: 여러 컨테이너의 점검을 제한된 작업자 풀에서 주기적으로 실행하고, 판정에 따라 경보 또는 자동 복구로 이어지게 하기 위함.
 *
 * <p>같은 컨테이너의 점검/복구는 동시에 실행되지 않는다. 이전 작업이 끝나지 않은 주기는 대기열에 쌓지 않고 건너뛴다.
 * 점검은 제한 시간을 넘기면 인터럽트로 중단되고 다음 주기에 재시도된다. 복구는 중간에 끊지 않는다.
 */
public class MonitorScheduler {

    private static final Logger log = Logger.getLogger(MonitorScheduler.class);

    private static final int PENDING = 0;
    private static final int RUNNING = 1;
    private static final int ABANDONED = 2;

    private final CheckIntegrityUseCase detector;
    private final RestoreUseCase restorer;
    private final BaselineUseCase baselines;
    private final RestoreJournalPort journal;
    private final ClockPort clock;
    private final Settings settings;

    private final ContainerRegistry registry = new ContainerRegistry();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final List<ScheduledFuture<?>> ticks = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService ticker;
    private final ThreadPoolExecutor workers;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean stopping = new AtomicBoolean();
    private final CountDownLatch terminated = new CountDownLatch(1);

    public MonitorScheduler(CheckIntegrityUseCase detector,
                            RestoreUseCase restorer,
                            BaselineUseCase baselines,
                            RestoreJournalPort journal,
                            ClockPort clock,
                            Settings settings) {
        this.detector = detector;
        this.restorer = restorer;
        this.baselines = baselines;
        this.journal = journal;
        this.clock = clock;
        this.settings = settings;
        this.ticker = Executors.newSingleThreadScheduledExecutor(threads("integrity-ticker-", true));
        this.workers = new ThreadPoolExecutor(settings.workers(), settings.workers(), 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), threads("integrity-worker-", false));
    }

    public record Settings(int workers, Duration operationTimeout, Duration shutdownGrace) {
        public Settings {
            Objects.requireNonNull(operationTimeout, "operationTimeout");
            Objects.requireNonNull(shutdownGrace, "shutdownGrace");
            if (workers < 1) {
                throw new IllegalArgumentException("workers는 1 이상이어야 합니다: " + workers);
            }
        }
    }

    ContainerRegistry registry() {
        return registry;
    }

    /**
     * 스냅샷이 없는 컨테이너는 등록할 수 없다. 복구 실패 보류가 남아 있으면 RESTORE_FAILED로 시작한다.
     */
    public MonitoredContainer register(String container, Duration interval, MonitorPolicy policy) {
        Snapshot snapshot = baselines.latest(container);
        MonitoredContainer monitored = MonitoredContainer.watch(snapshot, interval, policy);
        if (journal.find(container).map(RestoreJournalEntry::isHold).orElse(false)) {
            monitored = monitored.withState(ContainerState.RESTORE_FAILED);
        }
        registry.register(monitored);
        log.infof("감시 등록: %s (기준선 v%d, 주기 %ds, 정책 %s, 상태 %s)", container, snapshot.version(),
                interval.toSeconds(), policy, monitored.state());
        return monitored;
    }

    /**
     * 컨테이너별 첫 점검을 {@code i * 주기 / n}만큼 늦춰 해시 I/O가 한꺼번에 몰리지 않게 한다.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("이미 시작된 스케줄러입니다");
        }
        List<MonitoredContainer> containers = registry.all();
        int count = containers.size();
        for (int i = 0; i < count; i++) {
            MonitoredContainer container = containers.get(i);
            long intervalMillis = container.pollInterval().toMillis();
            long initialDelay = intervalMillis * i / count;
            ticks.add(ticker.scheduleWithFixedDelay(() -> tick(container.name()),
                    initialDelay, intervalMillis, TimeUnit.MILLISECONDS));
        }
        log.infof("감시 시작: 컨테이너 %d개, 작업자 %d개, 작업 제한 시간 %ds", count, settings.workers(),
                settings.operationTimeout().toSeconds());
    }

    void tick(String name) {
        if (stopping.get()) {
            return;
        }
        if (!inFlight.add(name)) {
            log.debugf("이전 작업이 끝나지 않아 이번 주기를 건너뜁니다: %s", name);
            return;
        }
        CheckRun run = new CheckRun(name);
        Future<?> future;
        try {
            future = workers.submit(run);
        } catch (RejectedExecutionException e) {
            inFlight.remove(name);
            log.debugf("종료 중이라 점검을 제출하지 않습니다: %s", name);
            return;
        }
        ticker.schedule(() -> run.timeout(future), settings.operationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    /** @return 복구 작업으로 넘겼으면 true. 이때 점유 해제는 복구 작업이 담당한다. */
    private boolean runCheck(String name) {
        // 다른 프로세스(restore 명령)의 복구는 이 프로세스의 상태에 보이지 않으므로 저널로 확인한다
        if (restorer.isRestoring(name)) {
            log.debugf("복구가 진행 중이라 점검을 건너뜁니다: %s", name);
            return false;
        }
        MonitoredContainer current = registry.require(name);
        if (current.state() == ContainerState.RESTORING) {
            return false;
        }
        if (current.state() == ContainerState.RESTORE_FAILED) {
            if (journal.find(name).isPresent()) {
                log.debugf("복구 실패 상태라 운영자 조치 전까지 점검하지 않습니다: %s", name);
                return false;
            }
            transition(name, ContainerState.UNVERIFIED, UnaryOperator.identity());
            log.infof("복구 실패 보류가 외부에서 해제되었습니다: %s", name);
        }

        CheckResult result;
        try {
            result = detector.check(name);
        } catch (IntegrityException e) {
            registry.update(name, c -> c.checkedAt(clock.now()));
            log.warnf("점검 실패, 다음 주기에 재시도합니다: %s (%s)", name, e.getMessage());
            return false;
        }

        ContainerState next = result.drifted() ? ContainerState.DRIFTED : ContainerState.CLEAN;
        transition(name, next, c -> c.withBaseline(result.snapshotVersion(), result.expectedDigest()).checkedAt(clock.now()));
        if (!result.drifted()) {
            return false;
        }
        if (registry.require(name).policy() == MonitorPolicy.AUTO_RESTORE) {
            return submitRestore(name);
        }
        log.warnf("무결성 위반 경보(감지 전용 정책): %s", name);
        return false;
    }

    private boolean submitRestore(String name) {
        Snapshot snapshot;
        try {
            snapshot = baselines.latest(name);
        } catch (IntegrityException e) {
            log.errorf("복구할 스냅샷을 찾지 못했습니다: %s (%s)", name, e.getMessage());
            return false;
        }
        Future<?> future;
        try {
            future = workers.submit(() -> {
                try {
                    runRestore(name, snapshot);
                } finally {
                    inFlight.remove(name);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warnf("종료 중이라 자동 복구를 시작하지 않습니다: %s", name);
            return false;
        }
        ticker.schedule(() -> {
            if (!future.isDone()) {
                log.warnf("복구가 제한 시간을 넘겨 계속 진행 중입니다(중단하지 않음): %s", name);
            }
        }, settings.operationTimeout().toMillis(), TimeUnit.MILLISECONDS);
        return true;
    }

    private void runRestore(String name, Snapshot snapshot) {
        try {
            RestoreOutcome outcome = restorer.restore(name, snapshot,
                    () -> transition(name, ContainerState.RESTORING, UnaryOperator.identity()));
            if (outcome.success()) {
                transition(name, ContainerState.CLEAN,
                        c -> c.withBaseline(snapshot.version(), snapshot.digest()).checkedAt(clock.now()));
            } else {
                transition(name, ContainerState.RESTORE_FAILED, UnaryOperator.identity());
                log.errorf("복구 실패로 운영자 조치가 필요합니다: %s (%s)", name, outcome.status());
            }
        } catch (RestoreInProgressException e) {
            log.infof("다른 복구가 진행 중이라 이번 주기는 건너뜁니다: %s", name);
        } catch (RuntimeException e) {
            if (registry.require(name).state() == ContainerState.RESTORING) {
                transition(name, ContainerState.RESTORE_FAILED, UnaryOperator.identity());
            }
            log.errorf(e, "복구 중 예기치 못한 오류: %s", name);
        }
    }

    private void transition(String name, ContainerState next, UnaryOperator<MonitoredContainer> update) {
        ContainerRegistry.Transition transition = registry.transition(name, next, update);
        if (transition.changed()) {
            log.infof("상태 전이: %s %s -> %s", name, transition.from(), next);
        }
    }

    /**
     * 새 주기를 멈추고 진행 중인 점검/복구가 끝나기를 유예 시간만큼 기다린다. 작업을 강제로 끊지 않는다.
     */
    public void shutdown() {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        log.info("감시 중지: 진행 중인 작업이 끝나기를 기다립니다");
        ticks.forEach(tick -> tick.cancel(false));
        workers.shutdown();
        try {
            if (!workers.awaitTermination(settings.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warnf("유예 시간(%ds) 안에 끝나지 않은 작업이 있습니다: %s", settings.shutdownGrace().toSeconds(), inFlight);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            ticker.shutdownNow();
            terminated.countDown();
        }
    }

    public void awaitTermination() throws InterruptedException {
        terminated.await();
    }

    boolean isBusy(String name) {
        return inFlight.contains(name);
    }

    boolean awaitIdle(String name, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.contains(name)) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    private final class CheckRun implements Runnable {

        private final String name;
        private final AtomicInteger phase = new AtomicInteger(PENDING);

        private CheckRun(String name) {
            this.name = name;
        }

        @Override
        public void run() {
            if (!phase.compareAndSet(PENDING, RUNNING)) {
                return;
            }
            boolean handedOff = false;
            try {
                handedOff = runCheck(name);
            } catch (RuntimeException e) {
                log.errorf(e, "점검 주기 처리 중 예기치 못한 오류: %s", name);
            } finally {
                if (!handedOff) {
                    inFlight.remove(name);
                }
            }
        }

        void timeout(Future<?> future) {
            if (future.isDone()) {
                return;
            }
            if (phase.compareAndSet(PENDING, ABANDONED)) {
                future.cancel(false);
                inFlight.remove(name);
                log.warnf("작업자가 부족해 제한 시간 안에 점검을 시작하지 못했습니다: %s", name);
                return;
            }
            log.warnf("점검이 제한 시간(%ds)을 넘겨 중단합니다: %s", settings.operationTimeout().toSeconds(), name);
            future.cancel(true);
        }
    }

    private static ThreadFactory threads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}
