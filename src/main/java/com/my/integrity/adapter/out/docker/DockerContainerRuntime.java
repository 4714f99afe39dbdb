package com.my.integrity.adapter.out.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateImageResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ContainerConfig;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import com.my.integrity.config.AppConfig;
import com.my.integrity.domain.exception.InvalidRequestException;
import com.my.integrity.domain.exception.RuntimeUnavailableException;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.faulttolerance.Retry;
import org.jboss.logging.Logger;

import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 왜: Docker Socket을 통해 감시 대상 컨테이너를 정지/시작하고, 파일시스템을 읽어 내고, 스냅샷 이미지로 다시 만들기 위함.
 */
@IfBuildProperty(name = "integrity.runtime.backend", stringValue = "docker", enableIfMissing = true)
@ApplicationScoped
public class DockerContainerRuntime implements ContainerRuntimePort {

    private static final Logger log = Logger.getLogger(DockerContainerRuntime.class);

    private final DockerClient dockerClient;
    private final AppConfig.DockerConfig dockerConfig;

    @Inject
    public DockerContainerRuntime(AppConfig appConfig) {
        this(appConfig.docker(), createDockerClient(appConfig.docker()));
    }

    DockerContainerRuntime(AppConfig.DockerConfig dockerConfig, DockerClient dockerClient) {
        this.dockerConfig = dockerConfig;
        this.dockerClient = dockerClient;
    }

    private static DockerClient createDockerClient(AppConfig.DockerConfig dockerConfig) {
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerConfig.host())
                .build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .maxConnections(16)
                .connectionTimeout(Duration.ofSeconds(30))
                .responseTimeout(responseTimeout(dockerConfig))
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    /**
     * 읽기가 멈춘 export 스트림이 작업자와 해시 허가를 붙잡지 않도록 유한한 값을 쓴다.
     * 정지 요청은 데몬이 정지 유예 시간만큼 응답을 미루므로 그보다 짧아지지 않게 한다.
     */
    static Duration responseTimeout(AppConfig.DockerConfig dockerConfig) {
        long seconds = Math.max(dockerConfig.readTimeoutSeconds(), dockerConfig.stopTimeoutSeconds() + 30L);
        return Duration.ofSeconds(seconds);
    }

    @Override
    @Retry(maxRetries = 3, delay = 1000, retryOn = RuntimeUnavailableException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 8000)
    public void stop(String container) {
        try {
            dockerClient.stopContainerCmd(container)
                    .withTimeout(dockerConfig.stopTimeoutSeconds())
                    .exec();
            log.debugf("컨테이너 정지: %s", container);
        } catch (NotModifiedException e) {
            log.debugf("이미 정지된 컨테이너: %s", container);
        } catch (NotFoundException e) {
            throw notFound(container, e);
        } catch (RuntimeException e) {
            throw unavailable("컨테이너 정지 실패: " + container, e);
        }
    }

    @Override
    @Retry(maxRetries = 3, delay = 1000, retryOn = RuntimeUnavailableException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 8000)
    public void start(String container) {
        try {
            dockerClient.startContainerCmd(container).exec();
            log.debugf("컨테이너 시작: %s", container);
        } catch (NotModifiedException e) {
            log.debugf("이미 실행 중인 컨테이너: %s", container);
        } catch (NotFoundException e) {
            throw notFound(container, e);
        } catch (RuntimeException e) {
            throw unavailable("컨테이너 시작 실패: " + container, e);
        }
    }

    @Override
    public boolean isRunning(String container) {
        try {
            return Boolean.TRUE.equals(dockerClient.inspectContainerCmd(container).exec().getState().getRunning());
        } catch (NotFoundException e) {
            return false;
        } catch (RuntimeException e) {
            throw unavailable("컨테이너 상태 조회 실패: " + container, e);
        }
    }

    @Override
    public List<String> listRunning() {
        try {
            List<Container> containers = dockerClient.listContainersCmd().exec();
            return containers.stream()
                    .map(Container::getNames)
                    .filter(Objects::nonNull)
                    .flatMap(Arrays::stream)
                    .filter(name -> name.lastIndexOf('/') == 0)
                    .map(name -> name.substring(1))
                    .sorted()
                    .toList();
        } catch (RuntimeException e) {
            throw unavailable("컨테이너 목록 조회 실패", e);
        }
    }

    /**
     * 루트 경로 아카이브를 그대로 넘긴다. 스트림을 닫을 때까지 HTTP 연결을 점유한다.
     */
    @Override
    @Retry(maxRetries = 3, delay = 1000, retryOn = RuntimeUnavailableException.class)
    @ExponentialBackoff(factor = 2, maxDelay = 8000)
    public InputStream exportFilesystem(String container) {
        try {
            return dockerClient.copyArchiveFromContainerCmd(container, "/").exec();
        } catch (NotFoundException e) {
            throw notFound(container, e);
        } catch (RuntimeException e) {
            throw unavailable("컨테이너 파일시스템 읽기 실패: " + container, e);
        }
    }

    /**
     * 아카이브를 이미지로 가져온 뒤, 기존 설정을 그대로 복사해 같은 이름의 컨테이너를 다시 만든다.
     * 생성에 실패하면 기존 컨테이너의 이름을 되돌려 호출자가 다시 시작할 수 있게 한다.
     */
    @Override
    public void replaceFilesystem(String container, InputStream archive) {
        InspectContainerResponse current;
        try {
            current = dockerClient.inspectContainerCmd(container).exec();
        } catch (NotFoundException e) {
            throw notFound(container, e);
        } catch (RuntimeException e) {
            throw unavailable("컨테이너 설정 조회 실패: " + container, e);
        }

        String image = importImage(container, archive);
        String previousId = current.getId();
        String parkedName = container + "-integrity-old-" + System.currentTimeMillis();
        try {
            dockerClient.renameContainerCmd(previousId).withName(parkedName).exec();
        } catch (RuntimeException e) {
            throw unavailable("기존 컨테이너 이름 변경 실패: " + container, e);
        }

        String createdId;
        try {
            createdId = recreate(container, image, current).exec().getId();
        } catch (RuntimeException e) {
            rollbackRename(previousId, container);
            throw unavailable("복구 컨테이너 생성 실패: " + container, e);
        }

        try {
            dockerClient.removeContainerCmd(previousId).withForce(true).exec();
        } catch (NotFoundException e) {
            log.debugf("기존 컨테이너가 이미 삭제됨: %s", previousId);
        } catch (RuntimeException e) {
            // 새 컨테이너는 이미 제자리에 있으므로 복구 자체는 계속 진행한다
            log.warnf(e, "기존 컨테이너 삭제 실패, 수동 정리가 필요합니다: %s (%s)", parkedName, previousId);
        }
        log.infof("컨테이너 교체 완료: %s (이미지 %s, id %s)", container, image, createdId);
    }

    private String importImage(String container, InputStream archive) {
        String repository = dockerConfig.restoreImageRepository() + "/" + container.toLowerCase(Locale.ROOT);
        String tag = String.valueOf(System.currentTimeMillis());
        try {
            CreateImageResponse response = dockerClient.createImageCmd(repository, archive)
                    .withTag(tag)
                    .exec();
            log.debugf("복구 이미지 생성: %s:%s (%s)", repository, tag, response.getId());
            return repository + ":" + tag;
        } catch (RuntimeException e) {
            throw unavailable("복구 이미지 생성 실패: " + container, e);
        }
    }

    private CreateContainerCmd recreate(String container, String image, InspectContainerResponse current) {
        CreateContainerCmd cmd = dockerClient.createContainerCmd(image)
                .withName(container)
                .withHostConfig(current.getHostConfig());
        ContainerConfig config = current.getConfig();
        if (config == null) {
            return cmd;
        }
        if (config.getEnv() != null) {
            cmd = cmd.withEnv(config.getEnv());
        }
        if (config.getEntrypoint() != null) {
            cmd = cmd.withEntrypoint(config.getEntrypoint());
        }
        if (config.getCmd() != null) {
            cmd = cmd.withCmd(config.getCmd());
        }
        if (config.getWorkingDir() != null && !config.getWorkingDir().isEmpty()) {
            cmd = cmd.withWorkingDir(config.getWorkingDir());
        }
        if (config.getUser() != null && !config.getUser().isEmpty()) {
            cmd = cmd.withUser(config.getUser());
        }
        if (config.getLabels() != null) {
            cmd = cmd.withLabels(config.getLabels());
        }
        if (config.getExposedPorts() != null) {
            cmd = cmd.withExposedPorts(config.getExposedPorts());
        }
        return cmd;
    }

    private void rollbackRename(String previousId, String container) {
        try {
            dockerClient.renameContainerCmd(previousId).withName(container).exec();
        } catch (RuntimeException e) {
            log.errorf(e, "이름 되돌리기 실패, 수동 조치가 필요합니다: %s (%s)", container, previousId);
        }
    }

    private static InvalidRequestException notFound(String container, NotFoundException e) {
        return new InvalidRequestException("컨테이너를 찾을 수 없습니다: " + container, e);
    }

    private static RuntimeUnavailableException unavailable(String message, RuntimeException e) {
        return new RuntimeUnavailableException(message, e);
    }
}
