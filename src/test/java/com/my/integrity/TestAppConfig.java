package com.my.integrity;

import com.my.integrity.config.AppConfig;

import java.nio.file.Path;
import java.util.List;

/**
 * 테스트용 설정. 저장소와 디렉터리 런타임 루트만 임시 디렉터리로 바꾸고 나머지는 기본값을 쓴다.
 */
public class TestAppConfig implements AppConfig {

    public static final List<String> DEFAULT_EXCLUSIONS = List.of("/proc", "/sys", "/dev", "/tmp", "/var/log");

    private final Path storePath;
    private final Path directoryRoot;
    private List<String> exclusions = DEFAULT_EXCLUSIONS;

    public TestAppConfig(Path storePath, Path directoryRoot) {
        this.storePath = storePath;
        this.directoryRoot = directoryRoot;
    }

    public TestAppConfig withExclusions(List<String> exclusions) {
        this.exclusions = exclusions;
        return this;
    }

    @Override
    public StoreConfig store() {
        return storePath::toString;
    }

    @Override
    public HashConfig hash() {
        return new HashConfig() {
            @Override
            public String algorithm() {
                return "SHA-256";
            }

            @Override
            public List<String> exclusions() {
                return exclusions;
            }

            @Override
            public int maxConcurrent() {
                return 2;
            }
        };
    }

    @Override
    public DetectorConfig detector() {
        return () -> false;
    }

    @Override
    public RuntimeConfig runtime() {
        return () -> "directory";
    }

    @Override
    public DockerConfig docker() {
        return new DockerConfig() {
            @Override
            public String host() {
                return "unix:///var/run/docker.sock";
            }

            @Override
            public int stopTimeoutSeconds() {
                return 5;
            }

            @Override
            public int readTimeoutSeconds() {
                return 60;
            }

            @Override
            public String restoreImageRepository() {
                return "integrity-restore";
            }
        };
    }

    @Override
    public DirectoryConfig directory() {
        return directoryRoot::toString;
    }

    @Override
    public MonitorConfig monitor() {
        return new MonitorConfig() {
            @Override
            public int intervalSeconds() {
                return 30;
            }

            @Override
            public int workers() {
                return 2;
            }

            @Override
            public int operationTimeoutSeconds() {
                return 60;
            }

            @Override
            public int shutdownGraceSeconds() {
                return 5;
            }

            @Override
            public boolean autoRestore() {
                return false;
            }
        };
    }

    @Override
    public ClockConfig clock() {
        return () -> "Etc/UTC";
    }
}
