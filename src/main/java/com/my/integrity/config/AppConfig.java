package com.my.integrity.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;

@StaticInitSafe
@ConfigMapping(prefix = "integrity")
public interface AppConfig {

    StoreConfig store();

    HashConfig hash();

    DetectorConfig detector();

    RuntimeConfig runtime();

    DockerConfig docker();

    DirectoryConfig directory();

    MonitorConfig monitor();

    ClockConfig clock();

    interface StoreConfig {
        @WithName("path")
        @WithDefault("./data/integrity")
        String path();
    }

    interface HashConfig {
        @WithName("algorithm")
        @WithDefault("SHA-256")
        String algorithm();

        @WithName("exclusions")
        @WithDefault("/proc,/sys,/dev,/run,/tmp,/var/tmp,/var/log,/var/run,/.dockerenv,/etc/hostname,/etc/hosts,/etc/resolv.conf")
        List<String> exclusions();

        @WithName("max-concurrent")
        @WithDefault("2")
        int maxConcurrent();
    }

    interface DetectorConfig {
        @WithName("verbose")
        @WithDefault("false")
        boolean verbose();
    }

    interface RuntimeConfig {
        @WithName("backend")
        @WithDefault("docker")
        String backend();
    }

    interface DockerConfig {
        @WithName("host")
        @WithDefault("unix:///var/run/docker.sock")
        String host();

        @WithName("stop-timeout-seconds")
        @WithDefault("30")
        int stopTimeoutSeconds();

        @WithName("read-timeout-seconds")
        @WithDefault("300")
        int readTimeoutSeconds();

        @WithName("restore-image-repository")
        @WithDefault("integrity-restore")
        String restoreImageRepository();
    }

    interface DirectoryConfig {
        @WithName("root")
        @WithDefault("./data/containers")
        String root();
    }

    interface MonitorConfig {
        @WithName("interval-seconds")
        @WithDefault("30")
        int intervalSeconds();

        @WithName("workers")
        @WithDefault("4")
        int workers();

        @WithName("operation-timeout-seconds")
        @WithDefault("600")
        int operationTimeoutSeconds();

        @WithName("shutdown-grace-seconds")
        @WithDefault("120")
        int shutdownGraceSeconds();

        @WithName("auto-restore")
        @WithDefault("false")
        boolean autoRestore();
    }

    interface ClockConfig {
        @WithName("zone")
        @WithDefault("Etc/UTC")
        String zone();
    }
}
