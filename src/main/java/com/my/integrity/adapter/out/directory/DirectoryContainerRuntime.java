package com.my.integrity.adapter.out.directory;

import com.my.integrity.config.AppConfig;
import com.my.integrity.domain.exception.InvalidRequestException;
import com.my.integrity.domain.exception.RuntimeUnavailableException;
import com.my.integrity.domain.exception.UnreadableEntryException;
import com.my.integrity.domain.hash.DirectoryTreeSource;
import com.my.integrity.domain.hash.ExclusionRules;
import com.my.integrity.domain.hash.TarTreeSource;
import com.my.integrity.domain.hash.TreeEntry;
import com.my.integrity.domain.hash.TreePaths;
import com.my.integrity.domain.model.ContainerNames;
import com.my.integrity.domain.model.EntryType;
import com.my.integrity.domain.port.out.ContainerRuntimePort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.archivers.tar.TarConstants;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 왜: 컨테이너 엔진 없이 호스트 디렉터리를 컨테이너 루트로 보고 감시/복구하기 위함(chroot 배포, 개발 환경).
 *
 * <p>{@code <root>/<name>}이 파일시스템이고, 정지 상태는 {@code <root>/.state/<name>.stopped} 표식 파일로 나타낸다.
 * 이름이 점으로 시작하는 항목은 런타임 내부용이다.
 */
@IfBuildProperty(name = "integrity.runtime.backend", stringValue = "directory")
@ApplicationScoped
public class DirectoryContainerRuntime implements ContainerRuntimePort {

    private static final Logger log = Logger.getLogger(DirectoryContainerRuntime.class);
    private static final int BUFFER_SIZE = 64 * 1024;

    private final Path root;

    @Inject
    public DirectoryContainerRuntime(AppConfig appConfig) {
        this(Path.of(appConfig.directory().root()));
    }

    public DirectoryContainerRuntime(Path root) {
        this.root = root;
    }

    @Override
    public void start(String container) {
        requireContainer(container);
        try {
            Files.deleteIfExists(stoppedMarker(container));
        } catch (IOException e) {
            throw new RuntimeUnavailableException("컨테이너 시작 실패: " + container, e);
        }
        log.debugf("컨테이너 시작: %s", container);
    }

    @Override
    public void stop(String container) {
        requireContainer(container);
        Path marker = stoppedMarker(container);
        try {
            Files.createDirectories(marker.getParent());
            if (!Files.exists(marker)) {
                Files.createFile(marker);
            }
        } catch (IOException e) {
            throw new RuntimeUnavailableException("컨테이너 정지 실패: " + container, e);
        }
        log.debugf("컨테이너 정지: %s", container);
    }

    @Override
    public boolean isRunning(String container) {
        return Files.isDirectory(containerDir(container), LinkOption.NOFOLLOW_LINKS)
                && !Files.exists(stoppedMarker(container));
    }

    @Override
    public List<String> listRunning() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> children = Files.list(root)) {
            return children.map(path -> path.getFileName().toString())
                    .filter(ContainerNames::isValid)
                    .filter(this::isRunning)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new RuntimeUnavailableException("컨테이너 목록 조회 실패: " + root, e);
        }
    }

    /**
     * 디렉터리를 임시 tar 파일로 묶은 뒤 그 파일을 연다. 스트림을 닫으면 임시 파일도 지워진다.
     */
    @Override
    public InputStream exportFilesystem(String container) {
        Path source = requireContainer(container);
        Path exported = null;
        try {
            exported = Files.createTempFile("integrity-export-" + container + "-", ".tar");
            try (OutputStream out = Files.newOutputStream(exported)) {
                writeTar(source, out);
            }
            return Files.newInputStream(exported, StandardOpenOption.DELETE_ON_CLOSE);
        } catch (IOException e) {
            deleteQuietly(exported);
            throw new RuntimeUnavailableException("컨테이너 파일시스템 읽기 실패: " + container, e);
        } catch (RuntimeException e) {
            deleteQuietly(exported);
            throw e;
        }
    }

    private void writeTar(Path source, OutputStream target) throws IOException {
        TarArchiveOutputStream tar = new TarArchiveOutputStream(target);
        tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
        new DirectoryTreeSource(source).accept(ExclusionRules.none(), (entry, content) -> {
            TarArchiveEntry tarEntry = toTarEntry(source, entry);
            tar.putArchiveEntry(tarEntry);
            if (entry.type() == EntryType.FILE) {
                copyExactly(entry.path(), content, tarEntry.getSize(), tar);
            }
            tar.closeArchiveEntry();
        });
        tar.finish();
    }

    private static TarArchiveEntry toTarEntry(Path source, TreeEntry entry) throws IOException {
        TarArchiveEntry tarEntry;
        switch (entry.type()) {
            case DIRECTORY -> {
                tarEntry = new TarArchiveEntry(entry.path() + "/");
                tarEntry.setMode(040000 | entry.mode());
            }
            case FILE -> {
                tarEntry = new TarArchiveEntry(entry.path());
                tarEntry.setMode(0100000 | entry.mode());
                tarEntry.setSize(Files.size(source.resolve(entry.path())));
            }
            case SYMLINK -> {
                tarEntry = new TarArchiveEntry(entry.path(), TarConstants.LF_SYMLINK);
                tarEntry.setLinkName(entry.linkTarget());
                tarEntry.setMode(0120777);
            }
            default -> {
                tarEntry = new TarArchiveEntry(entry.path(), TarConstants.LF_FIFO);
                tarEntry.setMode(010000 | entry.mode());
            }
        }
        return tarEntry;
    }

    private static void copyExactly(String path, InputStream content, long size, OutputStream out) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long remaining = size;
        while (remaining > 0) {
            int read = content.read(buffer, 0, (int) Math.min(buffer.length, remaining));
            if (read == -1) {
                throw new UnreadableEntryException(path, new IOException("읽는 도중 파일 크기가 바뀌었습니다"));
            }
            out.write(buffer, 0, read);
            remaining -= read;
        }
    }

    /**
     * 아카이브를 옆 디렉터리에 먼저 풀고, 다 풀린 뒤에만 기존 디렉터리와 자리를 바꾼다.
     * 풀기에 실패하면 기존 디렉터리는 그대로 남는다.
     */
    @Override
    public void replaceFilesystem(String container, InputStream archive) {
        Path target = requireContainer(container);
        if (isRunning(container)) {
            throw new RuntimeUnavailableException("실행 중인 컨테이너의 파일시스템은 교체할 수 없습니다: " + container);
        }
        long stamp = System.currentTimeMillis();
        Path staging = root.resolve("." + container + ".restore-" + stamp);
        Path parked = root.resolve("." + container + ".old-" + stamp);
        try {
            Files.createDirectories(staging);
            int extracted = extract(archive, staging);
            move(target, parked);
            try {
                move(staging, target);
            } catch (IOException e) {
                move(parked, target);
                throw e;
            }
            log.infof("컨테이너 교체 완료: %s (%d개 항목)", container, extracted);
        } catch (IOException e) {
            deleteTreeQuietly(staging);
            throw new RuntimeUnavailableException("파일시스템 교체 실패: " + container, e);
        } catch (RuntimeException e) {
            deleteTreeQuietly(staging);
            throw e;
        }
        deleteTreeQuietly(parked);
    }

    private int extract(InputStream archive, Path staging) throws IOException {
        TarArchiveInputStream tar = new TarArchiveInputStream(archive);
        List<PendingMode> directoryModes = new ArrayList<>();
        int count = 0;
        TarArchiveEntry entry;
        while ((entry = tar.getNextEntry()) != null) {
            String path = TreePaths.normalize(entry.getName());
            if (path.isEmpty()) {
                continue;
            }
            Path dest = resolveInside(staging, path);
            int mode = entry.getMode() & 07777;
            switch (TarTreeSource.typeOf(entry)) {
                case DIRECTORY -> {
                    Files.createDirectories(dest);
                    directoryModes.add(new PendingMode(dest, mode));
                }
                case FILE -> {
                    Files.createDirectories(dest.getParent());
                    Files.copy(tar, dest, StandardCopyOption.REPLACE_EXISTING);
                    applyMode(dest, mode);
                }
                case SYMLINK -> {
                    Files.createDirectories(dest.getParent());
                    Files.deleteIfExists(dest);
                    Files.createSymbolicLink(dest, Path.of(entry.getLinkName()));
                }
                case HARDLINK -> {
                    Path linked = resolveInside(staging, TreePaths.normalize(entry.getLinkName()));
                    Files.createDirectories(dest.getParent());
                    Files.deleteIfExists(dest);
                    try {
                        Files.createLink(dest, linked);
                    } catch (UnsupportedOperationException | IOException e) {
                        Files.copy(linked, dest, StandardCopyOption.COPY_ATTRIBUTES);
                    }
                }
                case OTHER -> log.warnf("장치/FIFO 항목은 복원하지 않습니다: %s", path);
            }
            count++;
        }
        // 읽기 전용 디렉터리 안에도 파일을 쓸 수 있도록 권한은 마지막에, 깊은 곳부터 적용한다
        for (int i = directoryModes.size() - 1; i >= 0; i--) {
            PendingMode pending = directoryModes.get(i);
            applyMode(pending.path(), pending.mode());
        }
        return count;
    }

    private static Path resolveInside(Path base, String relative) throws IOException {
        Path resolved = base.resolve(relative).normalize();
        if (!resolved.startsWith(base)) {
            throw new IOException("아카이브 항목이 대상 디렉터리를 벗어납니다: " + relative);
        }
        return resolved;
    }

    private static void applyMode(Path path, int mode) throws IOException {
        if (path.getFileSystem().supportedFileAttributeViews().contains("unix")) {
            Files.setAttribute(path, "unix:mode", mode, LinkOption.NOFOLLOW_LINKS);
        } else if (path.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(path, toPermissions(mode));
        }
    }

    static Set<PosixFilePermission> toPermissions(int mode) {
        Set<PosixFilePermission> permissions = EnumSet.noneOf(PosixFilePermission.class);
        PosixFilePermission[] ordered = {
                PosixFilePermission.OTHERS_EXECUTE, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_READ,
                PosixFilePermission.GROUP_EXECUTE, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_READ,
                PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_READ
        };
        for (int bit = 0; bit < ordered.length; bit++) {
            if ((mode & (1 << bit)) != 0) {
                permissions.add(ordered[bit]);
            }
        }
        return permissions;
    }

    private static void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to);
        }
    }

    private Path requireContainer(String container) {
        ContainerNames.requireValid(container);
        Path dir = containerDir(container);
        if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
            throw new InvalidRequestException("컨테이너를 찾을 수 없습니다: " + container);
        }
        return dir;
    }

    private Path containerDir(String container) {
        return root.resolve(container);
    }

    private Path stoppedMarker(String container) {
        return root.resolve(".state").resolve(container + ".stopped");
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warnf("임시 파일 삭제 실패: %s (%s)", path, e.getMessage());
        }
    }

    private static void deleteTreeQuietly(Path dir) {
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) throws IOException {
                    d.toFile().setWritable(true, true);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                    Files.delete(d);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warnf("정리하지 못한 디렉터리가 남았습니다: %s (%s)", dir, e.getMessage());
        }
    }

    private record PendingMode(Path path, int mode) {
    }
}
