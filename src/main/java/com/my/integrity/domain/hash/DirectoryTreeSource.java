package com.my.integrity.domain.hash;

import com.my.integrity.domain.exception.UnreadableEntryException;
import com.my.integrity.domain.model.EntryType;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Set;

/**
 * 왜: 호스트 디렉터리(디렉터리 런타임의 루트 또는 임의 경로)를 tar export와 같은 규칙으로 해시하기 위함.
 */
public class DirectoryTreeSource implements TreeSource {

    private final Path root;

    public DirectoryTreeSource(Path root) {
        this.root = root;
    }

    @Override
    public void accept(ExclusionRules rules, TreeVisitor visitor) throws IOException {
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                String path = relative(dir);
                if (path.isEmpty()) {
                    return FileVisitResult.CONTINUE;
                }
                if (rules.excludes(path)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                visitor.visit(new TreeEntry(path, EntryType.DIRECTORY, modeOf(dir), null), null);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                String path = relative(file);
                if (attrs.isSymbolicLink()) {
                    String target = Files.readSymbolicLink(file).toString().replace('\\', '/');
                    visitor.visit(new TreeEntry(path, EntryType.SYMLINK, 0, target), null);
                } else if (attrs.isRegularFile()) {
                    if (rules.excludes(path)) {
                        return FileVisitResult.CONTINUE;
                    }
                    InputStream content;
                    try {
                        content = Files.newInputStream(file, LinkOption.NOFOLLOW_LINKS);
                    } catch (IOException e) {
                        throw new UnreadableEntryException(path, e);
                    }
                    try (content) {
                        visitor.visit(new TreeEntry(path, EntryType.FILE, modeOf(file), null), content);
                    }
                } else {
                    visitor.visit(new TreeEntry(path, EntryType.OTHER, modeOf(file), null), null);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                throw new UnreadableEntryException(relative(file), exc);
            }
        });
    }

    private String relative(Path path) {
        return TreePaths.normalize(root.relativize(path).toString());
    }

    /**
     * 권한 비트(setuid/setgid/sticky 포함)를 읽는다. unix 뷰가 없는 파일시스템에서는 rwx 비트만 읽힌다.
     */
    public static int modeOf(Path path) throws IOException {
        if (path.getFileSystem().supportedFileAttributeViews().contains("unix")) {
            return ((Integer) Files.getAttribute(path, "unix:mode", LinkOption.NOFOLLOW_LINKS)) & 07777;
        }
        PosixFileAttributes attrs = Files.readAttributes(path, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        return toBits(attrs.permissions());
    }

    static int toBits(Set<PosixFilePermission> permissions) {
        int bits = 0;
        for (PosixFilePermission permission : permissions) {
            bits |= switch (permission) {
                case OWNER_READ -> 0400;
                case OWNER_WRITE -> 0200;
                case OWNER_EXECUTE -> 0100;
                case GROUP_READ -> 040;
                case GROUP_WRITE -> 020;
                case GROUP_EXECUTE -> 010;
                case OTHERS_READ -> 04;
                case OTHERS_WRITE -> 02;
                case OTHERS_EXECUTE -> 01;
            };
        }
        return bits;
    }
}
