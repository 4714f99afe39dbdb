package com.my.integrity.domain.hash;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * 왜: 기준선 아카이브에 휘발성 경로의 내용은 담지 않되, 복구된 컨테이너가 디렉터리 골격(/tmp, /var/log 등)을 잃지 않게 하기 위함.
 *
 * <p>제외 규칙에 걸린 디렉터리는 빈 디렉터리로 남기고, 그 외 항목은 버린다.
 * 남는 하드 링크가 버려진 파일을 가리키면 그 내용을 링크 경로의 일반 파일로 옮겨 적는다.
 */
public final class ArchiveFilter {

    private static final Logger log = Logger.getLogger(ArchiveFilter.class);
    private static final int TYPE_BITS = 0170000;
    private static final int REGULAR_FILE = 0100000;

    private ArchiveFilter() {
    }

    /**
     * @return 기록한 항목 수
     */
    public static int copy(InputStream export, ExclusionRules rules, OutputStream target) throws IOException {
        TarArchiveInputStream in = new TarArchiveInputStream(export);
        TarArchiveOutputStream out = new TarArchiveOutputStream(target);
        out.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        out.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

        Spool spool = new Spool();
        // 버려진 하드 링크 경로 -> 실제 대상 경로
        Map<String, String> droppedLinks = new HashMap<>();
        // 버려진 파일 경로 -> 그 내용을 처음 옮겨 적은 링크 경로
        Map<String, String> promoted = new HashMap<>();
        int written = 0;
        try {
            TarArchiveEntry entry;
            while ((entry = in.getNextEntry()) != null) {
                String path = TreePaths.normalize(entry.getName());
                boolean hardlink = entry.isLink() && !entry.isSymbolicLink();
                if (!path.isEmpty() && !entry.isDirectory() && rules.excludes(path)) {
                    if (hardlink) {
                        String linked = TreePaths.normalize(entry.getLinkName());
                        droppedLinks.put(path, droppedLinks.getOrDefault(linked, linked));
                    } else if (entry.isFile()) {
                        spool.keep(path, in);
                    }
                    continue;
                }
                if (hardlink) {
                    String linked = TreePaths.normalize(entry.getLinkName());
                    String resolved = droppedLinks.getOrDefault(linked, linked);
                    if (promoted.containsKey(resolved)) {
                        entry.setLinkName(promoted.get(resolved));
                    } else if (spool.contains(resolved)) {
                        writePromoted(out, entry, spool.file(resolved));
                        promoted.put(resolved, path);
                        written++;
                        continue;
                    } else if (!resolved.equals(linked)) {
                        entry.setLinkName(resolved);
                    }
                }
                out.putArchiveEntry(entry);
                if (entry.isFile() && !entry.isLink()) {
                    in.transferTo(out);
                }
                out.closeArchiveEntry();
                written++;
            }
            out.finish();
            out.flush();
        } finally {
            spool.clear();
        }
        return written;
    }

    private static void writePromoted(TarArchiveOutputStream out, TarArchiveEntry link, Path content) throws IOException {
        TarArchiveEntry file = new TarArchiveEntry(link.getName());
        file.setMode(REGULAR_FILE | (link.getMode() & ~TYPE_BITS));
        file.setSize(Files.size(content));
        file.setModTime(link.getModTime());
        file.setUserId(link.getLongUserId());
        file.setGroupId(link.getLongGroupId());
        file.setUserName(link.getUserName());
        file.setGroupName(link.getGroupName());
        out.putArchiveEntry(file);
        Files.copy(content, out);
        out.closeArchiveEntry();
    }

    /** 제외된 일반 파일 내용을 하드 링크가 다시 찾을 때까지 임시 디렉터리에 둔다. */
    private static final class Spool {

        private final Map<String, Path> files = new HashMap<>();
        private Path directory;

        void keep(String path, InputStream content) throws IOException {
            if (directory == null) {
                directory = Files.createTempDirectory("integrity-filter-");
            }
            Path file = directory.resolve(Integer.toString(files.size()));
            Files.copy(content, file);
            files.put(path, file);
        }

        boolean contains(String path) {
            return files.containsKey(path);
        }

        Path file(String path) {
            return files.get(path);
        }

        void clear() {
            if (directory == null) {
                return;
            }
            try {
                for (Path file : files.values()) {
                    Files.deleteIfExists(file);
                }
                Files.deleteIfExists(directory);
            } catch (IOException e) {
                log.warnf("임시 파일 정리 실패: %s (%s)", directory, e.getMessage());
            }
        }
    }
}
