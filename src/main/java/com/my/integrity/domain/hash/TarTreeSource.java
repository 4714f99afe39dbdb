package com.my.integrity.domain.hash;

import com.my.integrity.domain.model.EntryType;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;

import java.io.IOException;
import java.io.InputStream;

/**
 * 왜: 런타임 export 스트림과 스냅샷 아카이브를 디스크에 풀지 않고 그대로 해시하기 위함.
 *
 * <p>스트림은 호출자가 소유한다. 이 클래스는 스트림을 닫지 않는다.
 */
public class TarTreeSource implements TreeSource {

    private final InputStream stream;

    public TarTreeSource(InputStream stream) {
        this.stream = stream;
    }

    @Override
    public void accept(ExclusionRules rules, TreeVisitor visitor) throws IOException {
        TarArchiveInputStream tar = new TarArchiveInputStream(stream);
        TarArchiveEntry entry;
        while ((entry = tar.getNextEntry()) != null) {
            String path = TreePaths.normalize(entry.getName());
            if (path.isEmpty()) {
                continue;
            }
            EntryType type = typeOf(entry);
            String linkTarget = switch (type) {
                case SYMLINK -> entry.getLinkName();
                case HARDLINK -> TreePaths.normalize(entry.getLinkName());
                default -> null;
            };
            visitor.visit(new TreeEntry(path, type, entry.getMode() & 07777, linkTarget),
                    type == EntryType.FILE ? tar : null);
        }
    }

    public static EntryType typeOf(TarArchiveEntry entry) {
        if (entry.isDirectory()) {
            return EntryType.DIRECTORY;
        }
        if (entry.isSymbolicLink()) {
            return EntryType.SYMLINK;
        }
        if (entry.isLink()) {
            return EntryType.HARDLINK;
        }
        // isFile()은 장치/FIFO 항목도 참으로 보므로 먼저 걸러낸다
        if (entry.isCharacterDevice() || entry.isBlockDevice() || entry.isFIFO()) {
            return EntryType.OTHER;
        }
        return entry.isFile() ? EntryType.FILE : EntryType.OTHER;
    }
}
