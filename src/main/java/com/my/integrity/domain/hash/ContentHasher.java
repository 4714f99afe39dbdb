package com.my.integrity.domain.hash;

import com.my.integrity.domain.exception.RuntimeUnavailableException;
import com.my.integrity.domain.exception.UnreadableEntryException;
import com.my.integrity.domain.model.EntryType;
import com.my.integrity.domain.model.ManifestEntry;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * 왜: 파일 트리의 내용과 상대 경로만으로 결정되는 단일 다이제스트를 만들어, 순회 순서나 호스트가 달라도 같은 값을 얻기 위함.
 *
 * <p>항목마다 {@code 경로 NUL 종류 권한(4바이트)}를 기록하고, 일반 파일은 내용 다이제스트를,
 * 심볼릭 링크는 {@code 대상 NUL}을 덧붙인다. 항목은 {@link TreePaths#CANONICAL_ORDER} 순으로 합산한다.
 * 동시에 실행되는 계산 수는 생성자에 준 값으로 제한된다.
 */
public class ContentHasher {

    private static final int BUFFER_SIZE = 64 * 1024;
    private static final HexFormat HEX = HexFormat.of();

    private final Semaphore permits;

    public ContentHasher(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent는 1 이상이어야 합니다: " + maxConcurrent);
        }
        this.permits = new Semaphore(maxConcurrent, true);
    }

    public TreeDigest digest(TreeSource source, ExclusionRules rules, DigestAlgorithm algorithm, boolean withManifest) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeUnavailableException("해시 계산 대기 중 중단되었습니다", e);
        }
        try {
            return compute(source, rules, algorithm, withManifest);
        } finally {
            permits.release();
        }
    }

    private TreeDigest compute(TreeSource source, ExclusionRules rules, DigestAlgorithm algorithm, boolean withManifest) {
        Map<String, Node> nodes = new HashMap<>();
        // 제외된 일반 파일도 제외되지 않은 하드 링크의 내용이 될 수 있으므로 내용 다이제스트만 따로 둔다
        Map<String, byte[]> excludedContent = new HashMap<>();
        String[] lastPath = {"<archive>"};
        try {
            source.accept(rules, (entry, content) -> {
                checkInterrupted();
                lastPath[0] = entry.path();
                if (rules.excludes(entry.path())) {
                    rememberExcluded(entry, content, algorithm, nodes, excludedContent);
                    return;
                }
                nodes.put(entry.path(), toNode(entry, content, algorithm, nodes, excludedContent));
            });
        } catch (SocketTimeoutException e) {
            throw stalled(lastPath[0], e);
        } catch (IOException e) {
            throw new UnreadableEntryException(lastPath[0], e);
        }

        List<String> paths = new ArrayList<>(nodes.keySet());
        paths.sort(TreePaths.CANONICAL_ORDER);

        MessageDigest aggregate = algorithm.newDigest();
        List<ManifestEntry> manifest = withManifest ? new ArrayList<>(paths.size()) : List.of();
        for (String path : paths) {
            Node node = nodes.get(path);
            aggregate.update(path.getBytes(StandardCharsets.UTF_8));
            aggregate.update((byte) 0);
            aggregate.update(node.type.tag());
            aggregate.update(ByteBuffer.allocate(Integer.BYTES).putInt(node.mode).array());
            if (node.type == EntryType.FILE) {
                aggregate.update(node.content);
            } else if (node.type == EntryType.SYMLINK) {
                aggregate.update(node.linkTarget.getBytes(StandardCharsets.UTF_8));
                aggregate.update((byte) 0);
            }
            if (withManifest) {
                manifest.add(new ManifestEntry(path, node.type, node.mode,
                        node.content == null ? null : HEX.formatHex(node.content), node.linkTarget));
            }
        }
        return new TreeDigest(algorithm, HEX.formatHex(aggregate.digest()), paths.size(), manifest);
    }

    private void rememberExcluded(TreeEntry entry, InputStream content, DigestAlgorithm algorithm,
                                  Map<String, Node> seen, Map<String, byte[]> excludedContent) {
        if (entry.type() == EntryType.FILE) {
            excludedContent.put(entry.path(), digestContent(entry.path(), content, algorithm));
        } else if (entry.type() == EntryType.HARDLINK) {
            byte[] linked = linkedContent(entry.linkTarget(), seen, excludedContent);
            if (linked != null) {
                excludedContent.put(entry.path(), linked);
            }
        }
    }

    private Node toNode(TreeEntry entry, InputStream content, DigestAlgorithm algorithm,
                        Map<String, Node> seen, Map<String, byte[]> excludedContent) {
        return switch (entry.type()) {
            case FILE -> new Node(EntryType.FILE, entry.mode(), digestContent(entry.path(), content, algorithm), null);
            case HARDLINK -> {
                byte[] linked = linkedContent(entry.linkTarget(), seen, excludedContent);
                if (linked == null) {
                    throw new UnreadableEntryException(entry.path(),
                            new IOException("하드 링크 대상이 트리에 없습니다: " + entry.linkTarget()));
                }
                yield new Node(EntryType.FILE, entry.mode(), linked, null);
            }
            // 심볼릭 링크 권한은 의미가 없으므로 0으로 고정한다
            case SYMLINK -> new Node(EntryType.SYMLINK, 0, null, entry.linkTarget() == null ? "" : entry.linkTarget());
            case DIRECTORY, OTHER -> new Node(entry.type(), entry.mode(), null, null);
        };
    }

    private static byte[] linkedContent(String target, Map<String, Node> seen, Map<String, byte[]> excludedContent) {
        Node node = seen.get(target);
        if (node != null) {
            return node.type == EntryType.FILE ? node.content : null;
        }
        return excludedContent.get(target);
    }

    private byte[] digestContent(String path, InputStream content, DigestAlgorithm algorithm) {
        MessageDigest digest = algorithm.newDigest();
        byte[] buffer = new byte[BUFFER_SIZE];
        try {
            int read;
            while ((read = content.read(buffer)) != -1) {
                checkInterrupted();
                digest.update(buffer, 0, read);
            }
        } catch (SocketTimeoutException e) {
            throw stalled(path, e);
        } catch (IOException e) {
            throw new UnreadableEntryException(path, e);
        }
        return digest.digest();
    }

    private static RuntimeUnavailableException stalled(String path, SocketTimeoutException e) {
        return new RuntimeUnavailableException("트리 스트림 읽기 시간 초과: " + path, e);
    }

    private static void checkInterrupted() {
        if (Thread.currentThread().isInterrupted()) {
            throw new RuntimeUnavailableException("해시 계산이 중단되었습니다");
        }
    }

    private record Node(EntryType type, int mode, byte[] content, String linkTarget) {
    }
}
