package com.ryuqq.netexec.adapter.inmemory.workspace;

import com.ryuqq.netexec.core.spi.Workspace;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link Workspace} SPI.
 *
 * <p>Blobs are kept in a {@link ConcurrentHashMap}, so operators running on different
 * worker threads can access distinct blobs concurrently. Conflicting access to the
 * same blob is serialized by the dependency graph, not by this class.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Blob contents are stored by reference; mutable payloads are shared, not copied</li>
 *   <li>Data lost on process restart</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Workspace workspace = new InMemoryWorkspace();
 * workspace.putBlob("X", input);
 * Outcome outcome = net.run();
 * Object y = workspace.getBlob("Y");
 * </pre>
 *
 * @author NetExec Team
 * @since 1.0.0
 */
public class InMemoryWorkspace implements Workspace {

    private final ConcurrentHashMap<String, Object> blobs = new ConcurrentHashMap<>();

    @Override
    public boolean hasBlob(String name) {
        validateName(name);
        return blobs.containsKey(name);
    }

    @Override
    public Object getBlob(String name) {
        validateName(name);
        Object content = blobs.get(name);
        if (content == null) {
            throw new IllegalStateException("Blob not found: " + name);
        }
        return content;
    }

    @Override
    public <T> T getBlob(String name, Class<T> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        Object content = getBlob(name);
        if (!type.isInstance(content)) {
            throw new IllegalStateException(
                "Blob " + name + " is " + content.getClass().getName() + ", not " + type.getName()
            );
        }
        return type.cast(content);
    }

    @Override
    public void putBlob(String name, Object content) {
        validateName(name);
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        blobs.put(name, content);
    }

    @Override
    public boolean removeBlob(String name) {
        validateName(name);
        return blobs.remove(name) != null;
    }

    @Override
    public Set<String> blobNames() {
        return new TreeSet<>(blobs.keySet());
    }

    @Override
    public void clear() {
        blobs.clear();
    }

    /**
     * 모든 blob의 정렬된 스냅샷 (테스트 및 비교용).
     *
     * @return blob 이름 → 내용
     */
    public Map<String, Object> snapshot() {
        return new TreeMap<>(blobs);
    }

    /**
     * 보관 중인 blob 수.
     *
     * @return blob 수
     */
    public int size() {
        return blobs.size();
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("blob name cannot be null or blank");
        }
    }
}
