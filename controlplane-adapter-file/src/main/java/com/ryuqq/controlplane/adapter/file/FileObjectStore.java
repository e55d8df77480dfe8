package com.ryuqq.controlplane.adapter.file;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.controlplane.core.spi.BackingStoreException;
import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.spi.StoredObject;
import com.ryuqq.controlplane.core.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 디렉토리 기반 {@link ObjectStore}.
 *
 * <p><strong>레이아웃:</strong></p>
 * <pre>
 * root/
 *   bundle/tplv_xxx.bin          본문
 *   bundle/tplv_xxx.meta.json    {"contentType": "..."}
 *   snapshot/...
 *   build_log/...
 *   build_artifact/...
 * </pre>
 *
 * <p>본문과 메타 파일은 임시 파일에 쓴 뒤 이동합니다. 동시 put은 같은 키에 대해
 * 마지막 기록이 남습니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class FileObjectStore implements ObjectStore {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_.-]+");

    private final Path root;

    public FileObjectStore(Path root) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        this.root = root.toAbsolutePath();
    }

    @Override
    public synchronized void put(ObjectTarget target, byte[] body, String contentType) {
        StoredObject object = new StoredObject(body, contentType);
        Path bodyPath = bodyPath(target);
        try {
            Files.createDirectories(bodyPath.getParent());
            writeAtomically(bodyPath, object.body());
            writeAtomically(metaPath(target), Jsons.toBytes(Map.of("contentType", object.contentType())));
        } catch (IOException e) {
            throw new BackingStoreException("Failed to store object " + target.kind() + "/" + target.id(), e);
        }
    }

    @Override
    public synchronized Optional<StoredObject> get(ObjectTarget target) {
        Path bodyPath = bodyPath(target);
        if (!Files.exists(bodyPath)) {
            return Optional.empty();
        }
        try {
            byte[] body = Files.readAllBytes(bodyPath);
            String contentType = "application/octet-stream";
            Path metaPath = metaPath(target);
            if (Files.exists(metaPath)) {
                JsonNode meta = Jsons.mapper().readTree(Files.readAllBytes(metaPath));
                contentType = meta.path("contentType").asText(contentType);
            }
            return Optional.of(new StoredObject(body, contentType));
        } catch (IOException e) {
            throw new BackingStoreException("Failed to read object " + target.kind() + "/" + target.id(), e);
        }
    }

    @Override
    public synchronized void delete(ObjectTarget target) {
        try {
            Files.deleteIfExists(bodyPath(target));
            Files.deleteIfExists(metaPath(target));
        } catch (IOException e) {
            throw new BackingStoreException("Failed to delete object " + target.kind() + "/" + target.id(), e);
        }
    }

    private void writeAtomically(Path destination, byte[] bytes) throws IOException {
        Path temp = Files.createTempFile(destination.getParent(), destination.getFileName().toString(), ".tmp");
        Files.write(temp, bytes);
        Files.move(temp, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path bodyPath(ObjectTarget target) {
        return directoryOf(target).resolve(safeId(target) + ".bin");
    }

    private Path metaPath(ObjectTarget target) {
        return directoryOf(target).resolve(safeId(target) + ".meta.json");
    }

    private Path directoryOf(ObjectTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        return root.resolve(target.kind().name().toLowerCase(Locale.ROOT));
    }

    private static String safeId(ObjectTarget target) {
        if (!SAFE_ID.matcher(target.id()).matches() || target.id().startsWith(".")) {
            throw new IllegalArgumentException("Unsafe object id: " + target.id());
        }
        return target.id();
    }
}
