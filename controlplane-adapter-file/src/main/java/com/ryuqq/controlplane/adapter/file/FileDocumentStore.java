package com.ryuqq.controlplane.adapter.file;

import com.ryuqq.controlplane.core.spi.BackingStore;
import com.ryuqq.controlplane.core.spi.BackingStoreException;
import com.ryuqq.controlplane.core.state.EntityCollection;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;

/**
 * 상태 문서 전체를 하나의 JSON 파일로 저장하는 {@link BackingStore}.
 *
 * <p><strong>저장 방식:</strong></p>
 * <ol>
 *   <li>같은 디렉토리의 임시 파일에 문서 전체를 기록</li>
 *   <li>원자적 이동(ATOMIC_MOVE)으로 기존 파일 교체</li>
 * </ol>
 *
 * <p>파일이 없으면 빈 문서를 반환합니다. 알 수 없는 필드는 무시하고,
 * 누락된 컬렉션은 빈 리스트로 채워집니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class FileDocumentStore implements BackingStore {

    private static final Logger log = LoggerFactory.getLogger(FileDocumentStore.class);

    private final Path file;

    /**
     * 생성자.
     *
     * @param file 상태 파일 경로 (상위 디렉토리는 저장 시 생성)
     * @throws IllegalArgumentException file이 null인 경우
     */
    public FileDocumentStore(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        this.file = file.toAbsolutePath();
    }

    @Override
    public StateDocument load() {
        if (!Files.exists(file)) {
            return StateDocument.empty();
        }
        try {
            return Jsons.mapper().readValue(Files.readAllBytes(file), StateDocument.class);
        } catch (IOException e) {
            throw new BackingStoreException("Failed to read state file: " + file, e);
        }
    }

    @Override
    public void save(StateDocument next, StateDocument previous, Set<EntityCollection> collections) {
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }
        if (collections == null) {
            throw new IllegalArgumentException("collections cannot be null");
        }
        StateDocument document = next;
        if (!collections.containsAll(EntityCollection.all())) {
            document = load();
            document.replaceCollections(next, collections);
        }
        write(document);
    }

    private void write(StateDocument document) {
        Path directory = file.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Files.write(temp, Jsons.mapper().writerWithDefaultPrettyPrinter().writeValueAsBytes(document));
            moveIntoPlace(temp);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new BackingStoreException("Failed to write state file: " + file, e);
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", file);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            log.warn("Failed to delete temp file {}: {}", temp, cleanup.getMessage());
        }
    }

    public Path file() {
        return file;
    }
}
