package com.ryuqq.controlplane.application.upload;

import com.ryuqq.controlplane.application.ledger.Ledger;
import com.ryuqq.controlplane.application.support.AccessGuard;
import com.ryuqq.controlplane.application.support.AuthContext;
import com.ryuqq.controlplane.application.support.StateQueries;
import com.ryuqq.controlplane.core.config.ControlPlaneConfig;
import com.ryuqq.controlplane.core.error.ControlPlaneException;
import com.ryuqq.controlplane.core.model.Session;
import com.ryuqq.controlplane.core.model.Snapshot;
import com.ryuqq.controlplane.core.model.Template;
import com.ryuqq.controlplane.core.model.TemplateVersion;
import com.ryuqq.controlplane.core.model.UploadGrant;
import com.ryuqq.controlplane.core.model.UploadTarget;
import com.ryuqq.controlplane.core.model.UsageKind;
import com.ryuqq.controlplane.core.spi.ObjectStore;
import com.ryuqq.controlplane.core.spi.ObjectTarget;
import com.ryuqq.controlplane.core.spi.StoredObject;
import com.ryuqq.controlplane.core.state.StateDocument;
import com.ryuqq.controlplane.core.store.StateStore;
import com.ryuqq.controlplane.core.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 스냅샷, 번들 업로드와 업로드 그랜트 관리.
 *
 * <p><strong>업로드 경로:</strong></p>
 * <ul>
 *   <li>직접 업로드: 토큰 인증 후 본문을 바로 저장 (크기 상한 초과 시 PAYLOAD_TOO_LARGE)</li>
 *   <li>그랜트 업로드: 그랜트 생성 후 {@link #consumeUploadGrant}로 1회만 사용</li>
 * </ul>
 *
 * <p>본문은 {@link ObjectStore}에, 크기와 콘텐츠 타입은 대상 엔티티에 기록됩니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class UploadService {

    private static final Logger log = LoggerFactory.getLogger(UploadService.class);

    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final StateStore stateStore;
    private final Clock clock;
    private final ControlPlaneConfig config;
    private final ObjectStore objectStore;

    public UploadService(StateStore stateStore, Clock clock, ControlPlaneConfig config, ObjectStore objectStore) {
        if (stateStore == null) {
            throw new IllegalArgumentException("stateStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (objectStore == null) {
            throw new IllegalArgumentException("objectStore cannot be null");
        }
        this.stateStore = stateStore;
        this.clock = clock;
        this.config = config;
        this.objectStore = objectStore;
    }

    // ============================================================
    // 스냅샷
    // ============================================================

    /**
     * 스냅샷 메타데이터 생성 (내용은 이후 업로드).
     */
    public Snapshot createSnapshot(String token, String sessionId, String label) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            Snapshot snapshot = new Snapshot();
            snapshot.setId(Ids.next("snap"));
            snapshot.setSessionId(session.getId());
            snapshot.setLabel(label == null || label.isBlank() ? "snapshot" : label.trim());
            snapshot.setCreatedAt(now);
            state.getSnapshots().add(snapshot);
            Ledger.usage(state, now, auth.workspaceId(), UsageKind.SNAPSHOT, 1, Map.of("sessionId", session.getId()));
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "snapshot.created", "snapshot",
                snapshot.getId(), Map.of("sessionId", session.getId()));
            return snapshot;
        });
    }

    public List<Snapshot> listSnapshots(String token, String sessionId) {
        return stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            Session session = StateQueries.requireSession(state, auth.workspaceId(), sessionId);
            return state.getSnapshots().stream().filter(s -> s.getSessionId().equals(session.getId())).toList();
        });
    }

    /**
     * 스냅샷 삭제. 오브젝트 스토어 내용도 즉시 제거합니다.
     */
    public void deleteSnapshot(String token, String snapshotId) {
        stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Snapshot snapshot = requireSnapshot(state, auth.workspaceId(), snapshotId);
            state.getSnapshots().remove(snapshot);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "snapshot.deleted", "snapshot",
                snapshot.getId());
            return snapshot;
        });
        objectStore.delete(ObjectTarget.snapshot(snapshotId));
    }

    public Snapshot uploadSnapshotContent(String token, String snapshotId, byte[] body, String contentType) {
        requireBody(body, config.maxSnapshotBytes(), "Snapshot");
        String type = contentTypeOrDefault(contentType);
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Snapshot snapshot = requireSnapshot(state, auth.workspaceId(), snapshotId);
            objectStore.put(ObjectTarget.snapshot(snapshot.getId()), body, type);
            markSnapshotUploaded(snapshot, body.length, type, now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "snapshot.uploaded", "snapshot",
                snapshot.getId(), Map.of("bytes", String.valueOf(body.length)));
            return snapshot;
        });
    }

    public StoredObject getSnapshotContent(String token, String snapshotId) {
        stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            return requireSnapshot(state, auth.workspaceId(), snapshotId);
        });
        return objectStore.get(ObjectTarget.snapshot(snapshotId))
            .orElseThrow(() -> ControlPlaneException.notFound("Snapshot content not found"));
    }

    // ============================================================
    // 번들
    // ============================================================

    public TemplateVersion uploadTemplateVersionBundle(
        String token,
        String templateId,
        String versionId,
        byte[] body,
        String contentType
    ) {
        requireBody(body, config.maxBundleBytes(), "Bundle");
        String type = contentTypeOrDefault(contentType);
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            TemplateVersion version = StateQueries.requireVersion(state, template.getId(), versionId);
            objectStore.put(ObjectTarget.bundle(version.getId()), body, type);
            markBundleUploaded(version, body.length, type, now);
            Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "template.bundle_uploaded",
                "template_version", version.getId(), Map.of("bytes", String.valueOf(body.length)));
            return version;
        });
    }

    public StoredObject getTemplateVersionBundle(String token, String templateId, String versionId) {
        stateStore.transact(state -> {
            AuthContext auth = AccessGuard.requireAuth(state, token, clock.instant());
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            return StateQueries.requireVersion(state, template.getId(), versionId);
        });
        return objectStore.get(ObjectTarget.bundle(versionId))
            .orElseThrow(() -> ControlPlaneException.notFound("Bundle not found"));
    }

    // ============================================================
    // 업로드 그랜트
    // ============================================================

    public UploadGrant createSnapshotUploadGrant(String token, String snapshotId, String contentType, long bytes) {
        requireDeclaredBytes(bytes, config.maxSnapshotBytes(), "Snapshot");
        String type = contentTypeOrDefault(contentType);
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Snapshot snapshot = requireSnapshot(state, auth.workspaceId(), snapshotId);
            return issueGrant(state, auth, UploadTarget.SNAPSHOT, snapshot.getId(), type, bytes, now);
        });
    }

    public UploadGrant createBundleUploadGrant(
        String token,
        String templateId,
        String versionId,
        String contentType,
        long bytes
    ) {
        requireDeclaredBytes(bytes, config.maxBundleBytes(), "Bundle");
        String type = contentTypeOrDefault(contentType);
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            AuthContext auth = AccessGuard.requireWrite(state, token, now);
            Template template = StateQueries.requireTemplate(state, auth.workspaceId(), templateId);
            TemplateVersion version = StateQueries.requireVersion(state, template.getId(), versionId);
            return issueGrant(state, auth, UploadTarget.BUNDLE, version.getId(), type, bytes, now);
        });
    }

    private UploadGrant issueGrant(
        StateDocument state,
        AuthContext auth,
        UploadTarget target,
        String targetId,
        String contentType,
        long bytes,
        Instant now
    ) {
        UploadGrant grant = new UploadGrant();
        grant.setId(Ids.next("upl"));
        grant.setWorkspaceId(auth.workspaceId());
        grant.setTarget(target);
        grant.setTargetId(targetId);
        grant.setContentType(contentType);
        grant.setBytes(bytes);
        grant.setCreatedByUserId(auth.userId());
        grant.setCreatedAt(now);
        grant.setExpiresAt(now.plus(config.uploadGrantTtl()));
        state.getUploadGrants().add(grant);
        Ledger.audit(state, now, auth.workspaceId(), auth.userId(), "upload.grant_created", "upload_grant",
            grant.getId(), Map.of("target", target.wireName(), "targetId", targetId));
        return grant;
    }

    /**
     * 그랜트로 업로드 (1회용). 그랜트 자체가 권한이므로 토큰이 필요 없습니다.
     *
     * @throws ControlPlaneException 그랜트 없음 NOT_FOUND, 사용됨 CONFLICT,
     *                               만료/크기 초과/콘텐츠 타입 불일치 BAD_REQUEST
     */
    public UploadGrant consumeUploadGrant(String grantId, byte[] body, String contentType) {
        return stateStore.transact(state -> {
            Instant now = clock.instant();
            UploadGrant grant = state.getUploadGrants().stream()
                .filter(g -> g.getId().equals(grantId))
                .findFirst()
                .orElseThrow(() -> ControlPlaneException.notFound("Upload grant not found"));
            if (grant.getUsedAt() != null) {
                throw ControlPlaneException.conflict("Upload grant already used");
            }
            if (!grant.getExpiresAt().isAfter(now)) {
                throw ControlPlaneException.badRequest("Upload grant expired");
            }
            if (body == null || body.length == 0) {
                throw ControlPlaneException.badRequest("Upload body is required");
            }
            if (body.length > grant.getBytes()) {
                throw ControlPlaneException.badRequest(
                    "Upload exceeds granted size (" + body.length + " > " + grant.getBytes() + ")");
            }
            String type = contentTypeOrDefault(contentType);
            if (!type.equals(grant.getContentType())) {
                throw ControlPlaneException.badRequest("Content type does not match grant");
            }

            if (grant.getTarget() == UploadTarget.SNAPSHOT) {
                Snapshot snapshot = state.getSnapshots().stream()
                    .filter(s -> s.getId().equals(grant.getTargetId()))
                    .findFirst()
                    .orElseThrow(() -> ControlPlaneException.notFound("Snapshot not found"));
                objectStore.put(ObjectTarget.snapshot(snapshot.getId()), body, type);
                markSnapshotUploaded(snapshot, body.length, type, now);
            } else {
                TemplateVersion version = StateQueries.findVersion(state, grant.getTargetId())
                    .orElseThrow(() -> ControlPlaneException.notFound("Template version not found"));
                objectStore.put(ObjectTarget.bundle(version.getId()), body, type);
                markBundleUploaded(version, body.length, type, now);
            }
            grant.setUsedAt(now);
            Ledger.audit(state, now, grant.getWorkspaceId(), grant.getCreatedByUserId(), "upload.grant_consumed",
                "upload_grant", grant.getId(), Map.of("bytes", String.valueOf(body.length)));
            log.debug("Upload grant {} consumed ({} bytes to {} {})", grant.getId(), body.length,
                grant.getTarget().wireName(), grant.getTargetId());
            return grant;
        });
    }

    // ============================================================
    // 내부 헬퍼
    // ============================================================

    private static Snapshot requireSnapshot(StateDocument state, String workspaceId, String snapshotId) {
        Snapshot snapshot = state.getSnapshots().stream()
            .filter(s -> s.getId().equals(snapshotId))
            .findFirst()
            .orElseThrow(() -> ControlPlaneException.notFound("Snapshot not found"));
        StateQueries.findSession(state, snapshot.getSessionId())
            .filter(s -> s.getWorkspaceId().equals(workspaceId))
            .orElseThrow(() -> ControlPlaneException.notFound("Snapshot not found"));
        return snapshot;
    }

    private static void markSnapshotUploaded(Snapshot snapshot, long bytes, String contentType, Instant now) {
        snapshot.setBytes(bytes);
        snapshot.setContentType(contentType);
        snapshot.setUploadedAt(now);
    }

    private static void markBundleUploaded(TemplateVersion version, long bytes, String contentType, Instant now) {
        version.setBundleBytes(bytes);
        version.setBundleContentType(contentType);
        version.setBundleUploadedAt(now);
    }

    private static void requireBody(byte[] body, long ceiling, String label) {
        if (body == null || body.length == 0) {
            throw ControlPlaneException.badRequest(label + " body is required");
        }
        if (body.length > ceiling) {
            throw ControlPlaneException.payloadTooLarge(
                label + " exceeds " + ceiling + " bytes (actual: " + body.length + ")");
        }
    }

    private static void requireDeclaredBytes(long bytes, long ceiling, String label) {
        if (bytes <= 0) {
            throw ControlPlaneException.badRequest(label + " size must be positive");
        }
        if (bytes > ceiling) {
            throw ControlPlaneException.payloadTooLarge(label + " exceeds " + ceiling + " bytes");
        }
    }

    private static String contentTypeOrDefault(String contentType) {
        return contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType.trim();
    }
}
