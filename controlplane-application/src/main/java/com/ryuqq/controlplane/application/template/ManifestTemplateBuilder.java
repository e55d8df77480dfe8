package com.ryuqq.controlplane.application.template;

import com.ryuqq.controlplane.core.builder.BuildRequest;
import com.ryuqq.controlplane.core.builder.TemplateBuilder;
import com.ryuqq.controlplane.core.model.Manifest;
import com.ryuqq.controlplane.core.outcome.BuildFailed;
import com.ryuqq.controlplane.core.outcome.BuildOutcome;
import com.ryuqq.controlplane.core.outcome.BuildSucceeded;
import com.ryuqq.controlplane.core.util.Hashing;

/**
 * 매니페스트만으로 이미지 참조를 결정하는 기본 빌더.
 *
 * <p>이미지 다이제스트는 버전 ID, 베이스 이미지, 번들 크기로부터 결정적으로
 * 계산됩니다. 매니페스트의 {@code simulateFailure}가 true이면 항상 실패합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public final class ManifestTemplateBuilder implements TemplateBuilder {

    @Override
    public BuildOutcome build(BuildRequest request) {
        Manifest manifest = request.manifest();
        boolean bundleUploaded = request.bundleBytes() != null;
        StringBuilder log = new StringBuilder()
            .append("build_id=").append(request.buildId()).append('\n')
            .append("template_version_id=").append(request.templateVersionId()).append('\n')
            .append("attempt=").append(request.attempt()).append('\n')
            .append("image=").append(manifest.getImage()).append('\n')
            .append("features=").append(String.join(",", manifest.getFeatures())).append('\n')
            .append("bundle_uploaded=").append(bundleUploaded).append('\n');

        if (manifest.isSimulateFailure()) {
            log.append("build_status=failed\n");
            return new BuildFailed("Simulated build failure", log.toString());
        }

        String digest = "sha256:" + Hashing.sha256(
            request.templateVersionId() + "|" + manifest.getImage() + "|" + request.bundleBytes()
        );
        String imageReference = repositoryOf(manifest.getImage()) + "@" + digest;
        log.append("image_reference=").append(imageReference).append('\n')
            .append("build_status=succeeded\n");
        return new BuildSucceeded(imageReference, digest, log.toString());
    }

    /**
     * 태그를 제거한 저장소 이름 (레지스트리 포트의 콜론은 유지).
     */
    static String repositoryOf(String image) {
        String withoutDigest = image.contains("@") ? image.substring(0, image.indexOf('@')) : image;
        int slash = withoutDigest.lastIndexOf('/');
        int colon = withoutDigest.lastIndexOf(':');
        return colon > slash ? withoutDigest.substring(0, colon) : withoutDigest;
    }
}
