package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * 테넌트 단위 워크스페이스.
 *
 * <p>소유자 멤버십과 함께 생성되며, 쿼터는 {@link Plan} 기본값에
 * {@link QuotaOverrides}를 덮어써서 계산합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class Workspace {

    private String id;
    private String name;
    private String ownerUserId;
    private Plan plan;
    private QuotaOverrides quotaOverrides;
    private Instant createdAt;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getOwnerUserId() {
        return ownerUserId;
    }

    public void setOwnerUserId(String ownerUserId) {
        this.ownerUserId = ownerUserId;
    }

    public Plan getPlan() {
        return plan;
    }

    public void setPlan(Plan plan) {
        this.plan = plan;
    }

    public QuotaOverrides getQuotaOverrides() {
        return quotaOverrides;
    }

    public void setQuotaOverrides(QuotaOverrides quotaOverrides) {
        this.quotaOverrides = quotaOverrides;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    /**
     * 실효 템플릿 한도.
     */
    public int effectiveMaxTemplates() {
        Plan base = plan == null ? Plan.FREE : plan;
        if (quotaOverrides != null && quotaOverrides.getMaxTemplates() != null) {
            return quotaOverrides.getMaxTemplates();
        }
        return base.maxTemplates();
    }

    /**
     * 실효 동시 실행 세션 한도.
     */
    public int effectiveMaxRunningSessions() {
        Plan base = plan == null ? Plan.FREE : plan;
        if (quotaOverrides != null && quotaOverrides.getMaxRunningSessions() != null) {
            return quotaOverrides.getMaxRunningSessions();
        }
        return base.maxRunningSessions();
    }

    @JsonIgnore
    public Limits getLimits() {
        return new Limits(effectiveMaxTemplates(), effectiveMaxRunningSessions());
    }
}
