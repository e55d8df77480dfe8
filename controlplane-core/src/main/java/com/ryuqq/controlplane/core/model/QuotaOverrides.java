package com.ryuqq.controlplane.core.model;

/**
 * 워크스페이스별 쿼터 재정의. null 필드는 플랜 기본값을 사용합니다.
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class QuotaOverrides {

    private Integer maxTemplates;
    private Integer maxRunningSessions;

    public Integer getMaxTemplates() {
        return maxTemplates;
    }

    public void setMaxTemplates(Integer maxTemplates) {
        this.maxTemplates = maxTemplates;
    }

    public Integer getMaxRunningSessions() {
        return maxRunningSessions;
    }

    public void setMaxRunningSessions(Integer maxRunningSessions) {
        this.maxRunningSessions = maxRunningSessions;
    }
}
