package com.ryuqq.controlplane.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 워크스페이스 요금제와 기본 쿼터.
 *
 * <p>워크스페이스의 {@link QuotaOverrides}가 설정되어 있으면 해당 값이 우선합니다.</p>
 *
 * <table>
 *   <caption>플랜별 한도</caption>
 *   <tr><th>plan</th><th>maxTemplates</th><th>maxRunningSessions</th></tr>
 *   <tr><td>free</td><td>10</td><td>3</td></tr>
 *   <tr><td>pro</td><td>100</td><td>20</td></tr>
 *   <tr><td>enterprise</td><td>1000</td><td>200</td></tr>
 * </table>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public enum Plan {

    FREE("free", 10, 3),
    PRO("pro", 100, 20),
    ENTERPRISE("enterprise", 1000, 200);

    private final String wireName;
    private final int maxTemplates;
    private final int maxRunningSessions;

    Plan(String wireName, int maxTemplates, int maxRunningSessions) {
        this.wireName = wireName;
        this.maxTemplates = maxTemplates;
        this.maxRunningSessions = maxRunningSessions;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int maxTemplates() {
        return maxTemplates;
    }

    public int maxRunningSessions() {
        return maxRunningSessions;
    }

    public static Plan fromWireName(String value) {
        if (value == null) {
            return null;
        }
        for (Plan plan : values()) {
            if (plan.wireName.equalsIgnoreCase(value.trim())) {
                return plan;
            }
        }
        return null;
    }
}
