package com.ryuqq.controlplane.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 템플릿 버전 매니페스트.
 *
 * <p>{@code simulateFailure}가 true이면 기본 빌더가 빌드를 실패시킵니다.
 * {@code sleepTtlSeconds}는 슬립 상태 세션의 보존 기간을 재정의합니다.</p>
 *
 * @author Control Plane Team
 * @since 1.0.0
 */
public class Manifest {

    private String image;
    private List<String> features = new ArrayList<>();
    private List<String> persistedPaths = new ArrayList<>();
    private Long sleepTtlSeconds;
    private boolean simulateFailure;

    public String getImage() {
        return image;
    }

    public void setImage(String image) {
        this.image = image;
    }

    public List<String> getFeatures() {
        return features;
    }

    public void setFeatures(List<String> features) {
        this.features = features == null ? new ArrayList<>() : new ArrayList<>(features);
    }

    public List<String> getPersistedPaths() {
        return persistedPaths;
    }

    public void setPersistedPaths(List<String> persistedPaths) {
        this.persistedPaths = persistedPaths == null ? new ArrayList<>() : new ArrayList<>(persistedPaths);
    }

    public Long getSleepTtlSeconds() {
        return sleepTtlSeconds;
    }

    public void setSleepTtlSeconds(Long sleepTtlSeconds) {
        this.sleepTtlSeconds = sleepTtlSeconds;
    }

    public boolean isSimulateFailure() {
        return simulateFailure;
    }

    public void setSimulateFailure(boolean simulateFailure) {
        this.simulateFailure = simulateFailure;
    }
}
