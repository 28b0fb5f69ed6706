package com.nutritioninsights.dietanalysis.infrastructure.output;

import java.nio.file.Path;
import java.util.List;

/**
 * 한 번의 실행에서 만든 산출물 목록. 생성 후 변경되지 않는다.
 *
 * @param artifacts 기록 순서대로의 산출물
 */
public record ArtifactManifest(List<Artifact> artifacts) {

    public ArtifactManifest {
        artifacts = List.copyOf(artifacts);
    }

    public List<Artifact> ofKind(Kind kind) {
        return artifacts.stream().filter(a -> a.kind() == kind).toList();
    }

    /** 산출물 종류 */
    public enum Kind {
        TABLE,
        DOCUMENT,
        CHART
    }

    /**
     * 산출물 한 건.
     *
     * @param name 파일명
     * @param kind 종류
     * @param path 기록된 경로
     */
    public record Artifact(String name, Kind kind, Path path) {}
}
