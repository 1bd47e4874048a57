package io.kneo.programmer.model.schedule;

import java.util.LinkedHashMap;
import java.util.Map;

public record ScheduleSource(String dslPath, String gitCommit, String compilerVersion) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("dsl_path", dslPath);
        map.put("git_commit", gitCommit);
        map.put("compiler_version", compilerVersion);
        return map;
    }
}
