package com.example.llmexplorer.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 单个界面指纹的跨会话知识
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class KnowledgeRecord {

    /** 界面描述的注释 key */
    public static final String DESCRIPTION = "description";

    private String fingerprint;
    private String screenName;
    private long visits;
    private Set<String> triedActions = new TreeSet<>();
    /** 曾导致崩溃的动作 */
    private Set<String> crashActions = new TreeSet<>();
    /** 只在这个界面上会离开 App 的动作（目前只有 BACK） */
    private Set<String> bannedActions = new TreeSet<>();
    private boolean deadEnd;
    private Map<String, String> annotations = new TreeMap<>();

    public KnowledgeRecord(String fingerprint, String screenName) {
        this.fingerprint = fingerprint;
        this.screenName = screenName;
    }

    public void setTriedActions(Set<String> triedActions) {
        this.triedActions = triedActions == null ? new TreeSet<>() : new TreeSet<>(triedActions);
    }

    public void setCrashActions(Set<String> crashActions) {
        this.crashActions = crashActions == null ? new TreeSet<>() : new TreeSet<>(crashActions);
    }

    public void setBannedActions(Set<String> bannedActions) {
        this.bannedActions = bannedActions == null ? new TreeSet<>() : new TreeSet<>(bannedActions);
    }

    public void setAnnotations(Map<String, String> annotations) {
        this.annotations = annotations == null ? new TreeMap<>() : new TreeMap<>(annotations);
    }

    public KnowledgeRecord copy() {
        KnowledgeRecord copy = new KnowledgeRecord(fingerprint, screenName);
        copy.visits = visits;
        copy.triedActions = new TreeSet<>(triedActions);
        copy.crashActions = new TreeSet<>(crashActions);
        copy.bannedActions = new TreeSet<>(bannedActions);
        copy.deadEnd = deadEnd;
        copy.annotations = new TreeMap<>(annotations);
        return copy;
    }

    /**
     * 把增量并入当前记录：访问次数相加、集合取并集、标志取或；
     * 注释同 key 不同值时以增量为准，冲突写入 conflicts
     */
    void absorb(KnowledgeRecord increment, String appId, String sessionId, List<KnowledgeMergeConflict> conflicts) {
        if (screenName == null) {
            screenName = increment.screenName;
        }
        visits += increment.visits;
        triedActions.addAll(increment.triedActions);
        crashActions.addAll(increment.crashActions);
        bannedActions.addAll(increment.bannedActions);
        deadEnd = deadEnd || increment.deadEnd;
        increment.annotations.forEach((key, value) -> {
            String previous = annotations.put(key, value);
            if (previous != null && !previous.equals(value)) {
                conflicts.add(new KnowledgeMergeConflict(appId, fingerprint, key, previous, value, sessionId));
            }
        });
    }
}
