package com.example.llmexplorer.knowledge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 一个被测 App 的全部知识，也是落盘的单位（每个 App 一个 JSON 文件）
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppKnowledge {

    private String appId;
    private Map<String, KnowledgeRecord> records = new TreeMap<>();
    /** 会离开被测 App 的动作，后续会话不再提供给 LLM 选择 */
    private Set<String> bannedActions = new TreeSet<>();

    public AppKnowledge(String appId) {
        this.appId = appId;
    }

    public void setRecords(Map<String, KnowledgeRecord> records) {
        this.records = records == null ? new TreeMap<>() : new TreeMap<>(records);
    }

    public void setBannedActions(Set<String> bannedActions) {
        this.bannedActions = bannedActions == null ? new TreeSet<>() : new TreeSet<>(bannedActions);
    }

    public AppKnowledge copy() {
        AppKnowledge copy = new AppKnowledge(appId);
        records.forEach((fingerprint, record) -> copy.records.put(fingerprint, record.copy()));
        copy.bannedActions.addAll(bannedActions);
        return copy;
    }
}
