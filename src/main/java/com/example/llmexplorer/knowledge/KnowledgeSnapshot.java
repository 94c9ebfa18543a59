package com.example.llmexplorer.knowledge;

import com.example.llmexplorer.fingerprint.StateFingerprint;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 会话开始时拿到的只读知识视图，之后其他会话的合并不会影响它
 */
public final class KnowledgeSnapshot {

    private final String appId;
    private final Map<String, KnowledgeRecord> records;
    private final Set<String> bannedActions;

    private KnowledgeSnapshot(String appId, Map<String, KnowledgeRecord> records, Set<String> bannedActions) {
        this.appId = appId;
        this.records = records;
        this.bannedActions = bannedActions;
    }

    public static KnowledgeSnapshot empty(String appId) {
        return new KnowledgeSnapshot(appId, Map.of(), Set.of());
    }

    static KnowledgeSnapshot of(AppKnowledge knowledge) {
        Map<String, KnowledgeRecord> copies = new HashMap<>();
        knowledge.getRecords().forEach((fingerprint, record) -> copies.put(fingerprint, record.copy()));
        return new KnowledgeSnapshot(knowledge.getAppId(),
                Collections.unmodifiableMap(copies),
                Collections.unmodifiableSet(new TreeSet<>(knowledge.getBannedActions())));
    }

    public String getAppId() {
        return appId;
    }

    public Optional<KnowledgeRecord> record(StateFingerprint fingerprint) {
        KnowledgeRecord record = records.get(fingerprint.value());
        return Optional.ofNullable(record == null ? null : record.copy());
    }

    public Set<String> triedActions(StateFingerprint fingerprint) {
        KnowledgeRecord record = records.get(fingerprint.value());
        return record == null ? Set.of() : Collections.unmodifiableSet(record.getTriedActions());
    }

    public Set<String> crashActions(StateFingerprint fingerprint) {
        KnowledgeRecord record = records.get(fingerprint.value());
        return record == null ? Set.of() : Collections.unmodifiableSet(record.getCrashActions());
    }

    public long visits(StateFingerprint fingerprint) {
        KnowledgeRecord record = records.get(fingerprint.value());
        return record == null ? 0 : record.getVisits();
    }

    public String annotation(StateFingerprint fingerprint, String key) {
        KnowledgeRecord record = records.get(fingerprint.value());
        return record == null ? null : record.getAnnotations().get(key);
    }

    public boolean isKnownDeadEnd(StateFingerprint fingerprint) {
        KnowledgeRecord record = records.get(fingerprint.value());
        return record != null && record.isDeadEnd();
    }

    public boolean isBanned(String actionKey) {
        return bannedActions.contains(actionKey);
    }

    public Set<String> getBannedActions() {
        return bannedActions;
    }

    /**
     * 在某个界面上被禁用的动作：全 App 禁用的加上只在该界面禁用的
     */
    public Set<String> bannedActions(StateFingerprint fingerprint) {
        KnowledgeRecord record = records.get(fingerprint.value());
        if (record == null || record.getBannedActions().isEmpty()) {
            return bannedActions;
        }
        Set<String> banned = new TreeSet<>(bannedActions);
        banned.addAll(record.getBannedActions());
        return Collections.unmodifiableSet(banned);
    }

    public int size() {
        return records.size();
    }
}
