package com.example.llmexplorer.knowledge;

import com.example.llmexplorer.fingerprint.StateFingerprint;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 一个会话产生的知识增量，会话结束（包括失败）后交给 KnowledgeStore 合并
 *
 * 只由所属会话的线程写入
 */
@Getter
public class KnowledgeDelta {

    private final String appId;
    private final String sessionId;
    private final Map<String, KnowledgeRecord> records = new LinkedHashMap<>();
    private final Set<String> bannedActions = new LinkedHashSet<>();

    public KnowledgeDelta(String appId, String sessionId) {
        this.appId = appId;
        this.sessionId = sessionId;
    }

    public void recordVisit(StateFingerprint fingerprint, String screenName) {
        KnowledgeRecord record = record(fingerprint);
        if (record.getScreenName() == null) {
            record.setScreenName(screenName);
        }
        record.setVisits(record.getVisits() + 1);
    }

    public void recordTried(StateFingerprint fingerprint, String actionKey) {
        record(fingerprint).getTriedActions().add(actionKey);
    }

    public void recordCrash(StateFingerprint fingerprint, String actionKey) {
        KnowledgeRecord record = record(fingerprint);
        record.getTriedActions().add(actionKey);
        record.getCrashActions().add(actionKey);
    }

    public void markDeadEnd(StateFingerprint fingerprint) {
        record(fingerprint).setDeadEnd(true);
    }

    public void annotate(StateFingerprint fingerprint, String key, String value) {
        record(fingerprint).getAnnotations().put(key, value);
    }

    public String annotation(StateFingerprint fingerprint, String key) {
        KnowledgeRecord record = records.get(fingerprint.value());
        return record == null ? null : record.getAnnotations().get(key);
    }

    public void ban(String actionKey) {
        bannedActions.add(actionKey);
    }

    /**
     * 只在某个界面上禁用动作
     */
    public void banOn(StateFingerprint fingerprint, String actionKey) {
        record(fingerprint).getBannedActions().add(actionKey);
    }

    public boolean isEmpty() {
        return records.isEmpty() && bannedActions.isEmpty();
    }

    public Map<String, KnowledgeRecord> getRecords() {
        return Collections.unmodifiableMap(records);
    }

    public Set<String> getBannedActions() {
        return Collections.unmodifiableSet(bannedActions);
    }

    private KnowledgeRecord record(StateFingerprint fingerprint) {
        return records.computeIfAbsent(fingerprint.value(), fp -> new KnowledgeRecord(fp, null));
    }
}
