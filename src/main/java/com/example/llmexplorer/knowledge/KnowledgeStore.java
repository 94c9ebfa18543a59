package com.example.llmexplorer.knowledge;

import com.example.llmexplorer.config.ExplorerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 跨会话知识库
 *
 * 功能：
 * 1. 会话开始时给出快照（深拷贝，之后互不影响）
 * 2. 会话结束时合并增量：次数相加、集合并集、标志取或，顺序无关
 * 3. 定期落盘（checkpoint）与结束时 flush
 *
 * 所有读写都在同一把锁下串行化，合并先在副本上完成再整体替换
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class KnowledgeStore {

    private final KnowledgeRepository repository;
    private final ExplorerProperties properties;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, AppKnowledge> apps = new HashMap<>();
    private final List<KnowledgeMergeConflict> conflicts = new ArrayList<>();
    private long mergedDeltas;

    /**
     * 从持久化介质加载；配置了 wipe 时从空库开始
     */
    public void load() {
        lock.lock();
        try {
            apps.clear();
            if (properties.getKnowledge().isWipe()) {
                log.info("[Knowledge] 已配置清空知识库，从空库开始");
                return;
            }
            apps.putAll(repository.load());
            log.info("[Knowledge] 加载知识库完成: {} 个 App", apps.size());
        } finally {
            lock.unlock();
        }
    }

    public KnowledgeSnapshot snapshot(String appId) {
        lock.lock();
        try {
            AppKnowledge knowledge = apps.get(appId);
            return knowledge == null ? KnowledgeSnapshot.empty(appId) : KnowledgeSnapshot.of(knowledge);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 合并一个会话的增量
     *
     * @return 本次合并中发现的注释冲突（已按后写入者生效）
     */
    public List<KnowledgeMergeConflict> merge(KnowledgeDelta delta) {
        if (delta == null) {
            return List.of();
        }
        lock.lock();
        try {
            AppKnowledge current = apps.get(delta.getAppId());
            AppKnowledge staged = current == null ? new AppKnowledge(delta.getAppId()) : current.copy();

            List<KnowledgeMergeConflict> found = new ArrayList<>();
            delta.getRecords().forEach((fingerprint, increment) ->
                    staged.getRecords()
                            .computeIfAbsent(fingerprint, fp -> new KnowledgeRecord(fp, increment.getScreenName()))
                            .absorb(increment, delta.getAppId(), delta.getSessionId(), found));
            staged.getBannedActions().addAll(delta.getBannedActions());

            apps.put(delta.getAppId(), staged);
            mergedDeltas++;
            conflicts.addAll(found);

            for (KnowledgeMergeConflict conflict : found) {
                log.warn("[Knowledge] 注释冲突，以后写入者为准: {}", conflict);
            }
            log.info("[Knowledge] 合并会话 {} 的增量: {} 条记录, {} 个禁用动作",
                    delta.getSessionId(), delta.getRecords().size(), delta.getBannedActions().size());
            return found;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 把当前内容写入持久化介质
     */
    public void flush() {
        lock.lock();
        try {
            List<AppKnowledge> copies = new ArrayList<>();
            for (AppKnowledge knowledge : apps.values()) {
                copies.add(knowledge.copy());
            }
            repository.save(copies);
            log.info("[Knowledge] 知识库已落盘: {} 个 App, 累计合并 {} 个会话", copies.size(), mergedDeltas);
        } finally {
            lock.unlock();
        }
    }

    public List<KnowledgeMergeConflict> getConflicts() {
        lock.lock();
        try {
            return List.copyOf(conflicts);
        } finally {
            lock.unlock();
        }
    }
}
