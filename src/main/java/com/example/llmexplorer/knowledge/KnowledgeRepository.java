package com.example.llmexplorer.knowledge;

import java.util.Collection;
import java.util.Map;

/**
 * 知识库的持久化介质
 */
public interface KnowledgeRepository {

    /**
     * @return appId -> 该 App 的知识
     */
    Map<String, AppKnowledge> load();

    void save(Collection<AppKnowledge> apps);
}
