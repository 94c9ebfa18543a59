package com.example.llmexplorer.support;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.executor.ActionExecutor;
import com.example.llmexplorer.fingerprint.StateFingerprinter;
import com.example.llmexplorer.oracle.DecisionOracle;
import com.example.llmexplorer.oracle.LlmClient;
import com.example.llmexplorer.oracle.OracleReplyParser;
import com.example.llmexplorer.oracle.PromptBuilder;
import com.example.llmexplorer.session.ExplorationSessionFactory;
import com.example.llmexplorer.session.FallbackPolicy;
import com.example.llmexplorer.session.ScreenObserver;
import com.example.llmexplorer.session.graph.SessionGraphBuilder;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Duration;

/**
 * 不启动 Spring 容器，手工装配探索组件
 */
public final class TestExplorer {

    private TestExplorer() {
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    /**
     * 退避为零、轮询间隔很短的配置
     */
    public static ExplorerProperties properties() {
        ExplorerProperties properties = new ExplorerProperties();
        properties.getOracle().setInitialBackoff(Duration.ZERO);
        properties.getOracle().setMaxBackoff(Duration.ZERO);
        properties.getScheduler().setPollInterval(Duration.ofMillis(20));
        properties.getSession().setDefaultTimeBudget(Duration.ZERO);
        return properties;
    }

    public static DecisionOracle oracle(ExplorerProperties properties, LlmClient llmClient) {
        return new DecisionOracle(llmClient, new PromptBuilder(properties),
                new OracleReplyParser(objectMapper()), properties);
    }

    public static ExplorationSessionFactory sessionFactory(ExplorerProperties properties, LlmClient llmClient) {
        StateFingerprinter fingerprinter = new StateFingerprinter(properties);
        SessionGraphBuilder graphBuilder = new SessionGraphBuilder(
                new ScreenObserver(fingerprinter, properties),
                oracle(properties, llmClient),
                new FallbackPolicy(),
                new ActionExecutor(fingerprinter, properties),
                properties);
        return new ExplorationSessionFactory(graphBuilder, properties);
    }
}
