package com.example.llmexplorer.session;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.executor.DriverTimeoutException;
import com.example.llmexplorer.fingerprint.CaptureException;
import com.example.llmexplorer.fingerprint.ObservedState;
import com.example.llmexplorer.fingerprint.StateFingerprinter;
import com.example.llmexplorer.graph.GraphNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 抓取界面并落到活动图上
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScreenObserver {

    private final StateFingerprinter fingerprinter;
    private final ExplorerProperties properties;

    /**
     * 抓取并计算指纹，抓取失败或驱动超时重试 capture-retries 次
     *
     * @throws CaptureException 重试用尽
     * @throws com.example.llmexplorer.executor.AppCrashedException 抓取时发现 App 已崩溃
     */
    public ObservedState capture(SessionContext context) {
        int retries = Math.max(0, properties.getSession().getCaptureRetries());
        RuntimeException lastError = null;
        for (int attempt = 0; attempt <= retries; attempt++) {
            try {
                return fingerprinter.fingerprint(context.getDriver().capture());
            } catch (CaptureException | DriverTimeoutException e) {
                lastError = e;
                log.warn("[Session] {} 抓取界面失败（第 {}/{} 次）: {}",
                        context.getSessionId(), attempt + 1, retries + 1, e.getMessage());
            }
        }
        throw new CaptureException("screen capture failed " + (retries + 1) + " times: "
                + lastError.getMessage(), lastError);
    }

    /**
     * 到达一个界面：查找或创建节点，并记入知识增量
     */
    public GraphNode arrive(SessionContext context, ObservedState observed) {
        GraphNode node = context.getGraph().lookupOrCreate(
                observed.getFingerprint(), observed.getScreenName(), observed.actionKeys());
        context.getDelta().recordVisit(observed.getFingerprint(), observed.getScreenName());
        return node;
    }
}
