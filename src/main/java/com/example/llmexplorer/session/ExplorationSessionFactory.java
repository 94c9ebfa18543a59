package com.example.llmexplorer.session;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.dto.DeviceHandle;
import com.example.llmexplorer.dto.JobDescriptor;
import com.example.llmexplorer.executor.DeviceDriver;
import com.example.llmexplorer.graph.ActivityGraph;
import com.example.llmexplorer.graph.LoopDetector;
import com.example.llmexplorer.knowledge.KnowledgeDelta;
import com.example.llmexplorer.knowledge.KnowledgeSnapshot;
import com.example.llmexplorer.session.graph.SessionGraphBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * 为每个（任务, 设备）组装独立的会话：独立的活动图、循环检测器与知识增量
 */
@Component
@RequiredArgsConstructor
public class ExplorationSessionFactory {

    private final SessionGraphBuilder graphBuilder;
    private final ExplorerProperties properties;

    public ExplorationSession create(JobDescriptor job, DeviceHandle device, DeviceDriver driver,
                                     KnowledgeSnapshot knowledge, StopSignal stopSignal) {
        String sessionId = sessionIdOf(job, device);
        Instant now = Instant.now();

        SessionContext context = new SessionContext();
        context.setSessionId(sessionId);
        context.setJob(job);
        context.setDevice(device);
        context.setDriver(driver);
        context.setStopSignal(stopSignal);
        context.setGraph(new ActivityGraph(properties.getGraph().getDeadEndRetryBudget()));
        context.setLoopDetector(new LoopDetector(properties.getGraph().getLoopWindow(),
                properties.getGraph().getLoopMaxDistinct()));
        context.setKnowledge(knowledge);
        context.setDelta(new KnowledgeDelta(job.getAppId(), sessionId));
        context.setStartedAt(now);
        context.setDeadline(job.getTimeBudgetSeconds() > 0 ? now.plus(job.timeBudget()) : null);

        return new ExplorationSession(context, graphBuilder.build());
    }

    public static String sessionIdOf(JobDescriptor job, DeviceHandle device) {
        return job.getId() + "@" + device.getSerial();
    }
}
