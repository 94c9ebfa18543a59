package com.example.llmexplorer.dto;

import com.example.llmexplorer.graph.GraphEdge;
import com.example.llmexplorer.graph.GraphNode;
import com.example.llmexplorer.knowledge.KnowledgeDelta;
import com.example.llmexplorer.session.SessionContext;
import com.example.llmexplorer.session.SessionStatus;
import com.example.llmexplorer.session.TerminalReason;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 一次会话的结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionResult {

    private String sessionId;
    private String jobId;
    private String deviceSerial;
    private String appId;
    private SessionStatus status;
    private TerminalReason terminalReason;

    /**
     * 访问到的不同界面数
     */
    private int visitedNodes;

    /**
     * 访问到的界面名（按首次访问顺序）
     */
    @Builder.Default
    private List<String> screens = new ArrayList<>();

    @Builder.Default
    private List<GraphEdge> edges = new ArrayList<>();

    private int stepsTaken;
    private int oracleErrors;
    private int loopsDetected;
    private int crashes;

    private Instant startedAt;
    private Instant finishedAt;
    private long elapsedMs;

    @Builder.Default
    private List<StepTrace> traces = new ArrayList<>();

    /**
     * 交给知识库合并的增量，不写入结果文件
     */
    @JsonIgnore
    private KnowledgeDelta knowledgeDelta;

    public static SessionResult from(SessionContext context) {
        Instant finished = Instant.now();
        List<GraphNode> nodes = context.getGraph().getNodes();
        return SessionResult.builder()
                .sessionId(context.getSessionId())
                .jobId(context.getJob().getId())
                .deviceSerial(context.getDevice().getSerial())
                .appId(context.getAppId())
                .status(context.getTerminalReason().getStatus())
                .terminalReason(context.getTerminalReason())
                .visitedNodes(nodes.size())
                .screens(nodes.stream().map(GraphNode::getScreenName).distinct().collect(Collectors.toList()))
                .edges(new ArrayList<>(context.getGraph().getEdges()))
                .stepsTaken(context.getStepsTaken())
                .oracleErrors(context.getOracleErrors())
                .loopsDetected(context.getLoopsDetected())
                .crashes(context.getCrashes())
                .startedAt(context.getStartedAt())
                .finishedAt(finished)
                .elapsedMs(Duration.between(context.getStartedAt(), finished).toMillis())
                .traces(new ArrayList<>(context.getTraces()))
                .knowledgeDelta(context.getDelta())
                .build();
    }

    /**
     * 会话还没开始就失败（比如连不上设备）
     */
    public static SessionResult notStarted(JobDescriptor job, DeviceHandle device, TerminalReason reason) {
        Instant now = Instant.now();
        return SessionResult.builder()
                .sessionId(job.getId() + "@" + device.getSerial())
                .jobId(job.getId())
                .deviceSerial(device.getSerial())
                .appId(job.getAppId())
                .status(reason.getStatus())
                .terminalReason(reason)
                .startedAt(now)
                .finishedAt(now)
                .build();
    }
}
