package com.example.llmexplorer.config;

import com.example.llmexplorer.fingerprint.FingerprintLevel;
import com.example.llmexplorer.dto.DeviceHandle;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 探索引擎配置（前缀 explorer）
 *
 * 所有可调参数集中在这里，默认值与 application.yml 保持一致
 */
@Data
@ConfigurationProperties(prefix = "explorer")
public class ExplorerProperties {

    private Fingerprint fingerprint = new Fingerprint();
    private Graph graph = new Graph();
    private Oracle oracle = new Oracle();
    private Executor executor = new Executor();
    private Session session = new Session();
    private Scheduler scheduler = new Scheduler();
    private Knowledge knowledge = new Knowledge();
    private Results results = new Results();
    private Testing testing = new Testing();
    private Run run = new Run();

    @Data
    public static class Fingerprint {
        private FingerprintLevel level = FingerprintLevel.STRUCTURE;
        /** 这些包名下的节点（状态栏等）不参与指纹计算 */
        private List<String> ignoredPackages = new ArrayList<>(List.of("com.android.systemui"));
    }

    @Data
    public static class Graph {
        /** 一个动作被尝试多少次后才算“已穷尽” */
        private int deadEndRetryBudget = 1;
        private int loopWindow = 6;
        private int loopMaxDistinct = 2;
    }

    @Data
    public static class Oracle {
        private int historyLength = 5;
        private int invalidReplyRetries = 2;
        /** 包含首次调用在内的总尝试次数 */
        private int unavailableMaxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Executor {
        private int driverTimeoutRetries = 2;
    }

    @Data
    public static class Session {
        private int captureRetries = 3;
        /** App 启动即崩溃时，连续重启多少次后放弃 */
        private int recoveryRetries = 3;
        private int defaultStepBudget = 30;
        private Duration defaultTimeBudget = Duration.ofMinutes(10);
    }

    @Data
    public static class Scheduler {
        private Duration globalTimeout = Duration.ofHours(2);
        /** 每合并多少个会话落盘一次知识库 */
        private int checkpointEvery = 1;
        private Duration pollInterval = Duration.ofSeconds(1);
    }

    @Data
    public static class Knowledge {
        private String directory = "knowledge";
        private boolean wipe = false;
    }

    @Data
    public static class Results {
        /** 为空时不写结果文件 */
        private String directory = "";
    }

    @Data
    public static class Testing {
        private String username = "";
        private String password = "";
        private String email = "";
        private String defaultText = "test";
    }

    @Data
    public static class Run {
        private List<String> jobFiles = new ArrayList<>();
        private List<DeviceHandle> devices = new ArrayList<>();
    }
}
