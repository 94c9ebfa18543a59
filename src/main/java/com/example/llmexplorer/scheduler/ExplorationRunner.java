package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.dto.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 启动入口：配置了 explorer.run.job-files 时加载任务并在 explorer.run.devices 上运行
 *
 * 设备驱动由接入方以 DeviceDriverFactory Bean 的形式提供
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExplorationRunner implements ApplicationRunner {

    private final JobFileLoader jobFileLoader;
    private final SessionScheduler sessionScheduler;
    private final ExplorerProperties properties;
    private final ObjectProvider<DeviceDriverFactory> driverFactoryProvider;

    @Override
    public void run(ApplicationArguments args) {
        List<String> jobFiles = properties.getRun().getJobFiles();
        if (jobFiles == null || jobFiles.isEmpty()) {
            log.debug("[Runner] 未配置任务文件，不启动探索");
            return;
        }
        DeviceDriverFactory driverFactory = driverFactoryProvider.getIfAvailable();
        if (driverFactory == null) {
            log.error("[Runner] 没有可用的 DeviceDriverFactory，无法开始探索");
            return;
        }

        List<Path> files = jobFiles.stream().map(Path::of).collect(Collectors.toList());
        JobLoadReport report = jobFileLoader.load(files);
        report.getProblems().forEach(problem -> log.warn("[Runner] {}", problem));
        if (report.getJobs().isEmpty()) {
            log.warn("[Runner] 没有可运行的任务");
            return;
        }

        RunSummary summary = sessionScheduler.run(report.getJobs(), properties.getRun().getDevices(), driverFactory);
        log.info("[Runner] 探索结束: 完成 {} 个会话, 失败 {} 个, 共访问 {} 个界面",
                summary.getDoneSessions(), summary.getFailedSessions(), summary.getTotalVisitedNodes());
    }
}
