package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.dto.DeviceHandle;
import com.example.llmexplorer.dto.JobDescriptor;
import com.example.llmexplorer.dto.RunSummary;
import com.example.llmexplorer.dto.SessionResult;
import com.example.llmexplorer.executor.DeviceDriver;
import com.example.llmexplorer.knowledge.KnowledgeMergeConflict;
import com.example.llmexplorer.knowledge.KnowledgePersistenceException;
import com.example.llmexplorer.knowledge.KnowledgeSnapshot;
import com.example.llmexplorer.knowledge.KnowledgeStore;
import com.example.llmexplorer.session.ExplorationSession;
import com.example.llmexplorer.session.ExplorationSessionFactory;
import com.example.llmexplorer.session.SessionStatus;
import com.example.llmexplorer.session.StopSignal;
import com.example.llmexplorer.session.TerminalReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 会话调度器
 *
 * 功能：
 * 1. 每台设备同一时间只跑一个会话，线程池大小等于设备数
 * 2. 会话结束后合并其结果与知识增量，再把下一个兼容的任务派给空出来的设备
 * 3. 全局超时后发出停止信号，进行中的会话在步间停下并返回部分结果，未开始的任务记为未运行
 * 4. 每合并 checkpoint-every 个会话落盘一次知识库，结束时再 flush 一次
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionScheduler {

    private final ExplorationSessionFactory sessionFactory;
    private final KnowledgeStore knowledgeStore;
    private final ResultWriter resultWriter;
    private final ExplorerProperties properties;

    public RunSummary run(List<JobDescriptor> jobs, List<DeviceHandle> devices, DeviceDriverFactory driverFactory) {
        if (devices == null || devices.isEmpty()) {
            throw new NoDevicesAvailableException("no devices available in the pool");
        }

        Instant started = Instant.now();
        RunSummary summary = RunSummary.builder().startedAt(started).build();

        Deque<JobDescriptor> pending = new ArrayDeque<>();
        for (JobDescriptor job : jobs) {
            if (devices.stream().noneMatch(device -> job.getDevice().matches(device))) {
                log.warn("[Scheduler] 没有设备满足任务 {} 的要求，跳过: {}", job.getId(), job.getDevice());
                summary.getSkippedJobs().put(job.getId(), "no device matches " + job.getDevice());
            } else {
                pending.add(job);
            }
        }

        knowledgeStore.load();
        log.info("[Scheduler] 开始调度: {} 个任务, {} 台设备", pending.size(), devices.size());

        StopSignal stopSignal = new StopSignal();
        Deque<DeviceHandle> idle = new ArrayDeque<>(devices);
        Map<Future<SessionResult>, Assignment> inFlight = new HashMap<>();
        ExecutorService pool = Executors.newFixedThreadPool(devices.size(),
                new CustomizableThreadFactory("explorer-device-"));
        CompletionService<SessionResult> completion = new ExecutorCompletionService<>(pool);

        Instant deadline = started.plus(properties.getScheduler().getGlobalTimeout());
        long pollMillis = Math.max(10, properties.getScheduler().getPollInterval().toMillis());
        int checkpointEvery = properties.getScheduler().getCheckpointEvery();
        int merged = 0;
        boolean interrupted = false;

        try {
            while (true) {
                if (!stopSignal.isStopRequested()) {
                    assign(pending, idle, inFlight, completion, driverFactory, stopSignal);
                }
                if (inFlight.isEmpty()) {
                    break;
                }

                Future<SessionResult> done = completion.poll(pollMillis, TimeUnit.MILLISECONDS);
                if (done != null) {
                    Assignment assignment = inFlight.remove(done);
                    idle.add(assignment.device);
                    SessionResult result = collect(done, assignment);
                    accept(summary, result);
                    merged++;
                    if (checkpointEvery > 0 && merged % checkpointEvery == 0) {
                        persistKnowledge("checkpoint");
                    }
                }

                if (!stopSignal.isStopRequested() && !Instant.now().isBefore(deadline)) {
                    log.warn("[Scheduler] 达到全局超时 {}，通知所有会话停止",
                            properties.getScheduler().getGlobalTimeout());
                    stopSignal.requestStop("global timeout");
                    summary.setGlobalTimeoutHit(true);
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            Thread.currentThread().interrupt();
            stopSignal.requestStop("scheduler interrupted");
            log.warn("[Scheduler] 调度线程被中断，{} 个会话的结果将丢失", inFlight.size());
        } finally {
            if (interrupted) {
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
        }

        for (JobDescriptor job : pending) {
            summary.getNotStartedJobs().add(job.getId());
        }
        summary.setKnowledgePersisted(persistKnowledge("final flush"));

        Instant finished = Instant.now();
        summary.setFinishedAt(finished);
        summary.setElapsedMs(Duration.between(started, finished).toMillis());
        resultWriter.writeSummary(summary);

        log.info("[Scheduler] 调度结束: 完成 {}, 失败 {}, 跳过 {}, 未开始 {}, 共 {} 步, 耗时 {} ms",
                summary.getDoneSessions(), summary.getFailedSessions(), summary.getSkippedJobs().size(),
                summary.getNotStartedJobs().size(), summary.getTotalSteps(), summary.getElapsedMs());
        return summary;
    }

    private void assign(Deque<JobDescriptor> pending, Deque<DeviceHandle> idle,
                        Map<Future<SessionResult>, Assignment> inFlight,
                        CompletionService<SessionResult> completion,
                        DeviceDriverFactory driverFactory, StopSignal stopSignal) {
        Iterator<DeviceHandle> devices = idle.iterator();
        while (devices.hasNext() && !pending.isEmpty()) {
            DeviceHandle device = devices.next();
            JobDescriptor job = takeFirstMatching(pending, device);
            if (job == null) {
                continue;
            }
            devices.remove();
            Future<SessionResult> future = completion.submit(() -> runSession(job, device, driverFactory, stopSignal));
            inFlight.put(future, new Assignment(job, device));
            log.info("[Scheduler] 任务 {} 分配到设备 {}", job.getId(), device.getSerial());
        }
    }

    private JobDescriptor takeFirstMatching(Deque<JobDescriptor> pending, DeviceHandle device) {
        Iterator<JobDescriptor> it = pending.iterator();
        while (it.hasNext()) {
            JobDescriptor job = it.next();
            if (job.getDevice().matches(device)) {
                it.remove();
                return job;
            }
        }
        return null;
    }

    /**
     * 在设备线程上运行一个会话；任何异常都转成失败结果，不影响其他设备
     */
    private SessionResult runSession(JobDescriptor job, DeviceHandle device,
                                     DeviceDriverFactory driverFactory, StopSignal stopSignal) {
        DeviceDriver driver;
        try {
            driver = driverFactory.connect(device, job);
        } catch (RuntimeException e) {
            log.error("[Scheduler] 连接设备 {} 失败", device.getSerial(), e);
            return SessionResult.notStarted(job, device,
                    TerminalReason.of(TerminalReason.Code.DRIVER_UNAVAILABLE, "could not connect: " + e.getMessage()));
        }
        try {
            KnowledgeSnapshot snapshot = knowledgeStore.snapshot(job.getAppId());
            ExplorationSession session = sessionFactory.create(job, device, driver, snapshot, stopSignal);
            return session.run();
        } catch (RuntimeException e) {
            log.error("[Scheduler] 会话 {}@{} 无法启动", job.getId(), device.getSerial(), e);
            return SessionResult.notStarted(job, device,
                    TerminalReason.of(TerminalReason.Code.INTERNAL_ERROR, e.getClass().getSimpleName() + ": " + e.getMessage()));
        } finally {
            try {
                driver.close();
            } catch (RuntimeException e) {
                log.warn("[Scheduler] 关闭设备 {} 的驱动失败: {}", device.getSerial(), e.getMessage());
            }
        }
    }

    private SessionResult collect(Future<SessionResult> done, Assignment assignment) throws InterruptedException {
        try {
            return done.get();
        } catch (ExecutionException e) {
            log.error("[Scheduler] 会话 {}@{} 异常终止", assignment.job.getId(), assignment.device.getSerial(), e.getCause());
            return SessionResult.notStarted(assignment.job, assignment.device,
                    TerminalReason.of(TerminalReason.Code.INTERNAL_ERROR, String.valueOf(e.getCause())));
        }
    }

    private void accept(RunSummary summary, SessionResult result) {
        summary.getResults().add(result);
        if (result.getStatus() == SessionStatus.DONE) {
            summary.setDoneSessions(summary.getDoneSessions() + 1);
        } else {
            summary.setFailedSessions(summary.getFailedSessions() + 1);
        }
        summary.setTotalSteps(summary.getTotalSteps() + result.getStepsTaken());
        summary.setTotalVisitedNodes(summary.getTotalVisitedNodes() + result.getVisitedNodes());

        if (result.getKnowledgeDelta() != null) {
            List<KnowledgeMergeConflict> conflicts = knowledgeStore.merge(result.getKnowledgeDelta());
            summary.setMergeConflicts(summary.getMergeConflicts() + conflicts.size());
        }
        resultWriter.writeSession(result);
        log.info("[Scheduler] 会话 {} 结束: {} - {}", result.getSessionId(),
                result.getTerminalReason().getCode().wireName(), result.getTerminalReason().getMessage());
    }

    private boolean persistKnowledge(String reason) {
        try {
            knowledgeStore.flush();
            return true;
        } catch (KnowledgePersistenceException e) {
            log.error("[Scheduler] 知识库落盘失败（{}）", reason, e);
            return false;
        }
    }

    private static class Assignment {
        private final JobDescriptor job;
        private final DeviceHandle device;

        Assignment(JobDescriptor job, DeviceHandle device) {
            this.job = job;
            this.device = device;
        }
    }
}
