package com.example.llmexplorer.scheduler;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.dto.DeviceHandle;
import com.example.llmexplorer.dto.DeviceSelector;
import com.example.llmexplorer.dto.DeviceType;
import com.example.llmexplorer.dto.JobDescriptor;
import com.example.llmexplorer.dto.RunSummary;
import com.example.llmexplorer.dto.SessionResult;
import com.example.llmexplorer.executor.DeviceDriver;
import com.example.llmexplorer.knowledge.AppKnowledge;
import com.example.llmexplorer.knowledge.KnowledgeRecord;
import com.example.llmexplorer.knowledge.KnowledgeStore;
import com.example.llmexplorer.session.SessionStatus;
import com.example.llmexplorer.session.TerminalReason;
import com.example.llmexplorer.support.InMemoryKnowledgeRepository;
import com.example.llmexplorer.support.ScriptedDeviceDriver;
import com.example.llmexplorer.support.ScriptedLlmClient;
import com.example.llmexplorer.support.ShopApp;
import com.example.llmexplorer.support.TestExplorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SessionSchedulerTest {

    private static final DeviceHandle EMULATOR_1 = device("emulator-5554");
    private static final DeviceHandle EMULATOR_2 = device("emulator-5556");

    private ExplorerProperties properties;
    private InMemoryKnowledgeRepository repository;
    private ScriptedLlmClient llm;
    private List<ScriptedDeviceDriver> drivers;

    @BeforeEach
    void setUp() {
        properties = TestExplorer.properties();
        repository = new InMemoryKnowledgeRepository();
        llm = new ScriptedLlmClient().otherwise(ScriptedLlmClient.tapFirstUntried());
        drivers = new CopyOnWriteArrayList<>();
    }

    @Test
    void twoDevicesExploreConcurrentlyAndNoVisitIsLost() {
        RunSummary summary = scheduler().run(List.of(job("a", 4), job("b", 4)),
                List.of(EMULATOR_1, EMULATOR_2), this::connect);

        assertThat(summary.getResults()).hasSize(2);
        assertThat(summary.getDoneSessions()).isEqualTo(2);
        assertThat(summary.getTotalSteps()).isEqualTo(8);
        assertThat(summary.getResults()).extracting(SessionResult::getDeviceSerial)
                .containsExactlyInAnyOrder("emulator-5554", "emulator-5556");
        assertThat(summary.isKnowledgePersisted()).isTrue();

        long sessionVisits = summary.getResults().stream()
                .flatMap(result -> result.getKnowledgeDelta().getRecords().values().stream())
                .mapToLong(KnowledgeRecord::getVisits)
                .sum();
        AppKnowledge stored = repository.get(ShopApp.APP);
        long storedVisits = stored.getRecords().values().stream().mapToLong(KnowledgeRecord::getVisits).sum();
        assertThat(sessionVisits).isEqualTo(10);
        assertThat(storedVisits).isEqualTo(sessionVisits);
        assertThat(drivers).hasSize(2).allMatch(ScriptedDeviceDriver::isClosed);
    }

    @Test
    void jobsQueueUpOnASingleDevice() {
        RunSummary summary = scheduler().run(List.of(job("a", 2), job("b", 2), job("c", 2)),
                List.of(EMULATOR_1), this::connect);

        assertThat(summary.getResults()).extracting(SessionResult::getJobId).containsExactly("a", "b", "c");
        assertThat(summary.getDoneSessions()).isEqualTo(3);
        assertThat(drivers).hasSize(3);
        assertThat(repository.saveCount()).isEqualTo(4);
    }

    @Test
    void jobWithoutMatchingDeviceIsSkipped() {
        JobDescriptor physicalOnly = job("on-phone", 2);
        physicalOnly.setDevice(DeviceSelector.builder().type(DeviceType.PHYSICAL).build());

        RunSummary summary = scheduler().run(List.of(physicalOnly, job("a", 2)), List.of(EMULATOR_1), this::connect);

        assertThat(summary.getSkippedJobs()).containsOnlyKeys("on-phone");
        assertThat(summary.getResults()).extracting(SessionResult::getJobId).containsExactly("a");
    }

    @Test
    void emptyDevicePoolIsRejectedBeforeAnythingRuns() {
        SessionScheduler scheduler = scheduler();

        assertThatThrownBy(() -> scheduler.run(List.of(job("a", 2)), List.of(), this::connect))
                .isInstanceOf(NoDevicesAvailableException.class);
        assertThat(repository.saveCount()).isZero();
        assertThat(drivers).isEmpty();
    }

    @Test
    void unreachableDeviceOnlyFailsItsOwnSession() {
        RunSummary summary = scheduler().run(List.of(job("a", 2), job("b", 2)),
                List.of(EMULATOR_1, EMULATOR_2), (device, job) -> {
                    if (device.getSerial().equals("emulator-5556")) {
                        throw new IllegalStateException("adb: device offline");
                    }
                    return connect(device, job);
                });

        Map<String, SessionResult> byJob = summary.getResults().stream()
                .collect(Collectors.toMap(SessionResult::getJobId, Function.identity()));
        assertThat(byJob.get("a").getStatus()).isEqualTo(SessionStatus.DONE);
        assertThat(byJob.get("b").getStatus()).isEqualTo(SessionStatus.FAILED);
        assertThat(byJob.get("b").getTerminalReason().getCode()).isEqualTo(TerminalReason.Code.DRIVER_UNAVAILABLE);
        assertThat(summary.getFailedSessions()).isEqualTo(1);
    }

    @Test
    void globalTimeoutStopsRunningSessionsAndLeavesTheRestUnstarted() {
        properties.getScheduler().setGlobalTimeout(Duration.ofMillis(100));
        llm.delay(20);

        RunSummary summary = scheduler().run(List.of(job("a", 1000), job("b", 1000), job("c", 1000)),
                List.of(EMULATOR_1, EMULATOR_2), this::connect);

        assertThat(summary.isGlobalTimeoutHit()).isTrue();
        assertThat(summary.getNotStartedJobs()).containsExactly("c");
        assertThat(summary.getResults()).hasSize(2)
                .allMatch(result -> result.getTerminalReason().getCode() == TerminalReason.Code.STOPPED);
        assertThat(summary.getResults()).allMatch(result -> result.getStepsTaken() < 1000);
        assertThat(repository.get(ShopApp.APP)).isNotNull();
    }

    private SessionScheduler scheduler() {
        KnowledgeStore store = new KnowledgeStore(repository, properties);
        ResultWriter writer = new ResultWriter(TestExplorer.objectMapper(), properties);
        return new SessionScheduler(TestExplorer.sessionFactory(properties, llm), store, writer, properties);
    }

    private DeviceDriver connect(DeviceHandle device, JobDescriptor job) {
        ScriptedDeviceDriver driver = ShopApp.driver();
        drivers.add(driver);
        return driver;
    }

    private static JobDescriptor job(String id, int stepBudget) {
        return JobDescriptor.builder()
                .id(id)
                .appId(ShopApp.APP)
                .entryActivity(ShopApp.ENTRY)
                .stepBudget(stepBudget)
                .build();
    }

    private static DeviceHandle device(String serial) {
        return DeviceHandle.builder().serial(serial).type(DeviceType.EMULATOR).build();
    }
}
