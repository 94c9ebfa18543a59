package com.example.llmexplorer.knowledge;

import com.example.llmexplorer.config.ExplorerProperties;
import com.example.llmexplorer.fingerprint.StateFingerprint;
import com.example.llmexplorer.support.InMemoryKnowledgeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class KnowledgeStoreTest {

    private static final String APP = "com.example.shop";
    private static final StateFingerprint MAIN = StateFingerprint.of("f00d");
    private static final StateFingerprint CART = StateFingerprint.of("cafe");

    private ExplorerProperties properties;
    private InMemoryKnowledgeRepository repository;
    private KnowledgeStore store;

    @BeforeEach
    void setUp() {
        properties = new ExplorerProperties();
        repository = new InMemoryKnowledgeRepository();
        store = new KnowledgeStore(repository, properties);
        store.load();
    }

    @Test
    void mergeSumsVisitsAndUnionsSets() {
        KnowledgeDelta first = new KnowledgeDelta(APP, "job-1@emulator-5554");
        first.recordVisit(MAIN, "MainActivity");
        first.recordVisit(MAIN, "MainActivity");
        first.recordTried(MAIN, "open::TAP");
        KnowledgeDelta second = new KnowledgeDelta(APP, "job-2@emulator-5556");
        second.recordVisit(MAIN, "MainActivity");
        second.recordCrash(MAIN, "settings::TAP");
        second.markDeadEnd(CART);
        second.ban("help::TAP");

        store.merge(first);
        store.merge(second);

        KnowledgeSnapshot snapshot = store.snapshot(APP);
        assertThat(snapshot.visits(MAIN)).isEqualTo(3);
        assertThat(snapshot.triedActions(MAIN)).containsExactlyInAnyOrder("open::TAP", "settings::TAP");
        assertThat(snapshot.crashActions(MAIN)).containsExactly("settings::TAP");
        assertThat(snapshot.isKnownDeadEnd(CART)).isTrue();
        assertThat(snapshot.isBanned("help::TAP")).isTrue();
        assertThat(snapshot.record(MAIN)).get().extracting(KnowledgeRecord::getScreenName).isEqualTo("MainActivity");
    }

    @Test
    void screenScopedBanStaysOnItsScreen() {
        KnowledgeDelta delta = new KnowledgeDelta(APP, "job-1@emulator-5554");
        delta.recordVisit(MAIN, "MainActivity");
        delta.recordVisit(CART, "CartActivity");
        delta.banOn(MAIN, "global::BACK");
        delta.annotate(MAIN, KnowledgeRecord.DESCRIPTION, "Home screen with login entry");

        store.merge(delta);

        KnowledgeSnapshot snapshot = store.snapshot(APP);
        assertThat(snapshot.bannedActions(MAIN)).containsExactly("global::BACK");
        assertThat(snapshot.bannedActions(CART)).isEmpty();
        assertThat(snapshot.isBanned("global::BACK")).isFalse();
        assertThat(snapshot.getBannedActions()).isEmpty();
        assertThat(snapshot.annotation(MAIN, KnowledgeRecord.DESCRIPTION)).isEqualTo("Home screen with login entry");
        assertThat(snapshot.annotation(CART, KnowledgeRecord.DESCRIPTION)).isNull();
    }

    @Test
    void mergeOrderDoesNotMatter() {
        KnowledgeDelta first = new KnowledgeDelta(APP, "s1");
        first.recordVisit(MAIN, "MainActivity");
        first.recordTried(MAIN, "open::TAP");
        KnowledgeDelta second = new KnowledgeDelta(APP, "s2");
        second.recordVisit(MAIN, "MainActivity");
        second.recordVisit(CART, "CartActivity");
        second.markDeadEnd(MAIN);

        KnowledgeStore forward = new KnowledgeStore(new InMemoryKnowledgeRepository(), properties);
        forward.merge(first);
        forward.merge(second);
        KnowledgeStore reverse = new KnowledgeStore(new InMemoryKnowledgeRepository(), properties);
        reverse.merge(second);
        reverse.merge(first);

        KnowledgeSnapshot a = forward.snapshot(APP);
        KnowledgeSnapshot b = reverse.snapshot(APP);
        assertThat(a.visits(MAIN)).isEqualTo(b.visits(MAIN)).isEqualTo(2);
        assertThat(a.visits(CART)).isEqualTo(b.visits(CART)).isEqualTo(1);
        assertThat(a.triedActions(MAIN)).isEqualTo(b.triedActions(MAIN));
        assertThat(a.isKnownDeadEnd(MAIN)).isEqualTo(b.isKnownDeadEnd(MAIN)).isTrue();
    }

    @Test
    void conflictingAnnotationsKeepTheLastWriterAndAreReported() {
        KnowledgeDelta first = new KnowledgeDelta(APP, "s1");
        first.annotate(MAIN, "purpose", "product list");
        KnowledgeDelta second = new KnowledgeDelta(APP, "s2");
        second.annotate(MAIN, "purpose", "home feed");

        assertThat(store.merge(first)).isEmpty();
        List<KnowledgeMergeConflict> conflicts = store.merge(second);

        assertThat(conflicts).hasSize(1);
        assertThat(conflicts.get(0).getPreviousValue()).isEqualTo("product list");
        assertThat(conflicts.get(0).getNewValue()).isEqualTo("home feed");
        assertThat(conflicts.get(0).getSessionId()).isEqualTo("s2");
        assertThat(store.getConflicts()).hasSize(1);
        assertThat(store.snapshot(APP).record(MAIN).get().getAnnotations()).containsEntry("purpose", "home feed");
    }

    @Test
    void snapshotIsIsolatedFromLaterMerges() {
        KnowledgeDelta first = new KnowledgeDelta(APP, "s1");
        first.recordVisit(MAIN, "MainActivity");
        store.merge(first);
        KnowledgeSnapshot before = store.snapshot(APP);

        KnowledgeDelta second = new KnowledgeDelta(APP, "s2");
        second.recordVisit(MAIN, "MainActivity");
        second.recordTried(MAIN, "open::TAP");
        store.merge(second);

        assertThat(before.visits(MAIN)).isEqualTo(1);
        assertThat(before.triedActions(MAIN)).isEmpty();
        assertThat(store.snapshot(APP).visits(MAIN)).isEqualTo(2);
    }

    @Test
    void unknownAppGivesEmptySnapshot() {
        KnowledgeSnapshot snapshot = store.snapshot("com.example.unknown");

        assertThat(snapshot.size()).isZero();
        assertThat(snapshot.getAppId()).isEqualTo("com.example.unknown");
        assertThat(snapshot.triedActions(MAIN)).isEmpty();
    }

    @Test
    void concurrentMergesLoseNothing() throws Exception {
        int sessions = 16;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < sessions; i++) {
            final int n = i;
            futures.add(pool.submit(() -> {
                KnowledgeDelta delta = new KnowledgeDelta(APP, "s" + n);
                delta.recordVisit(MAIN, "MainActivity");
                delta.recordTried(MAIN, "action-" + n + "::TAP");
                start.await();
                store.merge(delta);
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        KnowledgeSnapshot snapshot = store.snapshot(APP);
        assertThat(snapshot.visits(MAIN)).isEqualTo(sessions);
        assertThat(snapshot.triedActions(MAIN)).hasSize(sessions);
    }

    @Test
    void flushPersistsAndReloadRestores() {
        KnowledgeDelta delta = new KnowledgeDelta(APP, "s1");
        delta.recordVisit(MAIN, "MainActivity");
        store.merge(delta);
        store.flush();

        KnowledgeStore reloaded = new KnowledgeStore(repository, properties);
        reloaded.load();

        assertThat(repository.saveCount()).isEqualTo(1);
        assertThat(reloaded.snapshot(APP).visits(MAIN)).isEqualTo(1);
    }

    @Test
    void wipeStartsFromAnEmptyStore() {
        KnowledgeRepository persisted = mock(KnowledgeRepository.class);
        properties.getKnowledge().setWipe(true);
        KnowledgeStore wiped = new KnowledgeStore(persisted, properties);

        wiped.load();

        verify(persisted, never()).load();
        assertThat(wiped.snapshot(APP).size()).isZero();
    }
}
