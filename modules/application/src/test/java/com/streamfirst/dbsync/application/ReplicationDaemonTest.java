package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.adapters.InMemoryRecordStore;
import com.streamfirst.dbsync.domain.RecordKey;
import com.streamfirst.dbsync.domain.ReplicaState;
import com.streamfirst.dbsync.domain.ReplicationReport;
import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.domain.Watermark;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ReplicationDaemonTest {

    private static final StoreId R1 = StoreId.of("replica1");
    private static final StoreId R2 = StoreId.of("replica2");
    private static final StoreId R3 = StoreId.of("replica3");
    private static final RecordKey P1 = RecordKey.of("proposals", "p1");

    private InMemoryRecordStore primary;
    private InMemoryRecordStore replica1;
    private InMemoryRecordStore replica2;
    private InMemoryRecordStore replica3;
    private ReplicaSet replicas;
    private ReplicationDaemon daemon;

    @BeforeEach
    void setUp() {
        primary = new InMemoryRecordStore(StoreId.PRIMARY);
        replica1 = new InMemoryRecordStore(R1);
        replica2 = new InMemoryRecordStore(R2);
        replica3 = new InMemoryRecordStore(R3);
        replicas = new ReplicaSet(List.of(replica1, replica2, replica3), Watermark.EPOCH, MutableClock.atEpochMilli(0));
        daemon =
                new ReplicationDaemon(
                        new ChangeExtractor(primary),
                        replicas,
                        Duration.ofMillis(20),
                        Duration.ofMillis(200),
                        Duration.ofSeconds(2));
    }

    @Test
    void pushesANewRowToEveryReplica() {
        Row p1 = Row.of(P1, Instant.ofEpochMilli(100), "{\"title\":\"solar\"}");
        primary.apply(List.of(p1));

        ReplicationReport report = daemon.replicate();

        assertThat(report.applied()).containsEntry(R1, 1).containsEntry(R2, 1).containsEntry(R3, 1);
        assertThat(report.hasFailures()).isFalse();
        for (InMemoryRecordStore replica : List.of(replica1, replica2, replica3)) {
            assertThat(replica.openConnection(true).find(P1)).contains(p1);
        }
        assertThat(replicas.snapshot())
                .extracting(ReplicaState::lastSync)
                .containsOnly(Watermark.ofEpochMilli(100));
    }

    @Test
    void aFailingReplicaDoesNotHoldBackTheOthers() {
        primary.apply(List.of(Row.of(P1, Instant.ofEpochMilli(100), "a")));
        replica2.simulateOutage(true);

        ReplicationReport report = daemon.replicate();

        assertThat(report.applied()).containsOnlyKeys(R1, R3);
        assertThat(report.failures()).containsOnlyKeys(R2);
        assertThat(replicas.state(R1).lastSync()).isEqualTo(Watermark.ofEpochMilli(100));
        assertThat(replicas.state(R3).lastSync()).isEqualTo(Watermark.ofEpochMilli(100));
        ReplicaState failed = replicas.state(R2);
        assertThat(failed.lastSync()).isEqualTo(Watermark.EPOCH);
        assertThat(failed.available()).isFalse();
        assertThat(failed.consecutiveFailures()).isEqualTo(1);
        assertThat(failed.lastError()).isPresent();
    }

    @Test
    void aRecoveredReplicaCatchesUpAndBecomesAvailable() {
        primary.apply(List.of(Row.of(P1, Instant.ofEpochMilli(100), "a")));
        replica2.simulateOutage(true);
        daemon.replicate();
        primary.apply(List.of(Row.of(RecordKey.of("users", "u1"), Instant.ofEpochMilli(200), "b")));

        replica2.simulateOutage(false);
        ReplicationReport report = daemon.replicate();

        assertThat(report.applied()).containsEntry(R1, 1).containsEntry(R2, 2).containsEntry(R3, 1);
        assertThat(replicas.state(R2).available()).isTrue();
        assertThat(replicas.state(R2).consecutiveFailures()).isZero();
        assertThat(replica2.rowCount()).isEqualTo(2);
        assertThat(replicas.snapshot())
                .extracting(ReplicaState::lastSync)
                .containsOnly(Watermark.ofEpochMilli(200));
    }

    @Test
    void anIdleReplicaThatStopsAnsweringBecomesUnavailable() {
        daemon.replicate();
        assertThat(replicas.state(R1).available()).isTrue();

        replica1.simulateOutage(true);
        ReplicationReport report = daemon.replicate();
        assertThat(report.failures()).containsOnlyKeys(R1);
        assertThat(replicas.state(R1).available()).isFalse();

        replica1.simulateOutage(false);
        daemon.replicate();
        assertThat(replicas.state(R1).available()).isTrue();
        assertThat(replicas.state(R1).consecutiveFailures()).isZero();
    }

    @Test
    void aReplicaAheadOfThePrimaryResumesFromThePrimarysCommit() {
        InMemoryRecordStore ahead = new InMemoryRecordStore(R1);
        ahead.apply(List.of(Row.of(RecordKey.of("users", "u9"), Instant.ofEpochMilli(500), "stale")));
        ReplicaSet set = new ReplicaSet(List.of(ahead), primary.highWatermark(), MutableClock.atEpochMilli(0));
        assertThat(set.state(R1).lastSync()).isEqualTo(Watermark.EPOCH);

        Row p1 = Row.of(P1, Instant.ofEpochMilli(100), "fresh");
        primary.apply(List.of(p1));
        new ReplicationDaemon(
                        new ChangeExtractor(primary),
                        set,
                        Duration.ofMillis(20),
                        Duration.ofMillis(200),
                        Duration.ofSeconds(2))
                .replicate();

        assertThat(ahead.openConnection(true).find(P1)).contains(p1);
        assertThat(set.state(R1).lastSync()).isEqualTo(Watermark.ofEpochMilli(100));
    }

    @Test
    void overlappingCyclesApplyBatchesInOrder() throws Exception {
        CountDownLatch applying = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        InMemoryRecordStore slow =
                new InMemoryRecordStore(R1) {
                    private boolean first = true;

                    @Override
                    public void apply(List<Row> batch) {
                        if (first) {
                            first = false;
                            applying.countDown();
                            try {
                                release.await(5, TimeUnit.SECONDS);
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                        }
                        super.apply(batch);
                    }
                };
        ReplicaSet set = new ReplicaSet(List.of(slow), Watermark.EPOCH, MutableClock.atEpochMilli(0));
        ReplicationDaemon serialized =
                new ReplicationDaemon(
                        new ChangeExtractor(primary),
                        set,
                        Duration.ofMillis(20),
                        Duration.ofSeconds(10),
                        Duration.ofSeconds(2));

        primary.apply(List.of(Row.of(P1, Instant.ofEpochMilli(100), "old")));
        CompletableFuture<ReplicationReport> scheduled = CompletableFuture.supplyAsync(serialized::replicate);
        assertThat(applying.await(5, TimeUnit.SECONDS)).isTrue();

        primary.apply(List.of(Row.of(P1, Instant.ofEpochMilli(200), "new")));
        CompletableFuture<ReplicationReport> manual = CompletableFuture.supplyAsync(serialized::replicate);
        Thread.sleep(100);
        assertThat(manual).isNotDone();

        release.countDown();
        scheduled.get(5, TimeUnit.SECONDS);
        assertThat(manual.get(5, TimeUnit.SECONDS).applied()).containsEntry(R1, 1);

        assertThat(slow.openConnection(true).find(P1)).hasValueSatisfying(
                row -> assertThat(row.payload()).isEqualTo("new"));
        assertThat(set.state(R1).lastSync()).isEqualTo(Watermark.ofEpochMilli(200));
    }

    @Test
    void watermarksNeverExceedThePrimary() {
        primary.apply(
                List.of(
                        Row.of(P1, Instant.ofEpochMilli(100), "a"),
                        Row.of(RecordKey.of("users", "u1"), Instant.ofEpochMilli(300), "b")));

        daemon.replicate();
        daemon.replicate();

        Watermark primaryHigh = primary.highWatermark();
        assertThat(replicas.snapshot())
                .allSatisfy(state -> assertThat(state.lastSync()).isLessThanOrEqualTo(primaryHigh));
    }

    @Test
    void tombstonesPropagate() {
        primary.apply(List.of(Row.of(P1, Instant.ofEpochMilli(100), "a")));
        daemon.replicate();
        assertThat(replica1.openConnection(true).find(P1)).isPresent();

        primary.apply(List.of(Row.tombstone(P1, Instant.ofEpochMilli(150))));
        daemon.replicate();

        assertThat(replica1.openConnection(true).find(P1)).isEmpty();
        assertThat(replica1.changesSince(Watermark.EPOCH)).singleElement().satisfies(
                row -> assertThat(row.deleted()).isTrue());
        assertThat(replicas.state(R1).lastSync()).isEqualTo(Watermark.ofEpochMilli(150));
    }

    @Test
    void aPrimaryOutageSkipsTheCycleWithoutMarkingReplicas() {
        primary.apply(List.of(Row.of(P1, Instant.ofEpochMilli(100), "a")));
        primary.simulateOutage(true);

        ReplicationReport report = daemon.replicate();

        assertThat(report.totalApplied()).isZero();
        assertThat(report.hasFailures()).isFalse();
        assertThat(replicas.snapshot()).allSatisfy(state -> assertThat(state.available()).isTrue());
    }

    @Test
    void scheduledCyclesReplicateAndStopPromptly() throws Exception {
        primary.apply(List.of(Row.of(P1, Instant.ofEpochMilli(100), "a")));

        daemon.start();
        long deadline = System.currentTimeMillis() + 2_000;
        while (replica3.rowCount() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        long stopStarted = System.nanoTime();
        daemon.stop();

        assertThat(replica3.rowCount()).isEqualTo(1);
        assertThat(Duration.ofNanos(System.nanoTime() - stopStarted)).isLessThan(Duration.ofSeconds(1));
        assertThat(daemon.isRunning()).isFalse();
        assertThat(daemon.getCompletedCycles()).isPositive();
    }
}
