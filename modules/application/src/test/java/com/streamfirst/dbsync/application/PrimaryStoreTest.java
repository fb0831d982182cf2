package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.adapters.InMemoryRecordStore;
import com.streamfirst.dbsync.domain.RecordKey;
import com.streamfirst.dbsync.domain.Row;
import com.streamfirst.dbsync.domain.RowMutation;
import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.domain.Watermark;
import com.streamfirst.dbsync.ports.StoreConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrimaryStoreTest {

    private static final RecordKey P1 = RecordKey.of("proposals", "p1");

    private MutableClock clock;
    private InMemoryRecordStore store;
    private PrimaryStore primary;
    private StoreConnection connection;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochMilli(1_000);
        store = new InMemoryRecordStore(StoreId.PRIMARY);
        primary = new PrimaryStore(store, clock);
        connection = store.openConnection(false);
    }

    @Test
    void stampsWritesWithTheClock() {
        Row row = primary.write(connection, RowMutation.upsert(P1, "{\"title\":\"draft\"}"));

        assertThat(row.modifiedAt()).isEqualTo(Instant.ofEpochMilli(1_000));
        assertThat(primary.lastCommit()).isEqualTo(Watermark.ofEpochMilli(1_000));
        assertThat(connection.find(P1)).contains(row);
    }

    @Test
    void stampsStrictlyIncreaseWhenTheClockStands() {
        Row first = primary.write(connection, RowMutation.upsert(P1, "a"));
        Row second = primary.write(connection, RowMutation.upsert(RecordKey.of("users", "u1"), "b"));
        Row third = primary.write(connection, RowMutation.upsert(P1, "c"));

        assertThat(first.modifiedAt()).isBefore(second.modifiedAt());
        assertThat(second.modifiedAt()).isBefore(third.modifiedAt());
        assertThat(third.modifiedAt()).isEqualTo(Instant.ofEpochMilli(1_002));
    }

    @Test
    void stampsNeverGoBackWhenTheClockDoes() {
        clock.advance(Duration.ofSeconds(10));
        primary.write(connection, RowMutation.upsert(P1, "a"));
        clock.set(Instant.ofEpochMilli(500));

        Row row = primary.write(connection, RowMutation.upsert(P1, "b"));

        assertThat(row.modifiedAt()).isEqualTo(Instant.ofEpochMilli(11_001));
    }

    @Test
    void acceptsLaterExplicitStamps() {
        Row row = primary.write(connection, RowMutation.upsertAt(P1, "a", Instant.ofEpochMilli(100)));

        assertThat(row.modifiedAt()).isEqualTo(Instant.ofEpochMilli(100));
        assertThat(primary.lastCommit()).isEqualTo(Watermark.ofEpochMilli(100));
    }

    @Test
    void rejectsExplicitStampsNotAfterTheLastCommit() {
        primary.write(connection, RowMutation.upsertAt(P1, "a", Instant.ofEpochMilli(100)));

        assertThatThrownBy(
                        () -> primary.write(connection, RowMutation.upsertAt(P1, "b", Instant.ofEpochMilli(100))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(connection.find(P1).orElseThrow().payload()).isEqualTo("a");
    }

    @Test
    void deleteWritesATombstone() {
        primary.write(connection, RowMutation.upsert(P1, "a"));

        Row tombstone = primary.write(connection, RowMutation.delete(P1));

        assertThat(tombstone.deleted()).isTrue();
        assertThat(connection.find(P1)).isEmpty();
        assertThat(store.changesSince(Watermark.EPOCH)).containsExactly(tombstone);
    }

    @Test
    void resumesFromTheStoredHighWatermark() {
        store.apply(java.util.List.of(Row.of(P1, Instant.ofEpochMilli(5_000), "old")));

        PrimaryStore reopened = new PrimaryStore(store, clock);

        assertThat(reopened.lastCommit()).isEqualTo(Watermark.ofEpochMilli(5_000));
        assertThat(reopened.write(connection, RowMutation.upsert(P1, "new")).modifiedAt())
                .isEqualTo(Instant.ofEpochMilli(5_001));
    }
}
