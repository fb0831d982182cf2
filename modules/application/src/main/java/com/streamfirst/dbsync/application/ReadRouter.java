package com.streamfirst.dbsync.application;

import com.streamfirst.dbsync.domain.ReplicaState;
import com.streamfirst.dbsync.domain.StoreId;
import com.streamfirst.dbsync.domain.Watermark;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Routes reads to the freshest available replica, i.e. the one with the newest synchronized
 * watermark, and to the primary when no replica qualifies. Each call selects again; nothing is
 * cached between calls.
 */
@Slf4j
public final class ReadRouter {

    public enum Target {
        REPLICA,
        PRIMARY
    }

    /**
     * Where a read goes.
     *
     * @param target replica or primary
     * @param replica the chosen replica, empty for the primary
     * @param watermark how current the chosen store is
     */
    public record Route(Target target, Optional<StoreId> replica, Watermark watermark) {

        static Route primary(Watermark watermark) {
            return new Route(Target.PRIMARY, Optional.empty(), watermark);
        }

        static Route replica(ReplicaState state) {
            return new Route(Target.REPLICA, Optional.of(state.id()), state.lastSync());
        }
    }

    private static final Comparator<ReplicaState> FRESHEST_FIRST =
            Comparator.comparing(ReplicaState::lastSync)
                    .reversed()
                    .thenComparing(ReplicaState::id);

    private final ReplicaSet replicas;
    private final Supplier<Watermark> primaryWatermark;
    private final Duration maxLag;

    /**
     * @param replicas candidates for reads
     * @param primaryWatermark newest commit on the primary
     * @param maxLag largest lag behind the primary a replica may have and still serve reads;
     *     empty accepts any lag
     */
    public ReadRouter(
            ReplicaSet replicas, Supplier<Watermark> primaryWatermark, Optional<Duration> maxLag) {
        this.replicas = replicas;
        this.primaryWatermark = primaryWatermark;
        this.maxLag = maxLag.orElse(null);
    }

    public Route route() {
        Watermark primary = primaryWatermark.get();
        Optional<ReplicaState> chosen =
                replicas.snapshot().stream()
                        .filter(ReplicaState::available)
                        .filter(state -> isFresh(state, primary))
                        .min(FRESHEST_FIRST);
        if (chosen.isEmpty()) {
            log.debug("No available fresh replica, routing read to the primary");
            return Route.primary(primary);
        }
        log.trace("Routing read to {} at {}", chosen.get().id(), chosen.get().lastSync());
        return Route.replica(chosen.get());
    }

    private boolean isFresh(ReplicaState state, Watermark primary) {
        if (maxLag == null || !primary.isAfter(state.lastSync())) {
            return true;
        }
        return Duration.between(state.lastSync().at(), primary.at()).compareTo(maxLag) <= 0;
    }
}
