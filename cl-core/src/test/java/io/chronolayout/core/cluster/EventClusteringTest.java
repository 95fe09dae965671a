package io.chronolayout.core.cluster;

import io.chronolayout.core.TestEvents;
import io.chronolayout.core.distribution.DistributedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class EventClusteringTest {

    private EventClustering clustering;

    @BeforeEach
    void setUp() {
        clustering = new EventClustering(120);
    }

    /** Events in timestamp order at the given x positions. */
    private static List<DistributedEvent> at(double... xs) {
        var events = TestEvents.daily(xs.length);
        var out = new ArrayList<DistributedEvent>(xs.length);
        for (int i = 0; i < xs.length; i++) {
            out.add(new DistributedEvent(events.get(i), i * 1000L, xs[i], i, 0));
        }
        return out;
    }

    @Test
    void cluster_identicalPositionsFormOneClusterAnchoredExactly() {
        double x = 123.456789;
        var clusters = clustering.cluster(at(x, x, x, x, x));

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).anchor().x()).isEqualTo(x);
        assertThat(clusters.get(0).anchor().eventCount()).isEqualTo(5);
        assertThat(clusters.get(0).anchor().eventIds()).containsExactly("e0", "e1", "e2", "e3", "e4");
    }

    @Test
    void cluster_anchorIsCentroidOfMembers() {
        var clusters = clustering.cluster(at(100, 140, 160));

        assertThat(clusters).hasSize(1);
        assertThat(clusters.get(0).anchor().x()).isCloseTo(400.0 / 3, within(1e-9));
        assertThat(clusters.get(0).anchor().timestamp()).isEqualTo(1000L);
    }

    @Test
    void cluster_farEventsStartNewClusters() {
        var clusters = clustering.cluster(at(0, 500, 1000));

        assertThat(clusters).extracting(EventCluster::id).containsExactly("cluster-0", "cluster-1", "cluster-2");
        assertThat(clusters).extracting(c -> c.anchor().id()).containsExactly("anchor-0", "anchor-1", "anchor-2");
    }

    @Test
    void cluster_joinsNearestCluster() {
        var clusters = clustering.cluster(at(0, 300, 200));

        assertThat(clusters).hasSize(2);
        assertThat(clusters.get(1).events()).extracting(e -> e.id()).containsExactly("e1", "e2");
        assertThat(clusters.get(1).anchor().x()).isEqualTo(250.0);
    }

    @Test
    void cluster_tieGoesToEarliestCluster() {
        var clusters = clustering.cluster(at(0, 200, 100));

        assertThat(clusters.get(0).size()).isEqualTo(2);
        assertThat(clusters.get(0).anchor().x()).isEqualTo(50.0);
        assertThat(clusters.get(1).size()).isEqualTo(1);
    }

    @Test
    void cluster_everyEventInExactlyOneCluster() {
        var events = at(0, 10, 400, 410, 900, 50, 2000);
        var clusters = clustering.cluster(events);

        assertThat(clusters.stream().mapToInt(EventCluster::size).sum()).isEqualTo(events.size());
        assertThat(clusters.stream().flatMap(c -> c.members().stream()).map(DistributedEvent::id).distinct().count())
                .isEqualTo(events.size());
    }

    @Test
    void cluster_largeSameDayBurstStaysLinear() {
        var events = new ArrayList<DistributedEvent>(100_000);
        var event = TestEvents.sameDay(1).get(0);
        for (int i = 0; i < 100_000; i++) {
            events.add(new DistributedEvent(event, 0L, 600.25, i, 0));
        }

        var clusters = assertTimeout(Duration.ofSeconds(5), () -> clustering.cluster(events));

        assertThat(clusters).singleElement().satisfies(c -> {
            assertThat(c.size()).isEqualTo(100_000);
            assertThat(c.anchor().x()).isEqualTo(600.25);
            assertThat(c.anchor().timestamp()).isZero();
        });
    }

    @Test
    void recluster_isIdempotent() {
        var clusters = clustering.cluster(at(0, 10, 400, 410, 900));

        assertThat(clustering.recluster(clusters)).isEqualTo(clusters);
        assertThat(clustering.recluster(clustering.recluster(clusters))).isEqualTo(clusters);
    }

    @Test
    void cluster_emptyInput() {
        assertThat(clustering.cluster(List.of())).isEmpty();
    }

    @Test
    void constructor_rejectsNegativeThreshold() {
        assertThatThrownBy(() -> new EventClustering(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stats_summarisesClusters() {
        var stats = ClusterStats.of(clustering.cluster(at(0, 10, 20, 900)));

        assertThat(stats.totalClusters()).isEqualTo(2);
        assertThat(stats.totalEvents()).isEqualTo(4);
        assertThat(stats.largestCluster()).isEqualTo(3);
        assertThat(stats.summary()).isEqualTo("2 clusters, 4 events (avg 2.0/cluster)");
        assertThat(ClusterStats.of(List.of()).summary()).isEqualTo("No clusters");
    }
}
