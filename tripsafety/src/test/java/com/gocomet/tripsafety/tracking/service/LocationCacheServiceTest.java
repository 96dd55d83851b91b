package com.gocomet.tripsafety.tracking.service;

import com.gocomet.tripsafety.common.event.SosEvent;
import com.gocomet.tripsafety.common.event.SosLocationSampledEvent;
import com.gocomet.tripsafety.common.message.TrackingMessage;
import com.gocomet.tripsafety.support.InMemoryBroadcastBus;
import com.gocomet.tripsafety.support.InMemoryLocationStore;
import com.gocomet.tripsafety.support.InMemoryTripWindowStore;
import com.gocomet.tripsafety.support.MutableClock;
import com.gocomet.tripsafety.support.TestJson;
import com.gocomet.tripsafety.tracking.config.TrackingProperties;
import com.gocomet.tripsafety.tracking.model.LocationSample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class LocationCacheServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T10:00:00Z");

    private final UUID tripId = UUID.randomUUID();
    private InMemoryLocationStore store;
    private InMemoryBroadcastBus bus;
    private InMemoryTripWindowStore tripWindows;
    private LocationCacheService cache;
    private final List<Object> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryLocationStore();
        bus = new InMemoryBroadcastBus(TestJson.mapper());
        tripWindows = new InMemoryTripWindowStore();
        cache = new LocationCacheService(store, bus, tripWindows, new TrackingProperties(), new MutableClock(T0),
                events::add);
    }

    @Test
    void put_outOfOrderSamples_keepsNewest() {
        // capturedAt 5, 3, 8 arriving in that order
        assertTrue(cache.put(sampleAt(5)));
        assertFalse(cache.put(sampleAt(3)), "An older sample must be discarded");
        assertTrue(cache.put(sampleAt(8)));

        assertEquals(T0.plusSeconds(8), cache.get(tripId).orElseThrow().capturedAt());
        assertEquals(2, bus.published().size(), "Only accepted writes are broadcast");
    }

    @Test
    void put_anyArrivalOrder_convergesOnMaxCapturedAt() {
        List<Integer> seconds = List.of(1, 4, 2, 9, 7);
        for (List<Integer> order : permutations(seconds)) {
            InMemoryLocationStore freshStore = new InMemoryLocationStore();
            LocationCacheService freshCache = new LocationCacheService(freshStore, bus, tripWindows,
                    new TrackingProperties(), new MutableClock(T0), event -> { });

            order.forEach(s -> freshCache.put(sampleAt(s)));

            assertEquals(T0.plusSeconds(9), freshCache.get(tripId).orElseThrow().capturedAt(),
                    "Order " + order + " must converge on the newest sample");
        }
    }

    @Test
    void put_sameSampleTwice_isIdempotent() {
        LocationSample sample = sampleAt(5);

        assertTrue(cache.put(sample));
        assertFalse(cache.put(sample));

        assertEquals(sample, cache.get(tripId).orElseThrow());
        assertEquals(1, bus.published().size());
    }

    @Test
    void put_equalTimestamp_isNotNewer() {
        cache.put(new LocationSample(tripId, 12.97, 77.59, 10, 90, T0));

        assertFalse(cache.put(new LocationSample(tripId, 13.00, 77.60, 10, 90, T0)));

        assertEquals(12.97, cache.get(tripId).orElseThrow().lat());
    }

    @Test
    void put_invalidCoordinates_rejected() {
        assertFalse(cache.put(new LocationSample(tripId, 91.0, 77.59, 0, 0, T0)));
        assertFalse(cache.put(new LocationSample(tripId, 12.97, -181.0, 0, 0, T0)));
        assertFalse(cache.put(new LocationSample(tripId, 12.97, 77.59, -1, 0, T0)));
        assertFalse(cache.put(new LocationSample(tripId, 12.97, 77.59, 0, 360, T0)));

        assertTrue(cache.get(tripId).isEmpty());
        assertTrue(bus.published().isEmpty());
    }

    @Test
    void put_storeUnavailable_reportsNotAcceptedWithoutThrowing() {
        store.setDown(true);

        assertFalse(cache.put(sampleAt(1)));
        assertTrue(bus.published().isEmpty());
    }

    @Test
    void put_busUnavailable_stillCachesSample() {
        bus.setDown(true);

        assertTrue(cache.put(sampleAt(1)));
        assertTrue(cache.get(tripId).isPresent());
    }

    @Test
    void put_sosActiveTrip_alsoPublishesOperatorLocationUpdate() {
        UUID alertId = UUID.randomUUID();
        tripWindows.markSosActive(tripId, alertId);

        cache.put(sampleAt(1));

        List<TrackingMessage> published = bus.published();
        assertEquals(2, published.size());
        assertEquals(TrackingMessage.TYPE_LOCATION, published.get(0).getType());
        assertEquals(TrackingMessage.TYPE_SOS_EVENT, published.get(1).getType());
        SosEvent event = (SosEvent) published.get(1).getPayload();
        assertEquals(SosEvent.EventType.LOCATION_UPDATE, event.getEventType());
        assertEquals(alertId, event.getAlertId());
        assertEquals(List.of(new SosLocationSampledEvent(alertId, sampleAt(1))), events);
    }

    @Test
    void put_noOpenAlert_publishesNoSosLocation() {
        cache.put(sampleAt(1));

        assertTrue(events.isEmpty());
    }

    @Test
    void put_staleSampleOnSosTrip_notRecordedForAlert() {
        tripWindows.markSosActive(tripId, UUID.randomUUID());
        cache.put(sampleAt(5));

        cache.put(sampleAt(3));

        assertEquals(1, events.size());
    }

    @Test
    void evict_removesCachedSample() {
        cache.put(sampleAt(1));

        cache.evict(tripId);

        assertTrue(cache.get(tripId).isEmpty());
    }

    private LocationSample sampleAt(int seconds) {
        return new LocationSample(tripId, 12.97 + seconds * 0.001, 77.59, 30, 180, T0.plusSeconds(seconds));
    }

    private static List<List<Integer>> permutations(List<Integer> items) {
        if (items.size() <= 1) {
            return List.of(items);
        }
        List<List<Integer>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<Integer> rest = new ArrayList<>(items);
            Integer head = rest.remove(i);
            for (List<Integer> tail : permutations(rest)) {
                List<Integer> permutation = new ArrayList<>();
                permutation.add(head);
                permutation.addAll(tail);
                result.add(permutation);
            }
        }
        return result;
    }
}
