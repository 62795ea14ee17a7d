package com.p14n.eventhub.broker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.p14n.eventhub.OrderPlaced;
import com.p14n.eventhub.TestClock;
import com.p14n.eventhub.data.ConfigData;
import com.p14n.eventhub.data.EventRecord;
import com.p14n.eventhub.data.FanOutMode;
import com.p14n.eventhub.data.HubConfig;
import com.p14n.eventhub.data.HubMode;
import com.p14n.eventhub.storage.InMemoryStorage;
import com.p14n.eventhub.storage.RecordSearch;
import com.p14n.eventhub.storage.StorageException;
import com.p14n.eventhub.storage.StorageProvider;
import com.p14n.eventhub.transport.EventChannel;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static com.p14n.eventhub.TestUtil.fastConfig;
import static com.p14n.eventhub.TestUtil.waitFor;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class EventHubTest {

    private static final String EVENT_TYPE = OrderPlaced.class.getName();

    private record Session(CancellationSignal call, Future<Void> loop) {
    }

    private DefaultExecutor executor;
    private CancellationSignal appStopping;
    private HubRegistry registry;

    @BeforeEach
    void setUp() {
        executor = new DefaultExecutor(2);
        appStopping = CancellationSignal.none();
        registry = new HubRegistry(executor);
    }

    @AfterEach
    void tearDown() throws Exception {
        appStopping.cancel();
        executor.close();
    }

    private EventHub<OrderPlaced, EventRecord> hub(HubConfig cfg, StorageProvider<EventRecord> storage) {
        return hub(cfg, storage, EventHubErrorObserver.NONE);
    }

    private EventHub<OrderPlaced, EventRecord> hub(HubConfig cfg, StorageProvider<EventRecord> storage,
            EventHubErrorObserver errors) {
        return EventHub.builder(OrderPlaced.class)
                .config(cfg)
                .storage(storage, EventRecord::new)
                .registry(registry)
                .appStopping(appStopping)
                .asyncExecutor(executor)
                .errorObserver(errors)
                .build();
    }

    private Session connect(EventHub<OrderPlaced, ?> hub, String subscriberId, EventChannel<OrderPlaced> channel)
            throws InterruptedException {
        var call = CancellationSignal.none();
        Future<Void> loop = executor.submit(() -> {
            hub.onSubscriberConnected(subscriberId, channel, call);
            return null;
        });
        assertTrue(waitFor(() -> {
            var s = hub.subscribers().get(subscriberId);
            return s != null && s.isConnected();
        }, Duration.ofSeconds(2)), "subscriber did not connect");
        return new Session(call, loop);
    }

    @Test
    void shouldBroadcastToEveryConnectedSubscriber() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var s1 = new CollectingChannel<OrderPlaced>();
        var s2 = new CollectingChannel<OrderPlaced>();
        connect(hub, "s1", s1);
        connect(hub, "s2", s2);

        registry.routeEvent(new OrderPlaced("o-1", 3), appStopping);

        assertEquals(new OrderPlaced("o-1", 3), s1.next());
        assertEquals(new OrderPlaced("o-1", 3), s2.next());
    }

    @Test
    void shouldDeliverInPublishOrder() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var s1 = new CollectingChannel<OrderPlaced>();
        connect(hub, "s1", s1);

        for (int i = 0; i < 20; i++) {
            hub.broadcastEvent(new OrderPlaced("o-" + i, i), appStopping);
        }

        for (int i = 0; i < 20; i++) {
            assertEquals(new OrderPlaced("o-" + i, i), s1.next());
        }
    }

    @Test
    void shouldQueueForKnownButDisconnectedSubscribersInBroadcast() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var storage = new InMemoryStorage(cfg);
        var hub = hub(cfg, storage);
        hub.subscribers().getOrAdd("offline");

        hub.broadcastEvent(new OrderPlaced("o-1", 1), appStopping);

        assertEquals(1, storage.queueSize(EVENT_TYPE, "offline"));

        var channel = new CollectingChannel<OrderPlaced>();
        connect(hub, "offline", channel);
        assertEquals(new OrderPlaced("o-1", 1), channel.next());
    }

    @Test
    void shouldRotateRoundRobinAcrossConnectedSubscribers() throws Exception {
        var cfg = fastConfig(FanOutMode.ROUND_ROBIN, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        List<CollectingChannel<OrderPlaced>> channels = new ArrayList<>();
        for (var id : List.of("s1", "s2", "s3")) {
            var c = new CollectingChannel<OrderPlaced>();
            channels.add(c);
            connect(hub, id, c);
        }

        for (int i = 0; i < 30; i++) {
            hub.broadcastEvent(new OrderPlaced("o-" + i, i), appStopping);
        }

        assertTrue(waitFor(() -> channels.stream().mapToInt(CollectingChannel::count).sum() == 30,
                Duration.ofSeconds(3)));
        for (var c : channels) {
            assertEquals(10, c.count());
        }
    }

    @Test
    void shouldDropEventWhenNoSubscriberAppears() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage);

        long start = System.nanoTime();
        hub.broadcastEvent(new OrderPlaced("o-1", 1), appStopping);
        long waited = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(waited >= 250, "expected to wait for subscribers, waited " + waited + "ms");
        verify(storage, never()).storeEvent(any(), any());
        verify(storage, never()).storeEvents(any(), any());
    }

    @Test
    void shouldDeliverToSubscriberConnectingDuringTheWait() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER)
                .withTimings(Duration.ofMillis(50), Duration.ofSeconds(3), Duration.ofMillis(20),
                        Duration.ofMillis(100), Duration.ofMillis(500));
        var hub = hub(cfg, new InMemoryStorage(cfg));

        Future<Void> publish = executor.submit(() -> {
            hub.broadcastEvent(new OrderPlaced("late", 1), appStopping);
            return null;
        });
        Thread.sleep(100);
        var channel = new CollectingChannel<OrderPlaced>();
        connect(hub, "s1", channel);

        publish.get(3, TimeUnit.SECONDS);
        assertEquals(new OrderPlaced("late", 1), channel.next());
    }

    @Test
    void shouldRequeueAndEndLoopWhenWriteFails() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var storage = new InMemoryStorage(cfg);
        var hub = hub(cfg, storage);
        var session = connect(hub, "s1", CollectingChannel.closed());

        hub.broadcastEvent(new OrderPlaced("o-1", 1), appStopping);

        session.loop().get(2, TimeUnit.SECONDS);
        assertEquals(1, storage.queueSize(EVENT_TYPE, "s1"));

        var channel = new CollectingChannel<OrderPlaced>();
        connect(hub, "s1", channel);
        assertEquals(new OrderPlaced("o-1", 1), channel.next());
    }

    @Test
    void shouldDisconnectRoundRobinSubscriberWhenWriteFails() throws Exception {
        var cfg = fastConfig(FanOutMode.ROUND_ROBIN, HubMode.EVENT_PUBLISHER);
        var storage = new InMemoryStorage(cfg);
        var hub = hub(cfg, storage);
        var broken = connect(hub, "a", CollectingChannel.closed());
        var healthy = new CollectingChannel<OrderPlaced>();
        connect(hub, "b", healthy);

        // "a" sorts first, so it is picked for the first event
        hub.broadcastEvent(new OrderPlaced("o-0", 0), appStopping);
        broken.loop().get(2, TimeUnit.SECONDS);

        assertFalse(hub.subscribers().get("a").isConnected());
        assertEquals(List.of("b"), hub.subscribers().connectedIds());
        assertEquals(1, storage.queueSize(EVENT_TYPE, "a"));

        for (int i = 1; i <= 5; i++) {
            hub.broadcastEvent(new OrderPlaced("o-" + i, i), appStopping);
        }
        for (int i = 1; i <= 5; i++) {
            assertEquals(new OrderPlaced("o-" + i, i), healthy.next());
        }
        assertEquals(1, storage.queueSize(EVENT_TYPE, "a"));
    }

    @Test
    void shouldReplaceTheLoopOfAReconnectingSubscriber() throws Exception {
        var cfg = fastConfig(FanOutMode.ROUND_ROBIN, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var stale = new CollectingChannel<OrderPlaced>();
        var first = connect(hub, "a", stale);
        var live = new CollectingChannel<OrderPlaced>();
        var second = connect(hub, "a", live);

        first.loop().get(2, TimeUnit.SECONDS);
        first.call().cancel();

        assertFalse(second.loop().isDone());
        assertEquals(List.of("a"), hub.subscribers().connectedIds());

        hub.broadcastEvent(new OrderPlaced("o-1", 1), appStopping);

        assertEquals(new OrderPlaced("o-1", 1), live.next());
        assertEquals(0, stale.count());
    }

    @Test
    void shouldEndLoopWhenItsThreadIsInterrupted() throws Exception {
        var cfg = fastConfig(FanOutMode.ROUND_ROBIN, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var call = CancellationSignal.none();
        var loop = new Thread(() -> hub.onSubscriberConnected("s1", new CollectingChannel<>(), call),
                "subscriber-loop");
        loop.start();
        assertTrue(waitFor(() -> {
            var s = hub.subscribers().get("s1");
            return s != null && s.isConnected();
        }, Duration.ofSeconds(2)));

        loop.interrupt();
        loop.join(2000);

        assertFalse(loop.isAlive());
        assertFalse(hub.subscribers().get("s1").isConnected());
        assertFalse(call.isCancelled());
    }

    @Test
    void shouldEvictSubscriberWhoseQueueOverflows() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var storage = new InMemoryStorage(new TestClock(Instant.parse("2024-01-01T00:00:00Z")),
                Duration.ofHours(4), 2);
        var errors = mock(EventHubErrorObserver.class);
        var hub = hub(cfg, storage, errors);
        hub.subscribers().getOrAdd("slow");
        hub.subscribers().getOrAdd("other");

        hub.broadcastEvent(new OrderPlaced("o-1", 1), appStopping);
        hub.broadcastEvent(new OrderPlaced("o-2", 1), appStopping);
        storage.getNextBatch(RecordSearch.pending(EVENT_TYPE, "other", 1,
                Instant.parse("2024-01-01T00:00:00Z"), appStopping));
        hub.broadcastEvent(new OrderPlaced("o-3", 1), appStopping);

        assertFalse(hub.subscribers().contains("slow"));
        assertTrue(hub.subscribers().contains("other"));
        assertEquals(2, storage.queueSize(EVENT_TYPE, "other"));
        verify(errors).onQueueOverflow(argThat(r -> "slow".equals(r.getSubscriberId()) && r.isQueueOverflowed()));
    }

    @Test
    void shouldEndLoopOfEvictedSubscriber() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var session = connect(hub, "s1", new CollectingChannel<>());

        hub.subscribers().remove("s1");

        session.loop().get(2, TimeUnit.SECONDS);
        assertFalse(hub.subscribers().contains("s1"));
    }

    @Test
    void shouldRetryFailedStoresUntilTheySucceed() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        doThrow(new StorageException("unavailable"))
                .doThrow(new StorageException("unavailable"))
                .doNothing()
                .when(storage).storeEvent(any(), any());
        var errors = mock(EventHubErrorObserver.class);
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage, errors);
        hub.subscribers().getOrAdd("s1");

        hub.broadcastEvent(new OrderPlaced("o-1", 1), appStopping);

        verify(storage, times(3)).storeEvent(any(), any());
        verify(errors).onStoreEventError(any(), eq(0), any(StorageException.class));
        verify(errors).onStoreEventError(any(), eq(1), any(StorageException.class));
    }

    @Test
    void shouldAbandonStoreRetriesWhenCancelled() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        doThrow(new StorageException("unavailable")).when(storage).storeEvent(any(), any());
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage);
        hub.subscribers().getOrAdd("s1");

        var publishCancelled = CancellationSignal.none();
        executor.schedule(publishCancelled::cancel, 200, TimeUnit.MILLISECONDS);
        hub.broadcastEvent(new OrderPlaced("o-1", 1), publishCancelled);

        verify(storage, atLeast(2)).storeEvent(any(), any());
    }

    @Test
    void shouldRetryFailedReads() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        when(storage.getNextBatch(any()))
                .thenThrow(new StorageException("unavailable"))
                .thenReturn(List.of());
        var errors = mock(EventHubErrorObserver.class);
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage, errors);

        var session = connect(hub, "s1", new CollectingChannel<>());

        assertTrue(waitFor(() -> mockingDetails(storage).getInvocations().stream()
                .filter(i -> i.getMethod().getName().equals("getNextBatch")).count() >= 2,
                Duration.ofSeconds(2)));
        verify(errors).onGetNextBatchError(eq(EVENT_TYPE), eq("s1"), eq(0), any(StorageException.class));
        session.call().cancel();
        session.loop().get(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldEndLoopWhenCallIsCancelled() throws Exception {
        var cfg = fastConfig(FanOutMode.ROUND_ROBIN, HubMode.EVENT_PUBLISHER)
                .withTimings(Duration.ofMillis(50), Duration.ofMillis(300), Duration.ofMillis(20),
                        Duration.ofSeconds(30), Duration.ofMillis(500));
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var session = connect(hub, "s1", new CollectingChannel<>());

        session.call().cancel();

        // the wake wait is long, cancellation has to wake the loop
        session.loop().get(2, TimeUnit.SECONDS);
        assertFalse(hub.subscribers().get("s1").isConnected());
        assertEquals(List.of(), hub.receiveCandidates());
    }

    @Test
    void shouldKeepBroadcastSubscriberAfterDisconnect() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var session = connect(hub, "s1", new CollectingChannel<>());

        session.call().cancel();
        session.loop().get(2, TimeUnit.SECONDS);

        assertEquals(List.of("s1"), hub.receiveCandidates());
    }

    @Test
    void shouldEndEveryLoopWhenApplicationStops() throws Exception {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));
        var s1 = connect(hub, "s1", new CollectingChannel<>());
        var s2 = connect(hub, "s2", new CollectingChannel<>());

        appStopping.cancel();

        s1.loop().get(2, TimeUnit.SECONDS);
        s2.loop().get(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldSkipRestoreForInMemoryStorage() {
        var cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var hub = hub(cfg, new InMemoryStorage(cfg));

        hub.initialize();

        assertEquals(0, hub.subscribers().size());
    }

    @Test
    void shouldSeedRestoredSubscribersAfterRetrying() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        when(storage.isDurable()).thenReturn(true);
        when(storage.restoreSubscriberIds(any()))
                .thenThrow(new StorageException("unavailable"))
                .thenReturn(Set.of("s1", "s2"));
        var errors = mock(EventHubErrorObserver.class);
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage, errors);

        hub.initialize();

        assertTrue(hub.subscribers().contains("s1"));
        assertTrue(hub.subscribers().contains("s2"));
        assertFalse(hub.subscribers().get("s1").isConnected());
        verify(errors).onRestoreSubscriberIdsError(eq(EVENT_TYPE), eq(0), any(StorageException.class));
    }

    @Test
    void shouldFailStartupWhenRestoreKeepsFailing() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        when(storage.isDurable()).thenReturn(true);
        when(storage.restoreSubscriberIds(any())).thenThrow(new StorageException("unavailable"));
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage);

        var e = assertThrows(HubInitializationException.class, hub::initialize);

        assertTrue(e.getMessage().contains(EVENT_TYPE));
        assertInstanceOf(StorageException.class, e.getCause());
        verify(storage, atLeast(2)).restoreSubscriberIds(any());
    }

    @Test
    void shouldMarkDurableRecordsCompleteAfterWriting() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        when(storage.isDurable()).thenReturn(true);
        var record = new EventRecord("s1", EVENT_TYPE,
                "{\"orderId\":\"o-1\",\"quantity\":1}".getBytes(),
                Instant.now().plusSeconds(60));
        when(storage.getNextBatch(any())).thenReturn(List.of(record)).thenReturn(List.of());
        doThrow(new StorageException("unavailable")).doNothing().when(storage).markComplete(any(), any());
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage);

        var channel = new CollectingChannel<OrderPlaced>();
        var session = connect(hub, "s1", channel);

        assertEquals(new OrderPlaced("o-1", 1), channel.next());
        verify(storage, timeout(2000).times(2)).markComplete(same(record), any());
        assertTrue(record.isComplete());
        session.call().cancel();
        session.loop().get(2, TimeUnit.SECONDS);
    }

    @Test
    void shouldLeaveDurableRecordsPendingWhenWriteFails() throws Exception {
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        when(storage.isDurable()).thenReturn(true);
        var record = new EventRecord("s1", EVENT_TYPE,
                "{\"orderId\":\"o-1\",\"quantity\":1}".getBytes(),
                Instant.now().plusSeconds(60));
        when(storage.getNextBatch(any())).thenReturn(List.of(record));
        var hub = hub(fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER), storage);

        var session = connect(hub, "s1", CollectingChannel.closed());

        session.loop().get(2, TimeUnit.SECONDS);
        assertFalse(record.isComplete());
        verify(storage, never()).markComplete(any(), any());
        verify(storage, never()).storeEvent(any(), any());
    }

    @Test
    void shouldUseConfiguredRecordTtl() throws Exception {
        var clock = new TestClock(Instant.parse("2024-01-01T00:00:00Z"));
        @SuppressWarnings("unchecked")
        StorageProvider<EventRecord> storage = mock(StorageProvider.class);
        ConfigData cfg = fastConfig(FanOutMode.BROADCAST, HubMode.EVENT_PUBLISHER);
        var hub = EventHub.builder(OrderPlaced.class)
                .config(cfg)
                .storage(storage, EventRecord::new)
                .asyncExecutor(executor)
                .clock(clock)
                .build();
        hub.subscribers().getOrAdd("s1");

        hub.broadcastEvent(new OrderPlaced("o-1", 1), appStopping);

        verify(storage).storeEvent(argThat(r -> r.getExpireOn().equals(clock.instant().plus(cfg.recordTtl()))
                && EVENT_TYPE.equals(r.getEventType())
                && "s1".equals(r.getSubscriberId())
                && !r.isComplete()), any());
    }
}
