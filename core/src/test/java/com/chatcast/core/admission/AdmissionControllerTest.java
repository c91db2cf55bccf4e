package com.chatcast.core.admission;

import com.chatcast.core.RecordingConnection;
import com.chatcast.core.broadcast.Broadcaster;
import com.chatcast.core.history.HistoryStore;
import com.chatcast.core.history.InMemoryMessageStore;
import com.chatcast.core.session.ClientRegistry;
import com.chatcast.core.session.RoleCounts;
import com.chatcast.protocol.DenyReason;
import com.chatcast.protocol.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class AdmissionControllerTest {

    private ClientRegistry registry;
    private HistoryStore history;
    private AdmissionController admission;

    @BeforeEach
    void setUp() {
        registry = new ClientRegistry();
        InMemoryMessageStore store = new InMemoryMessageStore();
        store.initialize();
        history = new HistoryStore(store);
        admission = new AdmissionController(registry, history, new Broadcaster(registry), 500);
    }

    @Test
    void policyTable() {
        assertTrue(AdmissionController.canAdmitWriter(new RoleCounts(0, 0)));
        assertFalse(AdmissionController.canAdmitWriter(new RoleCounts(1, 0)));
        assertFalse(AdmissionController.canAdmitWriter(new RoleCounts(0, 1)));

        assertTrue(AdmissionController.canAdmitReader(new RoleCounts(0, 0)));
        assertTrue(AdmissionController.canAdmitReader(new RoleCounts(5, 0)));
        assertFalse(AdmissionController.canAdmitReader(new RoleCounts(0, 1)));
    }

    @Test
    void grantSendsHistoryThenConfirmationThenJoinNotice() {
        history.append("old", "line");
        RecordingConnection a = connect(1);
        RecordingConnection b = connect(2);
        registry.setUsername(1, "alice");

        AdmissionResult result = admission.request(1, "WRITER");

        assertTrue(result.granted());
        assertEquals(Role.WRITER, registry.lookup(1).role());
        assertEquals(List.of("old: line", "ROLE_CONFIRMED:writer", "System: alice joined as Writer"), a.frames());
        assertEquals(List.of("System: alice joined as Writer"), b.frames());
    }

    @Test
    void anyOtherValueRequestsReader() {
        RecordingConnection a = connect(1);
        AdmissionResult result = admission.request(1, "moderator");

        assertEquals(AdmissionResult.granted(Role.READER), result);
        assertEquals(List.of("", "ROLE_CONFIRMED:reader", "System: Anonymous joined as Reader"), a.frames());
    }

    @Test
    void denialIsPrivateAndChangesNothing() {
        RecordingConnection a = connect(1);
        admission.request(1, "writer");
        a.clear();
        RecordingConnection b = connect(2);

        AdmissionResult result = admission.request(2, "reader");

        assertFalse(result.granted());
        assertEquals(DenyReason.WRITER_PRESENT, result.reason());
        assertEquals(List.of("ROLE_DENIED:A writer is already inside."), b.frames());
        assertTrue(a.frames().isEmpty());
        assertEquals(Role.NONE, registry.lookup(2).role());
    }

    @Test
    void writerDeniedWhileReadersPresent() {
        connect(1);
        admission.request(1, "reader");
        RecordingConnection b = connect(2);

        AdmissionResult result = admission.request(2, "writer");

        assertEquals(DenyReason.WRITER_OR_READERS_PRESENT, result.reason());
        assertEquals("ROLE_DENIED:A writer or readers are already inside.", b.last());
    }

    @Test
    void soleReaderCannotUpgradeItself() {
        connect(1);
        admission.request(1, "reader");
        assertFalse(admission.request(1, "writer").granted());
        assertEquals(Role.READER, registry.lookup(1).role());
    }

    @Test
    void unknownSessionIsDenied() {
        assertFalse(admission.request(99, "writer").granted());
    }

    @Test
    void concurrentWriterRequestsHaveExactlyOneWinner() throws Exception {
        int contenders = 32;
        for (int i = 1; i <= contenders; i++) connect(i);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<AdmissionResult>> results = new ArrayList<>();
        try {
            for (int i = 1; i <= contenders; i++) {
                int id = i;
                results.add(pool.submit(() -> {
                    start.await();
                    return admission.request(id, "writer");
                }));
            }
            start.countDown();
            int winners = 0;
            for (Future<AdmissionResult> f : results) {
                if (f.get(10, TimeUnit.SECONDS).granted()) winners++;
            }
            assertEquals(1, winners);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(new RoleCounts(0, 1), registry.countRoles());
    }

    @Test
    void mixedConcurrentRequestsNeverBreakExclusion() throws Exception {
        int sessions = 16;
        for (int i = 1; i <= sessions; i++) connect(i);

        AtomicBoolean violated = new AtomicBoolean();
        ExecutorService pool = Executors.newFixedThreadPool(sessions + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> work = new ArrayList<>();
            for (int i = 1; i <= sessions; i++) {
                int id = i;
                work.add(pool.submit(() -> {
                    start.await();
                    for (int n = 0; n < 200; n++) {
                        admission.request(id, ThreadLocalRandom.current().nextBoolean() ? "writer" : "reader");
                        // occasionally step back down so other sessions get a turn
                        if (n % 7 == 0) registry.setRole(id, Role.NONE);
                    }
                    return null;
                }));
            }
            work.add(pool.submit(() -> {
                start.await();
                for (int n = 0; n < 2_000; n++) {
                    RoleCounts c = registry.countRoles();
                    if (c.writers() > 1 || (c.writers() == 1 && c.readers() > 0)) violated.set(true);
                }
                return null;
            }));
            start.countDown();
            for (Future<?> f : work) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertFalse(violated.get(), "writer and reader roles coexisted");
    }

    private RecordingConnection connect(int id) {
        RecordingConnection c = new RecordingConnection(id);
        registry.register(c);
        return c;
    }
}
