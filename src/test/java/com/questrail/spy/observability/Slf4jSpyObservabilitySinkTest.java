package com.questrail.spy.observability;

import com.questrail.spy.api.Spy;
import com.questrail.spy.core.SpyEngine;
import com.questrail.spy.fixtures.IdService;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class Slf4jSpyObservabilitySinkTest
{
    @Test
    void lifecycleEventTargetIncludesOwnerWhenKnown() {
        Instant now = Instant.now();
        assertEquals("IdService.nextId", new SpyLifecycleEvent(now, "IdService", "nextId", "spy").target());
        assertEquals("loose", new SpyLifecycleEvent(now, null, "loose", "spy").target());
    }

    /**
     * The default engine logs through SLF4J; a full install/restore cycle must
     * not disturb the member.
     */
    @Test
    void defaultEngineLogsLifecycleWithoutSideEffects() {
        SpyEngine engine = new SpyEngine();
        IdService service = new IdService();
        IntSupplier original = service.nextId;

        Spy<IntSupplier> spy = engine.spyOn(service, "nextId");
        service.nextId.getAsInt();
        engine.restoreAllSpies();

        assertSame(original, service.nextId);
        assertTrue(spy.calledOnce());
    }

    @Test
    void errorEventsAreLogged() {
        Slf4jSpyObservabilitySink sink = new Slf4jSpyObservabilitySink();
        assertDoesNotThrow(() -> sink.onError(
                new SpyErrorEvent(Instant.now(), "restore failed", new IllegalStateException("boom"))));
        assertDoesNotThrow(() -> sink.onBulkRestore(new SpyBulkRestoreEvent(Instant.now(), 2)));
    }
}
