package com.questrail.spy.core;

import com.questrail.spy.api.Spy;
import com.questrail.spy.api.SpyCall;
import com.questrail.spy.api.SpyFunction;
import com.questrail.spy.api.SpyUsageException;
import com.questrail.spy.config.SpyEngineConfig;
import com.questrail.spy.fixtures.IdService;
import com.questrail.spy.observability.RecordingObservabilitySink;
import com.questrail.spy.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class BasicSpyTest
{
    private ManualMonotonicClock clock;
    private SpyEngine engine;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        engine = new SpyEngine(SpyEngineConfig.builder()
                .withClock(clock)
                .withObservabilitySink(new RecordingObservabilitySink())
                .build());
    }

    // ---------------------------------------------------------------------
    // Fresh spy
    // ---------------------------------------------------------------------

    @Test
    void freshSpyHasNoCalls() {
        Spy<SpyFunction> spy = engine.createSpyFunction("fresh");

        assertEquals(0, spy.callCount());
        assertFalse(spy.called());
        assertTrue(spy.notCalled());
        assertFalse(spy.calledOnce());
        assertTrue(spy.calls().isEmpty());
        assertTrue(spy.firstCall().isEmpty());
        assertTrue(spy.lastCall().isEmpty());
        assertTrue(spy.getCall(0).isEmpty());
        assertFalse(spy.calledWith());
    }

    @Test
    void standaloneSpyWithoutOriginalReturnsZeroValues() {
        Spy<IntSupplier> ints = engine.createSpy(IntSupplier.class);
        Spy<SpyFunction> fn = engine.createSpyFunction();

        assertEquals(0, ints.fn().getAsInt());
        assertNull(fn.fn().call("a"));
        assertEquals(1, ints.callCount());
        assertEquals("spy", ints.memberName());
        assertTrue(ints.owner().isEmpty());
    }

    @Test
    void standaloneSpyCallsThroughToGivenOriginal() {
        Spy<Function<String, String>> spy = engine.createSpy(typeOf(), "upper", String::toUpperCase);

        assertEquals("ABC", spy.fn().apply("abc"));
        assertTrue(spy.calledWith("abc"));
    }

    // ---------------------------------------------------------------------
    // Recording
    // ---------------------------------------------------------------------

    @Test
    void recordsArgumentsReceiverValueAndTimestampInCallOrder() {
        IdService service = new IdService();
        Spy<Function<String, String>> spy = engine.spyOn(service, "greet");

        clock.advanceNanos(5);
        service.greet.apply("ann");
        clock.advanceNanos(5);
        service.greet.apply("bob");

        List<SpyCall> calls = spy.calls();
        assertEquals(2, calls.size());
        assertEquals(List.of("ann"), calls.get(0).args());
        assertSame(service, calls.get(0).receiver());
        assertEquals("Hello ann", calls.get(0).returnValue());
        assertNull(calls.get(0).error());
        assertEquals(5, calls.get(0).timestampNanos());
        assertEquals(10, calls.get(1).timestampNanos());
        assertTrue(spy.calledTwice());
    }

    @Test
    void indexLookupIsBoundsSafe() {
        Spy<SpyFunction> spy = engine.createSpyFunction("idx");
        spy.fn().call(1);
        spy.fn().call(2);
        spy.fn().call(3);

        assertTrue(spy.calledThrice());
        assertEquals(1, spy.getCall(0).orElseThrow().arg(0));
        assertEquals(3, spy.getCall(2).orElseThrow().arg(0));
        assertTrue(spy.getCall(3).isEmpty());
        assertTrue(spy.getCall(-1).isEmpty());
        assertEquals(1, spy.firstCall().orElseThrow().arg(0));
        assertEquals(3, spy.lastCall().orElseThrow().arg(0));
    }

    @Test
    void calledWithComparesStructurallyPositionByPosition() {
        Spy<SpyFunction> spy = engine.createSpyFunction("args");
        spy.fn().call("a", new int[] { 1, 2 }, List.of("x"));

        assertTrue(spy.calledWith("a", new int[] { 1, 2 }, List.of("x")));
        assertFalse(spy.calledWith("a", new int[] { 1, 3 }, List.of("x")));
        assertFalse(spy.calledWith("a"));
        assertTrue(spy.neverCalledWith("b"));
    }

    @Test
    void nullArgumentsAreRecordedAndMatched() {
        Spy<SpyFunction> spy = engine.createSpyFunction("nulls");
        spy.fn().call((Object) null);
        spy.fn().call("x", null);

        assertEquals(Arrays.asList((Object) null), spy.getCall(0).orElseThrow().args());
        assertTrue(spy.calledWith((Object) null));
        assertTrue(spy.calledWith((Object[]) null));
        assertTrue(spy.calledWith("x", null));
    }

    @Test
    void callsSnapshotIsUnaffectedByLaterCalls() {
        Spy<SpyFunction> spy = engine.createSpyFunction("snap");
        spy.fn().call();
        List<SpyCall> before = spy.calls();
        spy.fn().call();

        assertEquals(1, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.add(before.get(0)));
    }

    // ---------------------------------------------------------------------
    // Behaviors
    // ---------------------------------------------------------------------

    @Test
    void returnValueOverridesOriginal() {
        IdService service = new IdService();
        Spy<IntSupplier> spy = engine.spyOn(service, "nextId");

        spy.returnValue(41);

        assertEquals(41, service.nextId.getAsInt());
        assertEquals(41, service.nextId.getAsInt());
    }

    @Test
    void returnValuesRepeatLastOnceExhausted() {
        IdService service = new IdService();
        Spy<IntSupplier> spy = engine.spyOn(service, "nextId");
        spy.returnValues(10, 20, 30);

        assertEquals(10, service.nextId.getAsInt());
        assertEquals(20, service.nextId.getAsInt());
        assertEquals(30, service.nextId.getAsInt());
        assertEquals(30, service.nextId.getAsInt());
        assertEquals(4, spy.callCount());
    }

    @Test
    void throwErrorRaisesAndRecordsTheError() {
        IdService service = new IdService();
        Spy<Function<String, String>> spy = engine.spyOn(service, "greet");
        IllegalStateException boom = new IllegalStateException("boom");

        spy.throwError(boom);

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> service.greet.apply("x"));
        assertSame(boom, thrown);
        SpyCall call = spy.lastCall().orElseThrow();
        assertSame(boom, call.error());
        assertNull(call.returnValue());
        assertTrue(call.hasError());
        assertTrue(spy.calledOnce());
    }

    @Test
    void declaredCheckedExceptionPassesThroughUnwrapped() {
        IdService service = new IdService();
        Spy<IdService.Loader> spy = engine.spyOn(service, "loader");
        spy.throwError(new IOException("disk"));

        IOException thrown = assertThrows(IOException.class, () -> service.loader.load("k"));
        assertEquals("disk", thrown.getMessage());
    }

    @Test
    void callFakeRunsReplacement() {
        IdService service = new IdService();
        Spy<Function<String, String>> spy = engine.spyOn(service, "greet");

        spy.callFake(name -> "Bye " + name);

        assertEquals("Bye ann", service.greet.apply("ann"));
        assertEquals("Bye ann", spy.lastCall().orElseThrow().returnValue());
    }

    @Test
    void errorsFromOriginalAreRecordedAndRethrown() {
        IllegalArgumentException bad = new IllegalArgumentException("bad");
        Spy<SpyFunction> spy = engine.createSpyFunction("failing", args -> { throw bad; });

        assertSame(bad, assertThrows(IllegalArgumentException.class, () -> spy.fn().call()));
        assertSame(bad, spy.lastCall().orElseThrow().error());
    }

    @Test
    void callThroughRestoresOriginalBehavior() {
        IdService service = new IdService();
        Spy<IntSupplier> spy = engine.spyOn(service, "nextId");

        spy.returnValue(5).callThrough();

        assertEquals(1, service.nextId.getAsInt());
    }

    @Test
    void nullFixedValueOnPrimitiveReturnYieldsZero() {
        Spy<IntSupplier> spy = engine.createSpy(IntSupplier.class);
        spy.returnValue(null);
        assertEquals(0, spy.fn().getAsInt());
    }

    @Test
    void defaultMethodsRunTheirOwnBodyThroughTheSpy() {
        IdService service = new IdService();
        Spy<IdService.Loader> spy = engine.spyOn(service, "loader");
        spy.throwError(new IOException("gone"));

        assertEquals("fallback", service.loader.loadOrDefault("k", "fallback"));
        assertTrue(spy.calledOnce());
        assertTrue(spy.calledWith("k"));
    }

    @Test
    void voidSpyDiscardsConfiguredValue() {
        Spy<Runnable> spy = engine.createSpy(Runnable.class);
        spy.returnValue("ignored");

        spy.fn().run();

        assertEquals("ignored", spy.lastCall().orElseThrow().returnValue());
    }

    // ---------------------------------------------------------------------
    // Usage errors
    // ---------------------------------------------------------------------

    @Test
    void valueOfWrongTypeIsRejected() {
        Spy<IntSupplier> spy = engine.createSpy(IntSupplier.class, "typed");
        assertThrows(SpyUsageException.class, () -> spy.returnValue("not an int"));
        assertThrows(SpyUsageException.class, () -> spy.returnValues(1, "two"));
    }

    @Test
    void undeclaredCheckedExceptionIsRejected() {
        Spy<IntSupplier> spy = engine.createSpy(IntSupplier.class, "checked");
        assertThrows(SpyUsageException.class, () -> spy.throwError(new IOException("io")));
    }

    // ---------------------------------------------------------------------
    // Reset and identity
    // ---------------------------------------------------------------------

    @Test
    void resetClearsCallsAndRewindsSequenceButKeepsBehavior() {
        Spy<IntSupplier> spy = engine.createSpy(IntSupplier.class);
        spy.returnValues(1, 2);
        spy.fn().getAsInt();
        spy.fn().getAsInt();

        spy.reset();

        assertEquals(0, spy.callCount());
        assertEquals(1, spy.fn().getAsInt());
    }

    @Test
    void proxyUsesIdentityAndSpyLabel() {
        Spy<SpyFunction> spy = engine.createSpyFunction("labelled");
        SpyFunction fn = spy.fn();

        assertEquals(fn, fn);
        assertNotEquals(fn, engine.createSpyFunction("labelled").fn());
        assertEquals(System.identityHashCode(fn), fn.hashCode());
        assertEquals("Spy<labelled>", fn.toString());
        assertEquals(0, spy.callCount());
    }

    @SuppressWarnings("unchecked")
    private static Class<Function<String, String>> typeOf() {
        return (Class<Function<String, String>>) (Class<?>) Function.class;
    }
}
