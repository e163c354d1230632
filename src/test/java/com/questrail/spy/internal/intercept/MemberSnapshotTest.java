package com.questrail.spy.internal.intercept;

import com.questrail.spy.api.SpyUsageException;
import com.questrail.spy.fixtures.ExtendedIdService;
import com.questrail.spy.fixtures.IdService;
import org.junit.jupiter.api.Test;

import java.util.function.IntSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class MemberSnapshotTest
{
    // ---------------------------------------------------------------------
    // Resolution
    // ---------------------------------------------------------------------

    @Test
    void capturesCallableMember() {
        IdService service = new IdService();
        IntSupplier original = service.nextId;

        MemberSnapshot snapshot = MemberSnapshot.capture(service, "nextId");

        assertEquals(MemberSnapshot.Kind.CALLABLE, snapshot.kind());
        assertSame(service, snapshot.owner());
        assertSame(original, snapshot.originalValue());
        assertEquals(IntSupplier.class, snapshot.declaredType());
        assertEquals("IdService.nextId", snapshot.toString());
    }

    @Test
    void capturesAccessorMember() {
        MemberSnapshot snapshot = MemberSnapshot.capture(new IdService(), "status");
        assertEquals(MemberSnapshot.Kind.ACCESSOR, snapshot.kind());
    }

    @Test
    void findsMembersDeclaredOnSuperclass() {
        ExtendedIdService service = new ExtendedIdService();
        MemberSnapshot snapshot = MemberSnapshot.capture(service, "greet");
        assertSame(service.greet, snapshot.originalValue());
    }

    @Test
    void classOwnerResolvesStaticMember() {
        MemberSnapshot snapshot = MemberSnapshot.capture(IdService.class, "sharedCounter");
        assertSame(IdService.sharedCounter, snapshot.originalValue());
    }

    /**
     * Instance members are not visible through the class and vice versa.
     */
    @Test
    void staticAndInstanceMembersAreKeptApart() {
        assertThrows(SpyUsageException.class, () -> MemberSnapshot.capture(IdService.class, "nextId"));
        assertThrows(SpyUsageException.class, () -> MemberSnapshot.capture(new IdService(), "sharedCounter"));
    }

    // ---------------------------------------------------------------------
    // Usage errors
    // ---------------------------------------------------------------------

    @Test
    void missingMemberIsRejected() {
        SpyUsageException e = assertThrows(SpyUsageException.class,
                () -> MemberSnapshot.capture(new IdService(), "nope"));
        assertTrue(e.getMessage().contains("does not exist"));
    }

    @Test
    void finalMemberIsRejected() {
        SpyUsageException e = assertThrows(SpyUsageException.class,
                () -> MemberSnapshot.capture(new IdService(), "fixed"));
        assertTrue(e.getMessage().contains("final"));
    }

    @Test
    void nonCallableMemberIsRejected() {
        SpyUsageException e = assertThrows(SpyUsageException.class,
                () -> MemberSnapshot.capture(new IdService(), "label"));
        assertEquals("Method 'label' is not a function or accessor", e.getMessage());
    }

    @Test
    void nullMemberIsRejected() {
        assertThrows(SpyUsageException.class, () -> MemberSnapshot.capture(new IdService(), "missing"));
    }

    // ---------------------------------------------------------------------
    // Install / restore
    // ---------------------------------------------------------------------

    @Test
    void restoreWritesOriginalBackWhileReplacementIsInstalled() {
        IdService service = new IdService();
        IntSupplier original = service.nextId;
        IntSupplier replacement = () -> 99;

        MemberSnapshot snapshot = MemberSnapshot.capture(service, "nextId");
        snapshot.install(replacement);
        assertSame(replacement, service.nextId);

        assertTrue(snapshot.restoreIfStillInstalled(replacement));
        assertSame(original, service.nextId);
    }

    /**
     * A member reassigned after install is left alone.
     */
    @Test
    void restoreSkipsMemberThatWasReassigned() {
        IdService service = new IdService();
        IntSupplier replacement = () -> 99;
        IntSupplier later = () -> 100;

        MemberSnapshot snapshot = MemberSnapshot.capture(service, "nextId");
        snapshot.install(replacement);
        service.nextId = later;

        assertFalse(snapshot.restoreIfStillInstalled(replacement));
        assertSame(later, service.nextId);
    }
}
