package com.polydoc.core;

import com.polydoc.core.store.DocumentStore;
import com.polydoc.core.store.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionCoordinatorTest {

    @Mock
    private DocumentStore store;

    @Mock
    private Session session;

    private TransactionCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new TransactionCoordinator(store);
    }

    @Test
    void commitsAndClosesANewSessionWhenTheWorkSucceeds() {
        when(store.startSession()).thenReturn(session);

        String result = coordinator.runInTransaction(given -> {
            assertSame(session, given);
            return "done";
        });

        assertEquals("done", result);
        InOrder order = inOrder(session);
        order.verify(session).startTransaction();
        order.verify(session).commitTransaction();
        order.verify(session).close();
        verify(session, never()).abortTransaction();
    }

    @Test
    void abortsAndRethrowsWhenTheWorkFails() {
        when(store.startSession()).thenReturn(session);
        when(session.hasActiveTransaction()).thenReturn(true);
        IllegalStateException failure = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> coordinator.runInTransaction(given -> {
                    throw failure;
                }));

        assertSame(failure, thrown);
        verify(session, never()).commitTransaction();
        InOrder order = inOrder(session);
        order.verify(session).abortTransaction();
        order.verify(session).close();
    }

    @Test
    void doesNotAbortAfterAFailedCommit() {
        when(store.startSession()).thenReturn(session);
        doThrow(new IllegalStateException("commit failed")).when(session).commitTransaction();

        assertThrows(IllegalStateException.class, () -> coordinator.runInTransaction(given -> 1));

        verify(session, never()).abortTransaction();
        verify(session).close();
    }

    @Test
    void closesTheSessionWhenTheTransactionCannotStart() {
        when(store.startSession()).thenReturn(session);
        doThrow(new IllegalStateException("no replica set")).when(session).startTransaction();

        assertThrows(IllegalStateException.class, () -> coordinator.runInTransaction(given -> 1));

        verify(session).close();
    }

    @Test
    void joinsTheActiveTransactionOfAGivenSession() {
        when(session.hasActiveTransaction()).thenReturn(true);
        OperationOptions options = OperationOptions.builder().session(session).build();

        Integer result = coordinator.runInTransaction(given -> {
            assertSame(session, given);
            return 7;
        }, options);

        assertEquals(7, result);
        verify(session, never()).startTransaction();
        verify(session, never()).commitTransaction();
        verify(session, never()).close();
        verify(store, never()).startSession();
    }

    @Test
    void leavesAJoinedTransactionToItsOwnerOnFailure() {
        when(session.hasActiveTransaction()).thenReturn(true);
        OperationOptions options = OperationOptions.builder().session(session).build();

        assertThrows(IllegalArgumentException.class, () -> coordinator.runInTransaction(given -> {
            throw new IllegalArgumentException("bad");
        }, options));

        verify(session, never()).abortTransaction();
        verify(session, never()).close();
    }

    @Test
    void startsATransactionOnAGivenIdleSessionWithoutClosingIt() {
        when(session.hasActiveTransaction()).thenReturn(false);
        OperationOptions options = OperationOptions.builder().session(session).build();

        coordinator.runInTransaction(given -> "done", options);

        InOrder order = inOrder(session);
        order.verify(session).startTransaction();
        order.verify(session).commitTransaction();
        verify(session, never()).close();
        verify(store, never()).startSession();
    }
}
