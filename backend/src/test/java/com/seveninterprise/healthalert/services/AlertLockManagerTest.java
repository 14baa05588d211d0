package com.seveninterprise.healthalert.services;

import com.seveninterprise.healthalert.exceptions.AlertException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class AlertLockManagerTest {

    @Mock
    private TransactionTemplate transactionTemplate;

    private AlertLockManager lockManager;

    @BeforeEach
    void setUp() {
        lockManager = new AlertLockManager(transactionTemplate);
        ReflectionTestUtils.setField(lockManager, "stripes", 16);
        ReflectionTestUtils.setField(lockManager, "lockWaitSeconds", 5L);
        lockManager.init();

        lenient().when(transactionTemplate.execute(any()))
            .thenAnswer(invocation -> ((TransactionCallback<?>) invocation.getArgument(0)).doInTransaction(null));
    }

    @Test
    void testExecuteInLock_WithConcurrentMutations_ShouldSerializeThem() throws Exception {
        // Given
        int[] counter = {0};
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < 40; i++) {
            futures.add(executor.submit(() -> lockManager.runInLock("ALT-SYS-0001", () -> {
                int read = counter[0];
                Thread.yield();
                counter[0] = read + 1;
            })));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        // Then
        assertEquals(40, counter[0]);
    }

    @Test
    void testExecuteInLock_WhenMutationThrows_ShouldReleaseLock() throws Exception {
        // Given
        assertThrows(IllegalStateException.class, () -> lockManager.executeInLock("ALT-SYS-0002", () -> {
            throw new IllegalStateException("falha na mutação");
        }));

        // When: outra thread consegue o mesmo lock
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<String> result = executor.submit(() -> lockManager.executeInLock("ALT-SYS-0002", () -> "ok"));

        // Then
        assertEquals("ok", result.get(10, TimeUnit.SECONDS));
        executor.shutdown();
    }

    @Test
    void testExecuteInLock_WhenLockHeldTooLong_ShouldThrowAlertException() throws Exception {
        // Given
        ReflectionTestUtils.setField(lockManager, "lockWaitSeconds", 0L);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<?> holder = executor.submit(() -> lockManager.runInLock("ALT-SYS-0003", () -> {
            locked.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));
        assertTrue(locked.await(10, TimeUnit.SECONDS));

        // When & Then
        try {
            assertThrows(AlertException.class, () -> lockManager.executeInLock("ALT-SYS-0003", () -> "nunca"));
        } finally {
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
            executor.shutdown();
        }
    }
}
