package com.liveclass.server.room;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RoomLocksTest {

    private int counter;

    @Test
    void serializesWorkOnOneRoom() throws Exception {
        RoomLocks locks = new RoomLocks();
        int threads = 8;
        int perThread = 5_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < perThread; i++) {
                        locks.run("R1", () -> counter++);
                    }
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }
        assertThat(counter).isEqualTo(threads * perThread);
        assertThat(locks.activeRooms()).isZero();
    }

    @Test
    void isReentrant() {
        RoomLocks locks = new RoomLocks();
        int value = locks.call("R1", () -> locks.call("R1", () -> {
            assertThat(locks.isHeldByCurrentThread("R1")).isTrue();
            return 7;
        }));
        assertThat(value).isEqualTo(7);
        assertThat(locks.isHeldByCurrentThread("R1")).isFalse();
        assertThat(locks.activeRooms()).isZero();
    }

    @Test
    void busyRoomDoesNotBlockOtherRooms() throws Exception {
        RoomLocks locks = new RoomLocks();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch releaseR1 = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            pool.execute(() -> locks.run("R1", () -> {
                held.countDown();
                try {
                    releaseR1.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            assertThat(held.await(2, TimeUnit.SECONDS)).isTrue();

            // every other room stays usable while R1 is held
            for (int i = 0; i < 200; i++) {
                String room = "other-" + i;
                CompletableFuture<Integer> f = CompletableFuture.supplyAsync(() -> locks.call(room, () -> 1));
                assertThat(f.get(1, TimeUnit.SECONDS)).isEqualTo(1);
            }
            assertThat(locks.isHeldByCurrentThread("R1")).isFalse();
        } finally {
            releaseR1.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
        assertThat(locks.activeRooms()).isZero();
    }
}
