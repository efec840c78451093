package com.devloop.orchestrator.server;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PortAllocatorTest {

    @Test
    void allocate_handsOutSequentialPortsFromBase() {
        PortAllocator ports = new PortAllocator(5000, 3);

        assertThat(ports.allocatePort()).isEqualTo(5000);
        assertThat(ports.allocatePort()).isEqualTo(5001);
        assertThat(ports.allocatePort()).isEqualTo(5002);
        assertThat(ports.outstanding()).isEqualTo(3);
    }

    @Test
    void allocate_atCapacity_throwsWithoutAllocating() {
        PortAllocator ports = new PortAllocator(5000, 1);
        ports.allocatePort();

        assertThatThrownBy(ports::allocatePort)
                .isInstanceOf(PortCapacityExceededException.class)
                .hasMessageContaining("1");
        assertThat(ports.outstanding()).isEqualTo(1);
    }

    @Test
    void release_thenAllocate_reusesPortWithoutMintingNew() {
        PortAllocator ports = new PortAllocator(5000, 2);
        int first = ports.allocatePort();
        ports.allocatePort();

        ports.releasePort(first);

        assertThat(ports.allocatePort()).isEqualTo(first);
        assertThat(ports.mintedCount()).isEqualTo(2);
    }

    @Test
    void repeatedStartStopCycles_neverMintPastCapacity() {
        PortAllocator ports = new PortAllocator(5000, 2);
        for (int i = 0; i < 50; i++) {
            int a = ports.allocatePort();
            int b = ports.allocatePort();
            ports.releasePort(a);
            ports.releasePort(b);
        }
        assertThat(ports.mintedCount()).isEqualTo(2);
        assertThat(ports.outstanding()).isZero();
    }

    @Test
    void concurrentAllocation_neverHandsOutTheSamePortTwice() throws Exception {
        int capacity = 64;
        PortAllocator ports = new PortAllocator(6000, capacity);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        ConcurrentLinkedQueue<Integer> allocated = new ConcurrentLinkedQueue<>();

        List<Runnable> tasks = new ArrayList<>();
        for (int i = 0; i < capacity; i++) {
            tasks.add(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                allocated.add(ports.allocatePort());
            });
        }
        tasks.forEach(pool::execute);
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        Set<Integer> unique = new HashSet<>(allocated);
        assertThat(allocated).hasSize(capacity);
        assertThat(unique).hasSize(capacity);
        assertThat(unique).allMatch(p -> p >= 6000 && p < 6000 + capacity);
    }
}
