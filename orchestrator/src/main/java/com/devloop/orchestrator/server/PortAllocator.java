package com.devloop.orchestrator.server;

import com.devloop.orchestrator.config.AgentProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands out local TCP ports from {@code [basePort, basePort + maxConcurrentServers)}.
 *
 * The pool state is an immutable snapshot swapped with compare-and-set, so
 * allocation and release never block each other. Released ports are reused
 * before a fresh one is minted.
 */
@Component
public class PortAllocator {

    private static final Logger log = LoggerFactory.getLogger(PortAllocator.class);

    /**
     * @param nextOffset  offset of the next never-used port
     * @param released    ports returned to the pool, available for reuse
     * @param outstanding ports currently held by servers
     */
    private record PoolState(int nextOffset, List<Integer> released, int outstanding) {}

    private final int basePort;
    private final int capacity;
    private final AtomicReference<PoolState> state =
            new AtomicReference<>(new PoolState(0, List.of(), 0));

    @Autowired
    public PortAllocator(AgentProperties props) {
        this(props.basePort(), props.maxConcurrentServers());
    }

    public PortAllocator(int basePort, int capacity) {
        this.basePort = basePort;
        this.capacity = capacity;
    }

    /**
     * @throws PortCapacityExceededException if {@code capacity} ports are already out
     */
    public int allocatePort() {
        while (true) {
            PoolState current = state.get();
            if (current.outstanding() >= capacity) {
                throw new PortCapacityExceededException(capacity);
            }

            int port;
            PoolState next;
            if (!current.released().isEmpty()) {
                List<Integer> remaining = new ArrayList<>(current.released());
                port = remaining.remove(remaining.size() - 1);
                next = new PoolState(current.nextOffset(), List.copyOf(remaining), current.outstanding() + 1);
            } else {
                port = basePort + current.nextOffset();
                next = new PoolState(current.nextOffset() + 1, current.released(), current.outstanding() + 1);
            }

            if (state.compareAndSet(current, next)) {
                log.debug("Allocated port {} ({}/{} in use)", port, next.outstanding(), capacity);
                return port;
            }
        }
    }

    /** Return a port to the pool. Releasing a port twice is a caller bug and is not detected. */
    public void releasePort(int port) {
        while (true) {
            PoolState current = state.get();
            List<Integer> released = new ArrayList<>(current.released());
            released.add(port);
            PoolState next = new PoolState(current.nextOffset(), List.copyOf(released),
                    Math.max(0, current.outstanding() - 1));
            if (state.compareAndSet(current, next)) {
                log.debug("Released port {} ({}/{} in use)", port, next.outstanding(), capacity);
                return;
            }
        }
    }

    public int outstanding() { return state.get().outstanding(); }

    public int capacity()    { return capacity; }

    /** Number of distinct ports ever minted; never exceeds {@link #capacity()}. */
    int mintedCount()        { return state.get().nextOffset(); }
}
