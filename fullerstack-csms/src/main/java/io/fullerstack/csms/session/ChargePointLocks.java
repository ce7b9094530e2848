package io.fullerstack.csms.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One exclusive section per charge point id.
 * <p>
 * Operations on the same charge point run one at a time, in the order their threads reached
 * the lock (fair locks); operations on different charge points never contend.
 * </p>
 */
public class ChargePointLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String chargePointId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(chargePointId, id -> new ReentrantLock(true));
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String chargePointId, Runnable action) {
        withLock(chargePointId, () -> {
            action.run();
            return null;
        });
    }
}
