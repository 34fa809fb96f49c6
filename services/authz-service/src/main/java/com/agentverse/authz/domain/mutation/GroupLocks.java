package com.agentverse.authz.domain.mutation;

import com.agentverse.authz.domain.error.UnavailableException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-group mutation locks.
 *
 * <p>Every read-check-write on a group's memberships or links runs while holding that group's
 * lock, so two concurrent demotions cannot both see "another admin remains". Acquisition is
 * bounded by a timeout; a caller that cannot get the lock fails with {@link
 * UnavailableException} instead of waiting indefinitely.
 *
 * <p>Locks are striped: a group id hashes to one of a fixed set of fair locks, so memory does
 * not grow with the number of group ids ever seen. Two groups may share a stripe, which only
 * serializes them. Stripes for several groups are always taken in ascending stripe order.
 */
public class GroupLocks {

    static final int DEFAULT_STRIPES = 1024;

    private final ReentrantLock[] stripes;
    private final Duration timeout;

    public GroupLocks(Duration timeout) {
        this(timeout, DEFAULT_STRIPES);
    }

    public GroupLocks(Duration timeout, int stripeCount) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        if (stripeCount <= 0) {
            throw new IllegalArgumentException("stripeCount must be positive");
        }
        this.timeout = timeout;
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    /** Handle that releases every lock it holds on close. */
    public interface Held extends AutoCloseable {
        @Override
        void close();
    }

    /** Acquires the lock of one group. */
    public Held lock(String groupId) {
        if (groupId == null || groupId.isBlank()) {
            throw new IllegalArgumentException("groupId must not be blank");
        }
        return lockAll(List.of(groupId));
    }

    /** Acquires the locks of all groups, in stripe order. Groups sharing a stripe lock it once. */
    public Held lockAll(Collection<String> groupIds) {
        TreeMap<Integer, String> byStripe = new TreeMap<>();
        for (String groupId : groupIds) {
            byStripe.putIfAbsent(stripeOf(groupId), groupId);
        }
        List<ReentrantLock> acquired = new ArrayList<>();
        try {
            for (var entry : byStripe.entrySet()) {
                ReentrantLock lock = stripes[entry.getKey()];
                if (!lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new UnavailableException(
                            "Timed out waiting for mutation lock of group " + entry.getValue());
                }
                acquired.add(lock);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            releaseAll(acquired);
            throw new UnavailableException("Interrupted waiting for mutation lock", e);
        } catch (RuntimeException e) {
            releaseAll(acquired);
            throw e;
        }
        return () -> releaseAll(acquired);
    }

    /** Number of underlying locks; fixed for the lifetime of this instance. */
    public int stripeCount() {
        return stripes.length;
    }

    int stripeOf(String groupId) {
        int h = groupId.hashCode();
        return Math.floorMod(h ^ (h >>> 16), stripes.length);
    }

    private static void releaseAll(List<ReentrantLock> acquired) {
        for (int i = acquired.size() - 1; i >= 0; i--) {
            acquired.get(i).unlock();
        }
        acquired.clear();
    }
}
