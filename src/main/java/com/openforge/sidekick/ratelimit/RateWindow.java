package com.openforge.sidekick.ratelimit;

import java.util.ArrayDeque;

/**
 * Exact sliding-window log for one client: the admission timestamps
 * (epoch millis) still inside the window, oldest first.
 *
 * All access goes through the instance monitor, so prune + check + append
 * is atomic per client while different clients never contend.
 */
final class RateWindow {

    private final ArrayDeque<Long> events = new ArrayDeque<>();

    synchronized boolean tryAdmit(long nowMillis, long windowMillis, int maxRequests) {
        prune(nowMillis, windowMillis);
        if (events.size() >= maxRequests) {
            return false;
        }
        events.addLast(nowMillis);
        return true;
    }

    /** Count of admissions still inside the window at {@code nowMillis}; does not mutate. */
    synchronized int countWithin(long nowMillis, long windowMillis) {
        long cutoff = nowMillis - windowMillis;
        int count = 0;
        for (long t : events) {
            if (t > cutoff) count++;
        }
        return count;
    }

    private void prune(long nowMillis, long windowMillis) {
        long cutoff = nowMillis - windowMillis;
        while (!events.isEmpty() && events.peekFirst() <= cutoff) {
            events.removeFirst();
        }
    }
}
