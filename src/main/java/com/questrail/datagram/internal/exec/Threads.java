package com.questrail.datagram.internal.exec;

import java.util.concurrent.TimeUnit;

/**
 * Join helpers for shutdown paths that must finish even when the calling
 * thread is interrupted.
 */
final class Threads {

    private Threads() {}

    /**
     * Join {@code thread} for at most {@code timeoutNanos}, retrying across
     * interrupts. The caller's interrupt status is restored before returning.
     *
     * @return {@code true} if the thread has terminated
     */
    static boolean joinUninterruptibly(Thread thread, long timeoutNanos) {
        boolean interrupted = false;
        long deadline = System.nanoTime() + Math.max(0, timeoutNanos);
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return !thread.isAlive();
                }
                try {
                    TimeUnit.NANOSECONDS.timedJoin(thread, remaining);
                    return !thread.isAlive();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
