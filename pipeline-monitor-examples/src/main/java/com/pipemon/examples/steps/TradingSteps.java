package com.pipemon.examples.steps;

import java.util.concurrent.ThreadLocalRandom;

/** Simulated trading work with random latency and the occasional broker rejection. */
public final class TradingSteps {
    private TradingSteps() {}

    public static String generateSignal(String symbol) throws InterruptedException {
        sleepBetween(10, 70);
        return ThreadLocalRandom.current().nextBoolean() ? "BUY " + symbol : "SELL " + symbol;
    }

    public static String executeOrder(String signal) throws InterruptedException {
        sleepBetween(5, 30);
        if (ThreadLocalRandom.current().nextInt(10) == 0) {
            throw new IllegalStateException("broker rejected order: " + signal);
        }
        return "FILLED " + signal;
    }

    public static int processBatch(int size) throws InterruptedException {
        sleepBetween(1, 5);
        return size;
    }

    private static void sleepBetween(int minMillis, int maxMillis) throws InterruptedException {
        Thread.sleep(ThreadLocalRandom.current().nextInt(minMillis, maxMillis + 1));
    }
}
