package com.pipemon.core;

@FunctionalInterface
public interface ThrowingRunnable {
    void run() throws Exception;
}
