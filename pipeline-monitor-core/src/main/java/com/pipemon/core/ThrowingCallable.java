package com.pipemon.core;

@FunctionalInterface
public interface ThrowingCallable<T> {
    T call() throws Exception;
}
