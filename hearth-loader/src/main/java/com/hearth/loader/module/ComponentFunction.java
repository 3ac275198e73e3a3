package com.hearth.loader.module;

@FunctionalInterface
public interface ComponentFunction {
    Object apply(Object... args);
}
