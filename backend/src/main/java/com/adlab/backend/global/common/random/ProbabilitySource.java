package com.adlab.backend.global.common.random;

/**
 * Source of uniformly distributed values in {@code [0, 1)}.
 */
@FunctionalInterface
public interface ProbabilitySource {

    double nextDouble();
}
