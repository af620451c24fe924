package com.vaultrebalancer.rebalance;

/** Blocking wait used for the withdrawal settle delay. Swapped for a recorder in tests. */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis);
}
