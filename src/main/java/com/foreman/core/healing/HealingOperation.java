package com.foreman.core.healing;

/**
 * A repair routine for a failing task. Returns {@code true} when the repair worked.
 */
@FunctionalInterface
public interface HealingOperation {

    boolean heal() throws Exception;
}
