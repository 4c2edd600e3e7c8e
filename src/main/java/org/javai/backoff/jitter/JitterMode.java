package org.javai.backoff.jitter;

/**
 * How a {@link JitterFunction} turns a raw wait into the wait actually slept.
 */
public enum JitterMode {

    /**
     * The function maps the raw wait to the jittered wait.
     */
    TRANSFORM,

    /**
     * The function ignores the raw wait and returns an offset that is added to it.
     *
     * @deprecated kept for callers written against the zero-argument jitter contract;
     * use {@link #TRANSFORM}
     */
    @Deprecated
    DELTA
}
