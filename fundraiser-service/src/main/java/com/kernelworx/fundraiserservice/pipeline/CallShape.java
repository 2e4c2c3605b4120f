package com.kernelworx.fundraiserservice.pipeline;

/**
 * How an operation reports an authorization denial: queries answer with an
 * empty result, mutations fail with Forbidden.
 */
public enum CallShape {
    QUERY,
    MUTATION
}
