package com.spreadsheet.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Limits applied by the formula engine, bound from "formula.*" properties.
 */
@ConfigurationProperties(prefix = "formula")
public class EngineProperties {

    /**
     * Largest number of cells a single range reference may expand to.
     */
    private long maxRangeCells = 10_000;

    /**
     * Deepest chain of nested formula evaluations one top-level call may make.
     */
    private int maxDepth = 256;

    /**
     * Deepest nesting of calls and parentheses one top-level call may make,
     * counted across every formula it reaches.
     */
    private int maxNesting = 512;

    public long getMaxRangeCells() {
        return maxRangeCells;
    }

    public void setMaxRangeCells(long maxRangeCells) {
        this.maxRangeCells = maxRangeCells;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public int getMaxNesting() {
        return maxNesting;
    }

    public void setMaxNesting(int maxNesting) {
        this.maxNesting = maxNesting;
    }
}
