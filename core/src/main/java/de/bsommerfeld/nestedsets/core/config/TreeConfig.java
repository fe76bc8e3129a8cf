package de.bsommerfeld.nestedsets.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.nestedsets.core.boundary.BoundaryAllocator;

public class TreeConfig {

    @JsonProperty("max-boundary")
    private long maxBoundary = BoundaryAllocator.DEFAULT_CEILING;

    @JsonProperty("create-table")
    private boolean createTable = true;

    public long getMaxBoundary() {
        return maxBoundary;
    }

    public void setMaxBoundary(long maxBoundary) {
        this.maxBoundary = maxBoundary;
    }

    public boolean isCreateTable() {
        return createTable;
    }

    public void setCreateTable(boolean createTable) {
        this.createTable = createTable;
    }
}
