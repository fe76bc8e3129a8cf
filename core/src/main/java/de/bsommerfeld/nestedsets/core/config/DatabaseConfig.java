package de.bsommerfeld.nestedsets.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.nestedsets.core.util.StorageUtils;

public class DatabaseConfig {

    @JsonProperty("url")
    private String url = "jdbc:sqlite:"
            + StorageUtils.getDatabaseFile().toAbsolutePath();

    @JsonProperty("busy-timeout-millis")
    private int busyTimeoutMillis = 5000;

    @JsonProperty("wal")
    private boolean wal = true;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    public boolean isWal() {
        return wal;
    }

    public void setWal(boolean wal) {
        this.wal = wal;
    }
}
