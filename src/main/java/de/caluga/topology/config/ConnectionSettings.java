package de.caluga.topology.config;

import java.util.ArrayList;
import java.util.List;

public class ConnectionSettings extends Settings {
    private int minPoolSize = 0;
    private int maxPoolSize = 100;
    private int connectionTimeout = 20000;
    //0 - no timeout
    private int readTimeout = 0;
    //max time to wait for a pooled connection
    private int maxWaitTime = 2000;
    private boolean retryReads = true;
    private boolean retryWrites = true;
    private List<String> compressors = new ArrayList<>();
    private String appName;

    public int getMinPoolSize() {
        return minPoolSize;
    }

    public ConnectionSettings setMinPoolSize(int minPoolSize) {
        this.minPoolSize = minPoolSize;
        return this;
    }

    public int getMaxPoolSize() {
        return maxPoolSize;
    }

    public ConnectionSettings setMaxPoolSize(int maxPoolSize) {
        this.maxPoolSize = maxPoolSize;
        return this;
    }

    public int getConnectionTimeout() {
        return connectionTimeout;
    }

    public ConnectionSettings setConnectionTimeout(int connectionTimeout) {
        this.connectionTimeout = connectionTimeout;
        return this;
    }

    public int getReadTimeout() {
        return readTimeout;
    }

    public ConnectionSettings setReadTimeout(int readTimeout) {
        this.readTimeout = readTimeout;
        return this;
    }

    public int getMaxWaitTime() {
        return maxWaitTime;
    }

    public ConnectionSettings setMaxWaitTime(int maxWaitTime) {
        this.maxWaitTime = maxWaitTime;
        return this;
    }

    public boolean isRetryReads() {
        return retryReads;
    }

    public ConnectionSettings setRetryReads(boolean retryReads) {
        this.retryReads = retryReads;
        return this;
    }

    public boolean isRetryWrites() {
        return retryWrites;
    }

    public ConnectionSettings setRetryWrites(boolean retryWrites) {
        this.retryWrites = retryWrites;
        return this;
    }

    public List<String> getCompressors() {
        if (compressors == null) {
            compressors = new ArrayList<>();
        }

        return compressors;
    }

    /**
     * compressors in order of preference, supported are <code>snappy</code> and <code>zlib</code>
     */
    public ConnectionSettings setCompressors(List<String> compressors) {
        this.compressors = compressors;
        return this;
    }

    public String getAppName() {
        return appName;
    }

    public ConnectionSettings setAppName(String appName) {
        this.appName = appName;
        return this;
    }
}
