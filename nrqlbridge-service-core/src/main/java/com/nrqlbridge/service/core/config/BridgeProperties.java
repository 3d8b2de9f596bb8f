package com.nrqlbridge.service.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "nrqlbridge")
public class BridgeProperties {

    private final Connection connection = new Connection();
    private final RateLimit rateLimit = new RateLimit();
    private final Metrics metrics = new Metrics();

    public Connection getConnection() {
        return connection;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Connection {
        private String apiKey = "";
        private long accountId;

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public long getAccountId() {
            return accountId;
        }

        public void setAccountId(long accountId) {
            this.accountId = accountId;
        }
    }

    public static class RateLimit {
        private boolean enabled = true;
        /** Sustained queries per second. */
        private double rate = 10.0d;
        /** Burst size; the bucket starts full. */
        private int capacity = 20;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public double getRate() {
            return rate;
        }

        public void setRate(double rate) {
            this.rate = rate;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class Metrics {
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }
}
