package com.nrqlbridge.reference.demodata;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component("demoNrqlProperties")
@ConfigurationProperties(prefix = "demo-data.nrql")
public class DemoNrqlProperties {

    private boolean enabled;
    private Long seed;
    private List<String> facetValues = List.of("checkout", "search", "login");
    private int sampleRows = 20;
    private int timeseriesBuckets = 12;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public List<String> getFacetValues() {
        return facetValues;
    }

    public void setFacetValues(List<String> facetValues) {
        this.facetValues = facetValues == null || facetValues.isEmpty() ? List.of("unknown") : List.copyOf(facetValues);
    }

    public int getSampleRows() {
        return sampleRows;
    }

    public void setSampleRows(int sampleRows) {
        this.sampleRows = Math.max(1, sampleRows);
    }

    public int getTimeseriesBuckets() {
        return timeseriesBuckets;
    }

    public void setTimeseriesBuckets(int timeseriesBuckets) {
        this.timeseriesBuckets = Math.max(1, timeseriesBuckets);
    }
}
