package com.pricetrack.config;

import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TrackerPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        TrackerProperties properties = new TrackerProperties();
        properties.getExtraction().setUserAgent("   ");
        assertTrue(properties.getExtraction().getUserAgent().startsWith("price-job-tracker/0.1"));
    }

    @Test
    void retrySettingsAreClamped() {
        TrackerProperties properties = new TrackerProperties();
        properties.getRetry().setMaxAttempts(0);
        properties.getRetry().setInitialDelayMs(-5);
        properties.getRetry().setBackoffFactor(0.1);
        assertEquals(1, properties.getRetry().getMaxAttempts());
        assertEquals(0L, properties.getRetry().getInitialDelayMs());
        assertEquals(1.0, properties.getRetry().getBackoffFactor());
    }

    @Test
    void workerAndJobSettingsAreClamped() {
        TrackerProperties properties = new TrackerProperties();
        properties.getWorkers().setWorkerCount(0);
        properties.getWorkers().setPollIntervalMs(1);
        properties.getQueue().setLeaseSeconds(0);
        properties.getJobs().setDefaultListLimit(-1);
        assertEquals(1, properties.getWorkers().getWorkerCount());
        assertEquals(50, properties.getWorkers().getPollIntervalMs());
        assertEquals(1L, properties.getQueue().getLeaseSeconds());
        assertEquals(1, properties.getJobs().getDefaultListLimit());
    }

    @Test
    void zoneDefaultsToAtlanticTime() {
        TrackerProperties properties = new TrackerProperties();
        properties.setZoneId(" ");
        assertEquals(ZoneId.of("America/Halifax"), properties.zone());
    }
}
