package com.p14n.eventhub.data;

import java.time.Duration;

public record ConfigData(FanOutMode fanOutMode,
        HubMode hubMode,
        String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        int batchLimit,
        Duration recordTtl,
        Duration restoreTimeout,
        Duration retryBackoff,
        Duration noSubscriberWait,
        Duration noSubscriberPoll,
        Duration wakeWait,
        Duration queueIdleTtl,
        int queueMaxDepth,
        Duration purgeInterval) implements HubConfig {

    public ConfigData(FanOutMode fanOutMode,
                      HubMode hubMode,
                      String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName) {
        this(fanOutMode, hubMode, dbHost, dbPort, dbUser, dbPassword, dbName,
                25,
                Duration.ofHours(4),
                Duration.ofSeconds(30),
                Duration.ofSeconds(5),
                Duration.ofSeconds(60),
                Duration.ofSeconds(5),
                Duration.ofSeconds(60),
                Duration.ofHours(4),
                10_000,
                Duration.ofHours(1));
    }

    // in-memory storage only, no database settings
    public ConfigData(FanOutMode fanOutMode, HubMode hubMode) {
        this(fanOutMode, hubMode, null, 0, null, null, null);
    }

    public ConfigData withTimings(Duration retryBackoff,
                                  Duration noSubscriberWait,
                                  Duration noSubscriberPoll,
                                  Duration wakeWait,
                                  Duration restoreTimeout) {
        return new ConfigData(fanOutMode, hubMode, dbHost, dbPort, dbUser, dbPassword, dbName,
                batchLimit, recordTtl, restoreTimeout, retryBackoff, noSubscriberWait, noSubscriberPoll,
                wakeWait, queueIdleTtl, queueMaxDepth, purgeInterval);
    }

    public ConfigData withQueuePolicy(Duration queueIdleTtl, int queueMaxDepth) {
        return new ConfigData(fanOutMode, hubMode, dbHost, dbPort, dbUser, dbPassword, dbName,
                batchLimit, recordTtl, restoreTimeout, retryBackoff, noSubscriberWait, noSubscriberPoll,
                wakeWait, queueIdleTtl, queueMaxDepth, purgeInterval);
    }

    public ConfigData withFanOutMode(FanOutMode mode) {
        return new ConfigData(mode, hubMode, dbHost, dbPort, dbUser, dbPassword, dbName,
                batchLimit, recordTtl, restoreTimeout, retryBackoff, noSubscriberWait, noSubscriberPoll,
                wakeWait, queueIdleTtl, queueMaxDepth, purgeInterval);
    }

    public ConfigData withPurgeInterval(Duration interval) {
        return new ConfigData(fanOutMode, hubMode, dbHost, dbPort, dbUser, dbPassword, dbName,
                batchLimit, recordTtl, restoreTimeout, retryBackoff, noSubscriberWait, noSubscriberPoll,
                wakeWait, queueIdleTtl, queueMaxDepth, interval);
    }
}
