package com.p14n.eventhub.data;

import java.time.Duration;

/**
 * Configuration interface for event hub settings.
 * Every timing and sizing knob has a default, only the storage connection
 * details have to be supplied when the PostgreSQL provider is used.
 */
public interface HubConfig {

    /**
     * Gets how published events fan out to subscribers.
     *
     * @return the fan-out mode
     */
    FanOutMode fanOutMode();

    /**
     * Gets which remote operations are exposed.
     *
     * @return the hub mode
     */
    HubMode hubMode();

    /**
     * Gets the database host address.
     *
     * @return The database host address
     */
    String dbHost();

    /**
     * Gets the database port number.
     *
     * @return The database port number
     */
    int dbPort();

    String dbUser();

    String dbPassword();

    String dbName();

    /**
     * Gets the maximum number of records fetched per storage read.
     *
     * @return the batch limit, 25 by default
     */
    default int batchLimit() {
        return 25;
    }

    /**
     * Gets how long a stored record stays deliverable.
     *
     * @return the record time to live, 4 hours by default
     */
    default Duration recordTtl() {
        return Duration.ofHours(4);
    }

    /**
     * Gets how long startup restoration of subscriber ids may take before the
     * hub refuses to start.
     *
     * @return the restore timeout, 30 seconds by default
     */
    default Duration restoreTimeout() {
        return Duration.ofSeconds(30);
    }

    /**
     * Gets the wait between retries of a failed storage operation.
     *
     * @return the retry backoff, 5 seconds by default
     */
    default Duration retryBackoff() {
        return Duration.ofSeconds(5);
    }

    /**
     * Gets how long a publish waits for any subscriber before dropping the event.
     *
     * @return the no-subscriber wait, 60 seconds by default
     */
    default Duration noSubscriberWait() {
        return Duration.ofSeconds(60);
    }

    default Duration noSubscriberPoll() {
        return Duration.ofSeconds(5);
    }

    /**
     * Gets the longest time an idle streaming loop waits for a wake signal before
     * checking storage again.
     *
     * @return the wake wait, 60 seconds by default
     */
    default Duration wakeWait() {
        return Duration.ofSeconds(60);
    }

    /**
     * Gets the time since the last dequeue after which an in-memory queue is
     * considered abandoned.
     *
     * @return the idle time to live, 4 hours by default
     */
    default Duration queueIdleTtl() {
        return Duration.ofHours(4);
    }

    default int queueMaxDepth() {
        return 10_000;
    }

    default Duration purgeInterval() {
        return Duration.ofHours(1);
    }

    /**
     * Constructs the JDBC URL for database connection.
     *
     * @return The complete JDBC URL string
     */
    default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }
}
