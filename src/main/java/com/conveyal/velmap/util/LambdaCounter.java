package com.conveyal.velmap.util;

import org.slf4j.Logger;

/**
 * Allows counting iterations and logging inside lambda expressions and tasks running on several worker threads at
 * once. Java does not allow you to modify a primitive in a lambda expression, but you can modify a primitive via a
 * constant reference to an object containing it. An instance that is "effectively final" can still have its
 * increment method called from a lambda.
 *
 * The pipeline uses this to report progress through long per-pixel loops, e.g. rows of the decomposition grid.
 */
public class LambdaCounter {

    private final Logger logger;

    private int count = 0;

    private final int total;

    private final int logFrequency;

    private String message;

    /**
     * Create a counter that will log the number of iterations out of a specified total.
     * It expects a message string with two {} placeholders. The first is the count and the second is the total.
     */
    public LambdaCounter (Logger logger, int total, int logFrequency, String message) {
        this.logger = logger;
        this.total = total;
        this.logFrequency = Math.max(1, logFrequency);
        this.message = message;
    }

    public synchronized void increment () {
        count += 1;
        if (count % logFrequency == 0) {
            log();
        }
    }

    private void log () {
        logger.info(message, count, total);
    }

    public synchronized void done () {
        message = "Done. " + message;
        log();
    }

}
