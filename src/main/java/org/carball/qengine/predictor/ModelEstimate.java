package org.carball.qengine.predictor;

/**
 * Raw output of a single duration model. Duration in milliseconds, memory in megabytes,
 * network traffic in kilobytes.
 */
public record ModelEstimate(double duration, double memoryUsage, double cpuUsage,
                            double ioOperations, double networkTraffic) {
}
