package io.fleetward.api.remote;

/**
 * System load averages over one, five and fifteen minutes.
 */
public record LoadAverage(double oneMinute, double fiveMinutes, double fifteenMinutes) {
}
