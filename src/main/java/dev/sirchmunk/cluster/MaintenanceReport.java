package dev.sirchmunk.cluster;

/**
 * Outcome of one maintenance cycle.
 *
 * @param cooled clusters whose hotness decayed
 * @param verified clusters whose sources were scanned
 * @param deprecated clusters retired because every source was missing or changed
 */
public record MaintenanceReport(int cooled, int verified, int deprecated) {}
