package com.e2eq.hierarchy.core;

/**
 * Outcome of one enrichment merge.
 *
 * @param bundlesSupplied number of bundles handed to the merger
 * @param bundlesWithData bundles carrying at least one non-empty attribute
 * @param nodesEnriched   node occurrences that received at least one attribute
 */
public record EnrichmentReport(int bundlesSupplied, int bundlesWithData, int nodesEnriched) {}
