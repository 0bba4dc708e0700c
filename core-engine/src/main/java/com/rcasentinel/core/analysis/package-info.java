/**
 * Root-cause analysis: ranks anomalous services by local anomaly density,
 * graph criticality and temporally correlated symptoms propagated from
 * downstream services, and reports the downstream impact of each candidate.
 */
package com.rcasentinel.core.analysis;
