/**
 * Flink streaming job: consumes service snapshots from Kafka, runs the
 * detection and root-cause pipeline per snapshot and publishes the reports.
 *
 * <p>
 * Also hosts the job-level collaborators: environment configuration, Kafka
 * schemas, Flink metrics, the health endpoint and the HTTP narrative
 * annotator.
 * </p>
 */
package com.rcasentinel.flink;
