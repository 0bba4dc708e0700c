/**
 * Service call graph built from snapshot topology, with the adjacency and
 * bounded traversal queries used by root-cause analysis.
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.graph;
