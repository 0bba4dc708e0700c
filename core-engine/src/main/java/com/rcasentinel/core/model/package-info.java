/**
 * Immutable domain types: the input snapshot (topology, metric series,
 * traces), detector anomalies, root-cause candidates and the reports built
 * from them.
 *
 * <p>
 * Output types carry explicit snake_case Jackson property names so that
 * serialised reports keep a stable wire format.
 * </p>
 */
package com.rcasentinel.core.model;
