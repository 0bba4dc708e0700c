/**
 * The batch pipeline and the collaborator seams around it.
 *
 * <p>
 * {@link com.rcasentinel.core.pipeline.SnapshotSource},
 * {@link com.rcasentinel.core.pipeline.NarrativeAnnotator} and
 * {@link com.rcasentinel.core.pipeline.ResultSink} are implemented outside
 * the core; {@link com.rcasentinel.core.pipeline.RcaPipeline} works with
 * them absent or failing.
 * </p>
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.pipeline;
