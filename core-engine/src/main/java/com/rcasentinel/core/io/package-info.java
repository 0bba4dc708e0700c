/**
 * JSON codec: lenient snapshot parsing and the shared Jackson configuration
 * used to write analysis reports.
 *
 * @since 1.0.0
 */
package com.rcasentinel.core.io;
