/**
 * Immutable result types: classification, decoded tag values and the per-container
 * {@link com.phillippitts.tagprobe.domain.Metadata} variants.
 */
package com.phillippitts.tagprobe.domain;
