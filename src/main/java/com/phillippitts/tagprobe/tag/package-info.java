/**
 * Collaborator seam for semantic tag decoding.
 *
 * <p>Container readers never interpret tag frames themselves; they hand bounded regions to a
 * {@link com.phillippitts.tagprobe.tag.TagDecoders} bean. Applications plug in real decoders by
 * declaring their own bean, which replaces {@link com.phillippitts.tagprobe.tag.TechnicalOnlyTagDecoders}.
 */
package com.phillippitts.tagprobe.tag;
