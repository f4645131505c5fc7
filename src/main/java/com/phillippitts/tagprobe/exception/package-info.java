/**
 * Exception hierarchy for container parsing.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.tagprobe.exception.TagProbeException} - Base exception</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.StreamReadException} - Short read, end of stream
 *       or seek failure</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.FormatMismatchException} - Expected magic or
 *       marker absent</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.UnsupportedVersionException} and
 *       {@link com.phillippitts.tagprobe.exception.UnsupportedFormatException} - Recognised but
 *       unhandled variants</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.ChecksumMismatchException} - OGG page CRC
 *       failure</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.OrphanedContinuationException} - OGG continued
 *       page without a pending packet</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.NoTagsFoundException} - No tag region found</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.ContainerIdentificationException} - Inner
 *       failure with a best-guess container type</li>
 *   <li>{@link com.phillippitts.tagprobe.exception.TagDecodingException} - Raised by tag
 *       decoders</li>
 * </ul>
 *
 * <p>Out-of-range bit or length arguments are reported with {@link IllegalArgumentException}.
 * The first error aborts the whole parse; no partial results are returned.
 *
 * @since 1.0
 */
package com.phillippitts.tagprobe.exception;
