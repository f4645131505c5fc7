/**
 * MPEG audio: ID3v2 header parsing and constant-bitrate duration estimation from the first
 * frame header.
 */
package com.phillippitts.tagprobe.mpeg;
