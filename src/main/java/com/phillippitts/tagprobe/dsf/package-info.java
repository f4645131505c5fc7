/**
 * DSD stream files.
 */
package com.phillippitts.tagprobe.dsf;
