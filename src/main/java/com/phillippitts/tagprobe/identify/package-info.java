/**
 * Container and tag format sniffing.
 */
package com.phillippitts.tagprobe.identify;
