/**
 * Spring configuration: bound read limits and default collaborator beans.
 *
 * @since 1.0
 */
package com.phillippitts.tagprobe.config;
