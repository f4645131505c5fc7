/**
 * Service layer: identification followed by routing to one container reader.
 */
package com.phillippitts.tagprobe.service;
