package com.phillippitts.tagprobe.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the unmodifiable raw maps exposed by {@link Metadata#raw()}.
 */
final class RawMaps {

    private RawMaps() {
    }

    /**
     * Merges decoded tag keys with technical container fields. Technical keys win on collision.
     */
    static Map<String, Object> merge(Map<String, Object> tagRaw, Object... technicalPairs) {
        if (technicalPairs.length % 2 != 0) {
            throw new IllegalArgumentException("technicalPairs must hold key/value pairs");
        }
        Map<String, Object> out = new LinkedHashMap<>(tagRaw);
        for (int i = 0; i < technicalPairs.length; i += 2) {
            out.put((String) technicalPairs[i], technicalPairs[i + 1]);
        }
        return Collections.unmodifiableMap(out);
    }
}
