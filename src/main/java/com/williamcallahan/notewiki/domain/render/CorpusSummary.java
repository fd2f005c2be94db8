package com.williamcallahan.notewiki.domain.render;

import java.util.Map;
import java.util.Set;

/**
 * Describes the current corpus index for inspection over HTTP.
 *
 * @param version index build number
 * @param noteCount number of titled notes
 * @param titles note identifier to display title
 * @param backlinks note identifier to the notes linking to it
 */
public record CorpusSummary(long version, int noteCount, Map<String, String> titles,
                            Map<String, Set<String>> backlinks) {

    public static CorpusSummary of(CorpusIndex index) {
        return new CorpusSummary(index.version(), index.titles().size(), index.titles(), index.backlinks());
    }
}
