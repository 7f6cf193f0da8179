package io.feydor.inspo.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.feydor.inspo.midi.FeatureRecord;

import java.util.Map;
import java.util.TreeMap;

/**
 * Renders a {@link FeatureRecord} as JSON. Keys are sorted, integers have no decimal point and the density is always
 * written as a decimal, so the same record always renders to the same text.
 */
public class JsonFeatures {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    private JsonFeatures() {}

    public static String toJson(FeatureRecord features) {
        return GSON.toJson(toSortedMap(features));
    }

    /** The record keyed by its snake_case field names, in lexicographic key order */
    public static Map<String, Object> toSortedMap(FeatureRecord features) {
        var map = new TreeMap<String, Object>();
        map.put("density", features.density());
        map.put("distinct_status_bytes", features.distinctStatusBytes());
        map.put("division", features.division());
        map.put("file_size", features.fileSize());
        map.put("format_type", features.formatType());
        map.put("note_on_events", features.noteOnEvents());
        map.put("track_consistency", features.trackConsistency());
        map.put("track_lengths", features.trackLengths());
        map.put("tracks_declared", features.tracksDeclared());
        map.put("tracks_observed", features.tracksObserved());
        return map;
    }
}
