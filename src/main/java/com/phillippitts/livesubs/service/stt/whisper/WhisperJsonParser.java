package com.phillippitts.livesubs.service.stt.whisper;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts segment texts from whisper JSON output.
 *
 * <p>Understands both the whisper.cpp layout ({@code {"transcription":[{"text":...}]}}) and the
 * openai-whisper layout ({@code {"segments":[{"text":...}]}}). A top-level {@code text} is used
 * when neither array is present.
 */
final class WhisperJsonParser {

    private WhisperJsonParser() {}

    /**
     * @return non-blank segment texts in order, with whisper's leading whitespace preserved
     * @throws org.json.JSONException if {@code json} is not a JSON object
     */
    static List<String> extractSegments(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JSONObject obj = new JSONObject(json);
        JSONArray segs = obj.optJSONArray("transcription");
        if (segs == null) {
            segs = obj.optJSONArray("segments");
        }
        if (segs == null) {
            String text = obj.optString("text", "");
            return text.isBlank() ? List.of() : List.of(text);
        }
        List<String> out = new ArrayList<>(segs.length());
        for (int i = 0; i < segs.length(); i++) {
            JSONObject seg = segs.optJSONObject(i);
            if (seg == null) {
                continue;
            }
            String text = seg.optString("text", "");
            if (!text.isBlank()) {
                out.add(text);
            }
        }
        return List.copyOf(out);
    }
}
