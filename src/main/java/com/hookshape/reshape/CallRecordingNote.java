package com.hookshape.reshape;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * Parsed form of the telephony system's call-recording note, a block of
 * "Key: value" lines:
 *
 *   DurationSeconds: 95
 *   CallDnaClassification: Voicemail
 *   CallAudioURL: https://...
 *
 * Unknown keys are ignored, a blank value counts as absent.
 */
@Getter
final class CallRecordingNote {

    private final Integer talkTime;
    private final String classification;
    private final String recordingLink;

    private CallRecordingNote(Integer talkTime, String classification, String recordingLink) {
        this.talkTime = talkTime;
        this.classification = classification;
        this.recordingLink = recordingLink;
    }

    static CallRecordingNote parse(String body) {
        Map<String, String> data = new HashMap<>();
        if (body != null) {
            for (String line : body.split("\\r?\\n")) {
                int colon = line.indexOf(':');
                if (colon < 0) {
                    continue;
                }
                String value = line.substring(colon + 1).trim();
                if (!value.isEmpty()) {
                    data.put(line.substring(0, colon).trim(), value);
                }
            }
        }
        return new CallRecordingNote(
                parseSeconds(data.get("DurationSeconds")),
                data.get("CallDnaClassification"),
                data.get("CallAudioURL"));
    }

    private static Integer parseSeconds(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
