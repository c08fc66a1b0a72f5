package com.hookshape.reshape;

/** Text extraction for CRM lead notes. */
final class LeadNotes {

    private static final String ORIGINAL_MESSAGE = "Original Message:";
    private static final String LEAD_EVENT = "Lead Event:";

    private LeadNotes() {}

    /** The text after "Original Message:" when present, otherwise the whole note. */
    static String body(String note) {
        if (note == null) {
            return null;
        }
        int index = note.indexOf(ORIGINAL_MESSAGE);
        String extracted = index < 0 ? note : note.substring(index + ORIGINAL_MESSAGE.length());
        extracted = extracted.trim();
        return extracted.isEmpty() ? null : extracted;
    }

    /** The rest of the "Lead Event:" line (exact case), or null. */
    static String eventName(String note) {
        if (note == null) {
            return null;
        }
        int index = note.indexOf(LEAD_EVENT);
        if (index < 0) {
            return null;
        }
        String rest = note.substring(index + LEAD_EVENT.length());
        int endOfLine = indexOfLineBreak(rest);
        String name = (endOfLine < 0 ? rest : rest.substring(0, endOfLine)).trim();
        return name.isEmpty() ? null : name;
    }

    private static int indexOfLineBreak(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                return i;
            }
        }
        return -1;
    }
}
