package com.hookshape.classifier;

import com.hookshape.model.CallDisposition;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Reads a call outcome out of the free-text note an agent left on a phone call.
 *
 * RULE ORDER (first match wins):
 *   no note / "no note added"                    → no_note
 *   couldn't leave a vm, no vm, vm not set up ... → no_answer
 *   lvm, vm, left message, voicemail, "lm"       → voicemail
 *   no answer, "na"                              → no_answer
 *   hung up / hang up                            → hung_up
 *   not interested                               → not_interested
 *   disconnected / dropped                       → disconnected
 *   wrong / invalid / bad number                 → wrong_number
 *   busy                                         → busy
 *   otherwise                                    → unknown
 *
 * The failed-voicemail phrases contain "vm" themselves, so they must be tested
 * before the voicemail rule. Notes are lower-cased and curly apostrophes folded.
 */
@Component
public class CallDispositionClassifier {

    private static final Pattern FAILED_VOICEMAIL = Pattern.compile(
            "no vm|vm not set ?up|mb not set ?up|(?:'t|not) leave (?:a )?(?:message|msg|voicemail|vm)");
    private static final Pattern STANDALONE_LM = Pattern.compile("(?:^|[^a-z])lm(?:[^a-z]|$)");
    private static final Pattern STANDALONE_NA = Pattern.compile("(?:^|[^a-z])na(?:[^a-z]|$)");

    @Getter
    private final ClassificationCascade<String, CallDisposition> cascade = new ClassificationCascade<>(List.of(
            ClassificationRule.of("no note", note -> note.isEmpty() || note.equals("no note added"),
                    CallDisposition.NO_NOTE),
            ClassificationRule.of("voicemail not left", FAILED_VOICEMAIL.asPredicate(),
                    CallDisposition.NO_ANSWER),
            ClassificationRule.of("voicemail left",
                    containsAny("lvm", "vm", "left message", "left msg", "left mssg", "voicemail", "voice mail"),
                    CallDisposition.VOICEMAIL),
            ClassificationRule.of("lm", STANDALONE_LM.asPredicate(), CallDisposition.VOICEMAIL),
            ClassificationRule.of("no answer", containsAny("no answer"), CallDisposition.NO_ANSWER),
            ClassificationRule.of("na", STANDALONE_NA.asPredicate(), CallDisposition.NO_ANSWER),
            ClassificationRule.of("hung up", containsAny("hung up", "hang up", "hangup", "hungup"),
                    CallDisposition.HUNG_UP),
            ClassificationRule.of("not interested", containsAny("not interested"), CallDisposition.NOT_INTERESTED),
            ClassificationRule.of("disconnected", containsAny("disconnected", "dropped"),
                    CallDisposition.DISCONNECTED),
            ClassificationRule.of("wrong number",
                    containsAny("wrong number", "wrong phone", "invalid phone", "invalid number", "bad number"),
                    CallDisposition.WRONG_NUMBER),
            ClassificationRule.of("busy", containsAny("busy"), CallDisposition.BUSY)
    ));

    public CallDisposition classify(String note) {
        return cascade.classify(fold(note)).orElse(CallDisposition.UNKNOWN);
    }

    static String fold(String note) {
        if (note == null) {
            return "";
        }
        return note.trim()
                .toLowerCase(Locale.ROOT)
                .replace('’', '\'')
                .replace('‘', '\'');
    }

    private static Predicate<String> containsAny(String... phrases) {
        return note -> {
            for (String phrase : phrases) {
                if (note.contains(phrase)) {
                    return true;
                }
            }
            return false;
        };
    }
}
