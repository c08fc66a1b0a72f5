package com.hookshape.classifier;

import com.hookshape.model.ConsentAction;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Detects SMS consent intent.
 *
 * The dealer's opt-in request template is recognized in either direction. Every
 * other action only applies to inbound messages:
 *   help                                   → help
 *   stop / unsubscribe / stop all          → opt_out
 *   "do not text me", "stop texting me" ...→ opt_out_possible
 *   y / agree                              → opt_in_possible
 *   yes                                    → opt_in_reply_possible
 */
@Component
public class ConsentActionClassifier {

    static final String OPT_IN_REQUEST_TEMPLATE =
            "requests permission to send you texts. Reply YES to allow. Reply STOP to end. HELP for help. Msg&data rates may apply.";

    private static final Set<String> OPT_OUT = Set.of("stop", "unsubscribe", "stop all");
    private static final List<String> POSSIBLE_OPT_OUT =
            List.of("do not text me", "stop texting me", "stop!", "dont text me", "don't text");

    private final ClassificationCascade<String, ConsentAction> anyDirection = new ClassificationCascade<>(List.of(
            ClassificationRule.of("opt-in request template", body -> body.contains(OPT_IN_REQUEST_TEMPLATE),
                    ConsentAction.OPT_IN_REQUEST)
    ));

    @Getter
    private final ClassificationCascade<String, ConsentAction> inbound = new ClassificationCascade<>(List.of(
            ClassificationRule.of("help", "help"::equals, ConsentAction.HELP),
            ClassificationRule.of("stop keyword", OPT_OUT::contains, ConsentAction.OPT_OUT),
            ClassificationRule.of("stop phrasing", lower -> POSSIBLE_OPT_OUT.stream().anyMatch(lower::contains),
                    ConsentAction.OPT_OUT_POSSIBLE),
            ClassificationRule.of("short agreement", lower -> lower.equals("y") || lower.equals("agree"),
                    ConsentAction.OPT_IN_POSSIBLE),
            ClassificationRule.of("yes", "yes"::equals, ConsentAction.OPT_IN_REPLY_POSSIBLE)
    ));

    /**
     * @param body      raw SMS body
     * @param inboundMessage true when the customer sent the message
     */
    public Optional<ConsentAction> classify(String body, boolean inboundMessage) {
        if (body == null) {
            return Optional.empty();
        }
        Optional<ConsentAction> request = anyDirection.classify(body);
        if (request.isPresent() || !inboundMessage) {
            return request;
        }
        String lower = CallDispositionClassifier.fold(body);
        return inbound.classify(lower);
    }
}
