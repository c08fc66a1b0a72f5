package com.hookshape.classifier;

import com.hookshape.core.PayloadPaths;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.model.RejectionReason;
import com.hookshape.model.ShowroomVisitTag;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.hookshape.core.EmptinessNormalizer.hasValue;

/**
 * Classifies a "showroom_visit" delivery by which sub-object it carries:
 * new_visit, then exit_note, then delete. The classified payload is that sub-object.
 */
@Component
public class ShowroomVisitClassifier {

    public static final String SHOWROOM_VISIT = "showroom_visit";

    static final Set<String> VISIT_TYPES = Set.of(
            "BeBack", "InternetApptShow", "PhoneApptShow", "RepeatCustomer",
            "FreshWalkIn", "OutsideProspect", "Referral", "ServiceCustomer");

    @Getter
    private final ClassificationCascade<Map<String, Object>, ShowroomVisitTag> cascade = new ClassificationCascade<>(List.of(
            ClassificationRule.of("new visit", v -> hasValue(v.get("new_visit")), ShowroomVisitTag.NEW_VISIT),
            ClassificationRule.of("exit note", v -> hasValue(v.get("exit_note")), ShowroomVisitTag.EXIT_NOTE),
            ClassificationRule.of("delete", v -> hasValue(v.get("delete")), ShowroomVisitTag.DELETE)
    ));

    public ClassifiedEvent classify(Map<String, Object> body) {
        Map<String, Object> visit = PayloadPaths.object(body, SHOWROOM_VISIT);
        if (visit == null) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    "missing required showroom_visit object");
        }
        ShowroomVisitTag tag = cascade.classify(visit)
                .orElseThrow(() -> new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                        "showroom_visit must contain new_visit, exit_note, or delete"));

        Map<String, Object> detail = PayloadPaths.object(visit, tag.wireValue());
        if (detail == null) {
            throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_SHAPE,
                    tag.wireValue() + " is not an object");
        }
        switch (tag) {
            case NEW_VISIT -> {
                require(detail, "id", "new_visit.id");
                require(detail, "date", "new_visit.date");
                require(detail, "type", "new_visit.type");
                String type = PayloadPaths.string(detail, "type");
                if (!VISIT_TYPES.contains(type)) {
                    throw new DeliveryRejectedException(RejectionReason.UNRECOGNIZED_ENUM_VALUE,
                            "invalid visit type: \"" + type + "\"");
                }
            }
            case EXIT_NOTE -> {
                require(detail, "showroom_visit_id", "exit_note.showroom_visit_id");
                require(detail, "id", "exit_note.id");
            }
            case DELETE -> require(detail, "id", "delete.id");
        }
        return ClassifiedEvent.of(tag, detail);
    }

    private static void require(Map<String, Object> detail, String field, String label) {
        if (PayloadPaths.resolve(detail, field) == null) {
            throw new DeliveryRejectedException(RejectionReason.MISSING_REQUIRED_FIELD, "missing " + label);
        }
    }
}
