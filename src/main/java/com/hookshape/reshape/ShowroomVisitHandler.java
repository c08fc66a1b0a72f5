package com.hookshape.reshape;

import com.hookshape.classifier.ShowroomVisitClassifier;
import com.hookshape.core.PayloadPaths;
import com.hookshape.core.Timestamps;
import com.hookshape.dto.Aggregate;
import com.hookshape.dto.ClassifiedEvent;
import com.hookshape.dto.DeliveryContext;
import com.hookshape.model.EventCategory;
import com.hookshape.model.ShowroomVisitTag;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Showroom visit deliveries → customer, showroom_visit and customer_last_activity.
 *
 *   new_visit → tier 1, visit date/type/creator/appointment
 *   exit_note → exit details; when the note is dated at least ten minutes before
 *               arrival, the note date is also taken as the visit's date_time
 *   delete    → deleted_at / deleted_by
 */
@Component
@RequiredArgsConstructor
public class ShowroomVisitHandler implements CategoryHandler {

    static final long BACKFILL_THRESHOLD_MS = Duration.ofMinutes(10).toMillis();
    private static final long SECONDS_CUTOFF = 1_000_000_000_000L;

    private final ShowroomVisitClassifier classifier;

    @Override
    public EventCategory category() {
        return EventCategory.SHOWROOM_VISIT;
    }

    @Override
    public ClassifiedEvent classify(Map<String, Object> body) {
        return classifier.classify(body);
    }

    @Override
    public List<Aggregate> reshape(ClassifiedEvent event, DeliveryContext context) {
        ShowroomVisitTag tag = (ShowroomVisitTag) event.getTag();
        Map<String, Object> detail = event.getPayload();
        long now = context.getArrivalTimestamp();

        Object visitId = PayloadPaths.resolve(detail, tag == ShowroomVisitTag.EXIT_NOTE ? "showroom_visit_id" : "id");
        Aggregate visit = new Aggregate("showroom_visit", visitId)
                .put("dealer_id", context.getTenantId())
                .put("customer_id", context.getSubjectId());
        Aggregate customer = context.subjectAggregate("customer");
        Aggregate lastActivity = context.subjectAggregate("customer_last_activity");

        switch (tag) {
            case NEW_VISIT -> {
                Object date = PayloadPaths.resolve(detail, "date");
                customer.put("primary_tier", 1)
                        .put("last_primary_tier_event", date)
                        .put("last_showroom_visit", date);
                visit.put("date_time", date)
                        .put("type", PayloadPaths.resolve(detail, "type"))
                        .putIfHasValue("created_by", PayloadPaths.resolve(detail, "employee_id"))
                        .putIfHasValue("appointment_id", PayloadPaths.resolve(detail, "appointment.id"));
                lastActivity.put("last_showroom_visit", now);
            }
            case EXIT_NOTE -> {
                Object noteDate = PayloadPaths.resolve(detail, "date");
                Optional<Long> backfill = backfilledVisitTime(noteDate, now);
                customer.put("last_showroom_visit", now);
                backfill.ifPresent(ms -> visit.put("date_time", noteDate));
                visit.put("exit_note_id", PayloadPaths.resolve(detail, "id"))
                        .put("exit_at", Timestamps.toIso(now))
                        .putIfHasValue("exit_by", PayloadPaths.resolve(detail, "employee_id"))
                        .putIfHasValue("is_manager_note", PayloadPaths.resolve(detail, "is_manager_note"))
                        .putIfHasValue("exit_note", PayloadPaths.resolve(detail, "quick_note"))
                        .putIfHasValue("reason_unsold", PayloadPaths.resolve(detail, "reason_unsold"));
                lastActivity.put("last_showroom_visit_exit_note", now);
                backfill.ifPresent(ms -> lastActivity.put("last_showroom_visit", ms));
            }
            case DELETE -> {
                visit.put("deleted_at", now)
                        .putIfHasValue("deleted_by", PayloadPaths.resolve(detail, "employee_id"));
                lastActivity.put("last_showroom_visit_deleted", now);
            }
        }
        return List.of(customer, visit, lastActivity);
    }

    /**
     * Epoch millis of the exit note's date when it lies at least ten minutes before
     * arrival. Numeric dates and arrivals below 10^12 are read as epoch seconds.
     */
    static Optional<Long> backfilledVisitTime(Object noteDate, long arrival) {
        Optional<Long> noteMillis = noteDate instanceof Number n && n.longValue() < SECONDS_CUTOFF
                ? Optional.of(n.longValue() * 1000)
                : Timestamps.toEpochMillis(noteDate);
        long arrivalMillis = arrival < SECONDS_CUTOFF ? arrival * 1000 : arrival;
        return noteMillis.filter(ms -> arrivalMillis - ms >= BACKFILL_THRESHOLD_MS);
    }
}
