package com.example.pharmacyrota.constraint;

import com.example.pharmacyrota.requirement.WorkItem;
import com.example.pharmacyrota.staff.StaffSnapshot;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Decides whether a staff member may take a work item on a date.
 * <p>
 * Checks run in a fixed order and stop at the first failure:
 * <ol>
 *     <li>working day (no working days configured means available)</li>
 *     <li>unavailability rules for that weekday, minus the rule indices ignored for this rota</li>
 *     <li>training: required tag, or warfarin training for a warfarin clinic</li>
 *     <li>do-not-split exclusivity against bookings at other locations that day</li>
 * </ol>
 * The evaluator holds no state.
 */
@Component
public class ConstraintEvaluator {

    public Eligibility isEligible(StaffSnapshot staff, WorkItem item, LocalDate date) {
        return isEligible(staff, item, date, List.of(), Set.of());
    }

    public Eligibility isEligible(StaffSnapshot staff,
                                  WorkItem item,
                                  LocalDate date,
                                  Collection<Commitment> commitments,
                                  Set<Integer> ignoredRuleIndices) {
        DayOfWeek day = date.getDayOfWeek();

        if (!staff.workingDays().isEmpty() && !staff.workingDays().contains(day)) {
            return Eligibility.rejected(IneligibilityReason.NOT_WORKING_DAY,
                    staff.name() + " does not work on " + day);
        }

        List<StaffSnapshot.Rule> rules = staff.unavailabilityRules();
        for (int i = 0; i < rules.size(); i++) {
            if (ignoredRuleIndices != null && ignoredRuleIndices.contains(i)) {
                continue;
            }
            StaffSnapshot.Rule rule = rules.get(i);
            if (rule.blocks(day, item.window())) {
                return Eligibility.rejected(IneligibilityReason.UNAVAILABLE,
                        staff.name() + " is unavailable " + day + " " + rule.window());
            }
        }

        if (item.requiredTraining() != null && !staff.specialistTraining().contains(item.requiredTraining())) {
            return Eligibility.rejected(IneligibilityReason.MISSING_TRAINING,
                    staff.name() + " lacks " + item.requiredTraining() + " training");
        }
        if (item.requiresWarfarinTraining() && !staff.warfarinTrained()) {
            return Eligibility.rejected(IneligibilityReason.MISSING_TRAINING,
                    staff.name() + " is not warfarin trained");
        }

        if (commitments != null) {
            for (Commitment c : commitments) {
                if (c.location().equals(item.name())) {
                    continue;
                }
                if (c.doNotSplit()) {
                    return Eligibility.rejected(IneligibilityReason.EXCLUSIVE_COMMITMENT,
                            staff.name() + " is committed to " + c.location() + " for the whole day");
                }
                if (item.doNotSplit()) {
                    return Eligibility.rejected(IneligibilityReason.EXCLUSIVE_COMMITMENT,
                            item.name() + " cannot be shared with other duties that day");
                }
            }
        }
        return Eligibility.ok();
    }
}
