package com.flagship.school_billing.attendance;

import com.flagship.school_billing.billing.exception.InvalidInputException;
import com.flagship.school_billing.course.Course;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Applies attendance events to a student's ledger.
 *
 * Both operations use the same reverse-then-reapply rule, so the result
 * depends only on the final content of each record and never on the path of
 * updates that led there. The lesson cost is taken from the course as it is
 * now, including for reversals of records created under an older price.
 *
 * Stateless and free of I/O; loading and persisting the ledger is the
 * caller's job.
 */
@Service
@Slf4j
public class AttendanceReconciliationEngine {

    /**
     * Records attendance for a key, overwriting (with reversal) any existing record.
     */
    public StudentLedger.Transition recordAttendance(StudentLedger ledger, Course course, AttendanceRecord incoming) {
        if (incoming == null) {
            throw new InvalidInputException("Attendance record is required");
        }
        requireSameCourse(course, incoming.getCourseId());

        BigDecimal lessonCost = course.lessonCost();
        StudentLedger.Transition transition = ledger.write(incoming, lessonCost);

        log.debug("Attendance {} for course {} on {}: absent={}, charged={}, lessonCost={}",
                transition.replacedExisting() ? "overwritten" : "recorded",
                incoming.getCourseId(), incoming.getDate(),
                incoming.isAbsent(), incoming.isChargeMoney(), lessonCost);
        return transition;
    }

    /**
     * Updates an existing record with the supplied fields.
     *
     * @throws com.flagship.school_billing.billing.exception.NotFoundException if the key has no record
     */
    public StudentLedger.Transition updateAttendance(StudentLedger ledger, Course course,
                                                     LocalDate date, AttendancePatch patch) {
        if (date == null) {
            throw new InvalidInputException("Attendance date is required");
        }
        AttendancePatch effective = patch != null ? patch : AttendancePatch.builder().build();

        BigDecimal lessonCost = course.lessonCost();
        StudentLedger.Transition transition =
            ledger.update(AttendanceKey.of(course.getId(), date), effective, lessonCost);

        log.debug("Attendance updated for course {} on {}: {} -> {}",
                course.getId(), date, transition.getPrevious(), transition.getRecord());
        return transition;
    }

    private void requireSameCourse(Course course, Long courseId) {
        if (!course.getId().equals(courseId)) {
            throw new InvalidInputException(
                String.format("Attendance course %s does not match course %s", courseId, course.getId()));
        }
    }
}
