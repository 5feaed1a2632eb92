package com.flagship.school_billing.attendance;

import com.flagship.school_billing.billing.exception.InvalidInputException;
import lombok.Value;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One attendance mark of a student for a course on a given day.
 *
 * Immutable: an update produces a new record through {@link #merge}.
 */
@Value
public class AttendanceRecord {

    /** Width of the student_attendance.reason column. */
    public static final int MAX_REASON_LENGTH = 500;

    LocalDate date;
    Long courseId;
    boolean absent;
    boolean chargeMoney;
    String reason;

    public AttendanceRecord(LocalDate date, Long courseId, boolean absent, boolean chargeMoney, String reason) {
        this.date = Objects.requireNonNull(date, "date");
        this.courseId = Objects.requireNonNull(courseId, "courseId");
        this.absent = absent;
        this.chargeMoney = chargeMoney;
        if (reason != null && reason.length() > MAX_REASON_LENGTH) {
            throw new InvalidInputException(String.format(
                "Attendance reason is %d characters long, at most %d allowed", reason.length(), MAX_REASON_LENGTH));
        }
        this.reason = reason == null ? "" : reason;
    }

    /**
     * Present and charged: the default mark taken during a lesson.
     */
    public static AttendanceRecord present(LocalDate date, Long courseId) {
        return new AttendanceRecord(date, courseId, false, true, "");
    }

    public AttendanceKey key() {
        return AttendanceKey.of(courseId, date);
    }

    /**
     * A record counts as a billed lesson only when the student was there and
     * the lesson was charged.
     */
    public boolean consumesLesson() {
        return chargeMoney && !absent;
    }

    /**
     * Overlays the supplied fields of a patch; unspecified fields keep their value.
     */
    public AttendanceRecord merge(AttendancePatch patch) {
        return new AttendanceRecord(
            date,
            courseId,
            patch.getAbsent() != null ? patch.getAbsent() : absent,
            patch.getChargeMoney() != null ? patch.getChargeMoney() : chargeMoney,
            patch.getReason() != null ? patch.getReason() : reason
        );
    }
}
