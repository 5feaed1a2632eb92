package com.flagship.school_billing.student;

import com.flagship.school_billing.attendance.AttendanceRecord;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Row of the student_attendance collection table.
 * Uniqueness of (student_id, course_id, lesson_date) is enforced by the schema.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AttendanceEntry {

    @Column(name = "lesson_date", nullable = false)
    private LocalDate lessonDate;

    @Column(name = "course_id", nullable = false)
    private Long courseId;

    @Column(name = "is_absent", nullable = false)
    private boolean absent;

    @Column(name = "charge_money", nullable = false)
    private boolean chargeMoney;

    @Column(name = "reason", nullable = false, length = AttendanceRecord.MAX_REASON_LENGTH)
    private String reason;

    static AttendanceEntry fromDomain(AttendanceRecord record) {
        return new AttendanceEntry(
            record.getDate(),
            record.getCourseId(),
            record.isAbsent(),
            record.isChargeMoney(),
            record.getReason()
        );
    }

    AttendanceRecord toDomain() {
        return new AttendanceRecord(lessonDate, courseId, absent, chargeMoney, reason);
    }
}
