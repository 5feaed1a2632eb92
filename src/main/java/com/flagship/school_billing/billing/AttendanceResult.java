package com.flagship.school_billing.billing;

import com.flagship.school_billing.attendance.AttendanceRecord;
import com.flagship.school_billing.attendance.LessonBalance;
import lombok.Value;

/**
 * The stored attendance record and the student's balance right after the write.
 */
@Value
public class AttendanceResult {
    Long studentId;
    AttendanceRecord record;
    LessonBalance balance;
    boolean replacedExisting;
}
