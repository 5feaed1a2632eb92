package com.flagship.school_billing.attendance;

import lombok.Value;

import java.time.LocalDate;

/**
 * Identifies an attendance record within one student's ledger.
 */
@Value(staticConstructor = "of")
public class AttendanceKey {
    Long courseId;
    LocalDate date;
}
