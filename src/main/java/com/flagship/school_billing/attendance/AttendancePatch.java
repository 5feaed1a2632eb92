package com.flagship.school_billing.attendance;

import lombok.Builder;
import lombok.Value;

/**
 * Partial update of an attendance record. A {@code null} field means
 * "keep the current value".
 */
@Value
@Builder
public class AttendancePatch {
    Boolean absent;
    Boolean chargeMoney;
    String reason;
}
