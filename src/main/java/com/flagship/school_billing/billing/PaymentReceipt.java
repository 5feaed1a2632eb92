package com.flagship.school_billing.billing;

import com.flagship.school_billing.attendance.LessonBalance;
import com.flagship.school_billing.debt.DebtReport;
import com.flagship.school_billing.payment.Payment;
import lombok.Value;

/**
 * A recorded payment together with the student's balance and debt computed in
 * the same transaction, so callers see the effect of the payment immediately.
 */
@Value
public class PaymentReceipt {
    Payment payment;
    LessonBalance balance;
    DebtReport debt;
}
