package com.flagship.school_billing.attendance;

import com.flagship.school_billing.billing.exception.NotFoundException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Domain aggregate holding a student's balance and attendance records.
 *
 * Transitions are immutable: every operation returns a new ledger. Records are
 * unique per (course, date); writing an existing key reverses the old record's
 * effect before the new one is applied, so the balance only ever reflects the
 * latest content of each record.
 */
@Value
public class StudentLedger {

    private static final Comparator<AttendanceRecord> CHRONOLOGICAL =
        Comparator.comparing(AttendanceRecord::getDate)
            .thenComparing(AttendanceRecord::getCourseId);

    Long studentId;
    LessonBalance balance;
    List<AttendanceRecord> records;

    public StudentLedger(Long studentId, LessonBalance balance, List<AttendanceRecord> records) {
        this.studentId = studentId;
        this.balance = Objects.requireNonNull(balance, "balance");
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        long distinctKeys = this.records.stream().map(AttendanceRecord::key).distinct().count();
        if (distinctKeys != this.records.size()) {
            throw new IllegalStateException(
                "Student " + studentId + " has more than one attendance record for the same course and date");
        }
    }

    public Optional<AttendanceRecord> find(AttendanceKey key) {
        return records.stream().filter(r -> r.key().equals(key)).findFirst();
    }

    public List<AttendanceRecord> chronologicalRecords() {
        List<AttendanceRecord> sorted = new ArrayList<>(records);
        sorted.sort(CHRONOLOGICAL);
        return sorted;
    }

    /**
     * Writes a record, replacing any existing record for the same key.
     *
     * @param incoming   the new record
     * @param lessonCost per-lesson price of the record's course
     * @return the transition result
     */
    public Transition write(AttendanceRecord incoming, BigDecimal lessonCost) {
        Optional<AttendanceRecord> existing = find(incoming.key());
        LessonBalance next = existing
            .map(old -> balance.reverse(old, lessonCost))
            .orElse(balance)
            .charge(incoming, lessonCost);
        return new Transition(withRecord(incoming, next), incoming, existing.orElse(null));
    }

    /**
     * Merges a patch into the record stored under {@code key}.
     *
     * @throws NotFoundException if no record exists for the key
     */
    public Transition update(AttendanceKey key, AttendancePatch patch, BigDecimal lessonCost) {
        AttendanceRecord old = find(key).orElseThrow(() -> new NotFoundException(
            String.format("No attendance record for student %s, course %s on %s",
                studentId, key.getCourseId(), key.getDate())));
        AttendanceRecord merged = old.merge(patch);
        LessonBalance next = balance.reverse(old, lessonCost).charge(merged, lessonCost);
        return new Transition(withRecord(merged, next), merged, old);
    }

    public StudentLedger credit(BigDecimal amount) {
        return new StudentLedger(studentId, balance.credit(amount), records);
    }

    private StudentLedger withRecord(AttendanceRecord record, LessonBalance next) {
        List<AttendanceRecord> updated = new ArrayList<>(records.size() + 1);
        boolean replaced = false;
        for (AttendanceRecord r : records) {
            if (r.key().equals(record.key())) {
                updated.add(record);
                replaced = true;
            } else {
                updated.add(r);
            }
        }
        if (!replaced) {
            updated.add(record);
        }
        return new StudentLedger(studentId, next, updated);
    }

    /**
     * Outcome of a single attendance write.
     */
    @Value
    public static class Transition {
        StudentLedger ledger;
        AttendanceRecord record;
        /** Record that was superseded, or {@code null} for a fresh key. */
        AttendanceRecord previous;

        public boolean replacedExisting() {
            return previous != null;
        }
    }
}
