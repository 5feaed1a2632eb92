package com.flagship.school_billing.student;

import com.flagship.school_billing.attendance.AttendanceRecord;
import com.flagship.school_billing.attendance.LessonBalance;
import com.flagship.school_billing.attendance.StudentLedger;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for a student and the attendance records embedded in it.
 *
 * Key design principles:
 * - No setters: balance and attendance change only through {@link #applyLedger}
 * - {@code version} backs the optimistic check on every billing write
 * - Attendance is a typed collection, not a free-form JSON column
 */
@Entity
@Table(name = "students")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StudentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 50)
    private String name;

    @Column(nullable = false, length = 50)
    private String surname;

    @Column(name = "second_name", length = 50)
    private String secondName;

    @Column(name = "starting_date", nullable = false)
    private LocalDate startingDate;

    @Column(name = "num_lesson", nullable = false)
    private int numLesson;

    // unconstrained NUMERIC, see V1 migration
    @Column(name = "total_money", nullable = false)
    private BigDecimal totalMoney;

    @Column(name = "is_archived", nullable = false)
    private boolean archived;

    @Version
    @Column(nullable = false)
    private Long version;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "student_attendance", joinColumns = @JoinColumn(name = "student_id"))
    @OrderColumn(name = "record_index")
    private List<AttendanceEntry> attendance = new ArrayList<>();

    /**
     * Registers a student with an empty ledger.
     */
    public static StudentEntity register(String name, String surname, String secondName, LocalDate startingDate) {
        StudentEntity entity = new StudentEntity();
        entity.name = name;
        entity.surname = surname;
        entity.secondName = secondName;
        entity.startingDate = startingDate;
        entity.numLesson = 0;
        entity.totalMoney = BigDecimal.ZERO;
        entity.archived = false;
        return entity;
    }

    public String getDisplayName() {
        return name + " " + surname;
    }

    public StudentLedger toLedger() {
        return new StudentLedger(
            id,
            new LessonBalance(numLesson, totalMoney),
            attendance.stream().map(AttendanceEntry::toDomain).toList()
        );
    }

    /**
     * Copies a ledger transition back onto the entity.
     * Only balance and attendance are mutable through billing.
     */
    public void applyLedger(StudentLedger ledger) {
        if (!id.equals(ledger.getStudentId())) {
            throw new IllegalArgumentException(
                "Ledger for student " + ledger.getStudentId() + " applied to student " + id);
        }
        this.numLesson = ledger.getBalance().getNumLesson();
        this.totalMoney = ledger.getBalance().getTotalMoney();
        // index-wise so a replaced record keeps its row and unchanged rows are not rewritten
        List<AttendanceRecord> records = ledger.getRecords();
        for (int i = 0; i < records.size(); i++) {
            AttendanceEntry entry = AttendanceEntry.fromDomain(records.get(i));
            if (i < attendance.size()) {
                if (!attendance.get(i).equals(entry)) {
                    attendance.set(i, entry);
                }
            } else {
                attendance.add(entry);
            }
        }
        while (attendance.size() > records.size()) {
            attendance.remove(attendance.size() - 1);
        }
    }
}
