package com.verticx.finance.promotion;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * Frozen copy of a student's academic records for one session, written when the student is promoted.
 */
@Entity
@Table(name = "archived_student_records")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ArchivedStudentRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long studentId;

    @Column(nullable = false, updatable = false)
    private String name;

    @Column(nullable = false, updatable = false)
    private Long branchId;

    @Column(nullable = false, updatable = false)
    private String academicSession;

    @Column(nullable = false, updatable = false)
    private String finalClass;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false)
    private List<GradeSnapshot> grades;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(updatable = false)
    private List<AttendanceSnapshot> attendance;

    @Column(nullable = false, updatable = false)
    private OffsetDateTime archivedAt;

    public ArchivedStudentRecord(Long studentId, String name, Long branchId, String academicSession,
                                 String finalClass, List<GradeSnapshot> grades,
                                 List<AttendanceSnapshot> attendance, OffsetDateTime archivedAt) {
        this.studentId = studentId;
        this.name = name;
        this.branchId = branchId;
        this.academicSession = academicSession;
        this.finalClass = finalClass;
        this.grades = grades;
        this.attendance = attendance;
        this.archivedAt = archivedAt;
    }

    public record GradeSnapshot(String courseName, String assessment, BigDecimal score, String term) {
        static GradeSnapshot of(GradeEntry entry) {
            return new GradeSnapshot(entry.getCourseName(), entry.getAssessment(), entry.getScore(), entry.getTerm());
        }
    }

    public record AttendanceSnapshot(String courseName, LocalDate date, AttendanceEntry.Status status) {
        static AttendanceSnapshot of(AttendanceEntry entry) {
            return new AttendanceSnapshot(entry.getCourseName(), entry.getDate(), entry.getStatus());
        }
    }
}
