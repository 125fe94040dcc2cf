package com.verticx.finance.promotion;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AttendanceEntryRepository extends JpaRepository<AttendanceEntry, Long> {
    List<AttendanceEntry> findByStudentIdAndAcademicSessionOrderByDateAsc(Long studentId, String academicSession);
}
