package com.verticx.finance.promotion;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface GradeEntryRepository extends JpaRepository<GradeEntry, Long> {
    List<GradeEntry> findByStudentIdAndAcademicSession(Long studentId, String academicSession);

    long countByStudentId(Long studentId);
}
