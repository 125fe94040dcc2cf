package com.verticx.finance.promotion;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ArchivedStudentRecordRepository extends JpaRepository<ArchivedStudentRecord, Long> {
    List<ArchivedStudentRecord> findByStudentIdOrderByArchivedAtDesc(Long studentId);
}
