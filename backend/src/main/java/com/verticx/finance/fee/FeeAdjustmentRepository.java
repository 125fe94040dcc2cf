package com.verticx.finance.fee;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FeeAdjustmentRepository extends JpaRepository<FeeAdjustment, Long> {
    List<FeeAdjustment> findByStudentIdOrderByDateAsc(Long studentId);
}
