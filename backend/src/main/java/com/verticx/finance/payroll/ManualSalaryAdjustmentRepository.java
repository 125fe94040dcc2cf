package com.verticx.finance.payroll;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ManualSalaryAdjustmentRepository extends JpaRepository<ManualSalaryAdjustment, Long> {
    List<ManualSalaryAdjustment> findByStaffIdAndMonth(Long staffId, String month);
}
