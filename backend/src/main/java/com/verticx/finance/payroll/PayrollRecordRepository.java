package com.verticx.finance.payroll;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface PayrollRecordRepository extends JpaRepository<PayrollRecord, Long> {
    Optional<PayrollRecord> findByStaffIdAndMonth(Long staffId, String month);

    List<PayrollRecord> findByBranchIdAndMonthOrderByStaffNameAsc(Long branchId, String month);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PayrollRecord p where p.id = :id")
    Optional<PayrollRecord> findByIdForUpdate(@Param("id") Long id);
}
