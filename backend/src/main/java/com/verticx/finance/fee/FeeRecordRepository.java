package com.verticx.finance.fee;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface FeeRecordRepository extends JpaRepository<FeeRecord, Long> {
    Optional<FeeRecord> findByStudentId(Long studentId);

    List<FeeRecord> findByStudentIdIn(Collection<Long> studentIds);

    @Query("SELECT f FROM FeeRecord f WHERE f.studentId IN :studentIds AND f.totalAmount > f.paidAmount")
    List<FeeRecord> findDefaulters(@Param("studentIds") Collection<Long> studentIds);
}
