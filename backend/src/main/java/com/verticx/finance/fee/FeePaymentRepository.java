package com.verticx.finance.fee;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface FeePaymentRepository extends JpaRepository<FeePayment, Long> {
    List<FeePayment> findByStudentIdOrderByPaidDateAsc(Long studentId);

    boolean existsByTransactionId(String transactionId);
}
