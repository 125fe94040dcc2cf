package com.verticx.finance.payroll;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PayrollRecordRepositoryTest {

    @Autowired
    private PayrollRecordRepository payrollRecordRepository;

    private PayrollRecord save(Long staffId, String month, PayrollRecord.Status status) {
        PayrollRecord record = new PayrollRecord();
        record.setBranchId(1L);
        record.setStaffId(staffId);
        record.setStaffName("Staff " + staffId);
        record.setStaffRole(StaffMember.Role.TEACHER);
        record.setMonth(month);
        record.setBaseSalary(new BigDecimal("30000"));
        record.setNetPayable(new BigDecimal("30000"));
        record.setStatus(status);
        return payrollRecordRepository.save(record);
    }

    @Test
    void looksUpRecordsByStaffAndMonth() {
        save(7L, "2024-03", PayrollRecord.Status.PAID);
        save(7L, "2024-04", PayrollRecord.Status.PENDING);
        save(8L, "2024-04", PayrollRecord.Status.PENDING);

        assertThat(payrollRecordRepository.findByStaffIdAndMonth(7L, "2024-04"))
                .get()
                .extracting(PayrollRecord::getStatus)
                .isEqualTo(PayrollRecord.Status.PENDING);
        assertThat(payrollRecordRepository.findByBranchIdAndMonthOrderByStaffNameAsc(1L, "2024-04"))
                .extracting(PayrollRecord::getStaffId)
                .containsExactly(7L, 8L);
    }

    @Test
    void lockingLookupReturnsTheRecord() {
        PayrollRecord saved = save(9L, "2024-05", PayrollRecord.Status.PENDING);

        assertThat(payrollRecordRepository.findByIdForUpdate(saved.getId()))
                .get()
                .extracting(PayrollRecord::yearMonth)
                .isEqualTo(java.time.YearMonth.of(2024, 5));
    }
}
