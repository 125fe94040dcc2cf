package com.verticx.finance.payroll;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.YearMonth;

@Component
public class PayrollDraftRefreshJob {

    private static final Logger logger = LoggerFactory.getLogger(PayrollDraftRefreshJob.class);

    private final PayrollService payrollService;
    private final StaffMemberRepository staffMemberRepository;

    public PayrollDraftRefreshJob(PayrollService payrollService, StaffMemberRepository staffMemberRepository) {
        this.payrollService = payrollService;
        this.staffMemberRepository = staffMemberRepository;
    }

    /**
     * Recalculates the current month's unpaid payroll drafts for every branch so that approved leaves
     * and adjustments show up without a principal opening the sheet. Paid records are left alone.
     */
    @Scheduled(cron = "${app.payroll.draftRefreshCron}")
    public void refreshCurrentMonthDrafts() {
        YearMonth month = YearMonth.now();
        logger.info("Starting payroll draft refresh for {}", month);
        int total = 0;
        for (Long branchId : staffMemberRepository.findDistinctBranchIds()) {
            try {
                total += payrollService.refreshDrafts(branchId, month);
            } catch (RuntimeException e) {
                logger.error("Payroll draft refresh failed for branch {}", branchId, e);
            }
        }
        logger.info("Finished payroll draft refresh for {}: {} drafts updated", month, total);
    }
}
