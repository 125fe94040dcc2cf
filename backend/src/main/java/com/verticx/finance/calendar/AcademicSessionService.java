package com.verticx.finance.calendar;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;

@Service
public class AcademicSessionService {

    private final AcademicSessionRepository academicSessionRepository;
    private final int defaultStartMonth;

    public AcademicSessionService(AcademicSessionRepository academicSessionRepository,
                                  @Value("${app.session.defaultStartMonth:4}") int defaultStartMonth) {
        this.academicSessionRepository = academicSessionRepository;
        this.defaultStartMonth = defaultStartMonth;
    }

    @Transactional(readOnly = true)
    public Optional<AcademicSession> findForBranch(Long branchId) {
        return academicSessionRepository.findByBranchId(branchId);
    }

    /**
     * Session start date of the branch; branches without a session row fall back to the first day of
     * the most recent occurrence of the configured start month, on or before {@code today}.
     */
    @Transactional(readOnly = true)
    public LocalDate startDateFor(Long branchId, LocalDate today) {
        return academicSessionRepository.findByBranchId(branchId)
                .map(AcademicSession::getStartDate)
                .orElseGet(() -> defaultStartDate(today));
    }

    LocalDate defaultStartDate(LocalDate today) {
        int year = today.getMonthValue() < defaultStartMonth ? today.getYear() - 1 : today.getYear();
        return LocalDate.of(year, defaultStartMonth, 1);
    }
}
