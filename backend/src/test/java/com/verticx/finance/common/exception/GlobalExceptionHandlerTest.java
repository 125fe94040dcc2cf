package com.verticx.finance.common.exception;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void duplicatePayrollInsertIsReportedAsConflict() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/payroll/branches/1");
        DataIntegrityViolationException race = new DataIntegrityViolationException("could not execute statement",
                new SQLException("duplicate key value violates unique constraint \"uk_payroll_staff_month\""));

        ResponseEntity<ErrorResponse> response = handler.handleDataIntegrityViolation(race, request);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getCode()).isEqualTo(ErrorCode.CONCURRENT_MODIFICATION.getCode());
        assertThat(response.getBody().getPath()).isEqualTo("/api/payroll/branches/1");
    }

    @Test
    void businessRuleUsesItsOwnStatus() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/fees/students/1/payments");

        ResponseEntity<ErrorResponse> response = handler.handleBusinessRule(
                new BusinessRuleException(ErrorCode.LEDGER_BUSY), request);

        assertThat(response.getStatusCode()).isEqualTo(ErrorCode.LEDGER_BUSY.getStatus());
        assertThat(response.getBody().getCode()).isEqualTo(ErrorCode.LEDGER_BUSY.getCode());
    }
}
