package com.verticx.finance.common.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    // --- common (C001 ~ C099) ---
    INVALID_INPUT_VALUE("C001", "Input value is invalid.", HttpStatus.BAD_REQUEST),
    INTERNAL_SERVER_ERROR("C002", "Internal server error. Please contact the administrator.", HttpStatus.INTERNAL_SERVER_ERROR),
    ACCESS_DENIED("C003", "You do not have access to the requested resource.", HttpStatus.FORBIDDEN),
    RESOURCE_NOT_FOUND("C004", "The requested resource was not found.", HttpStatus.NOT_FOUND),
    AUTHENTICATION_FAILED("C005", "Authentication failed.", HttpStatus.UNAUTHORIZED),
    CONCURRENT_MODIFICATION("C006", "The record was modified concurrently, please retry.", HttpStatus.CONFLICT),

    // --- fee ledger (F001 ~ F099) ---
    FEE_RECORD_NOT_FOUND("F001", "Fee record not found for student.", HttpStatus.NOT_FOUND),
    INVALID_PAYMENT_AMOUNT("F002", "Payment amount must be greater than zero.", HttpStatus.BAD_REQUEST),
    PAYMENT_EXCEEDS_OUTSTANDING("F003", "Payment amount exceeds the outstanding balance.", HttpStatus.BAD_REQUEST),
    DUPLICATE_TRANSACTION("F004", "A payment with this transaction id was already recorded.", HttpStatus.CONFLICT),
    LEDGER_BUSY("F005", "Fee ledger is busy, please try again later.", HttpStatus.LOCKED),
    INVALID_ADJUSTMENT_AMOUNT("F006", "Adjustment amount must be greater than zero.", HttpStatus.BAD_REQUEST),

    // --- payroll and leave (P001 ~ P099) ---
    FROZEN_RECORD_CONFLICT("P001", "Payroll record is already paid and cannot be changed.", HttpStatus.CONFLICT),
    SALARY_NOT_SET("P002", "Staff member has no base salary set.", HttpStatus.BAD_REQUEST),
    LEAVE_ALREADY_REVIEWED("P003", "Leave application has already been reviewed.", HttpStatus.CONFLICT),
    INVALID_LEAVE_PERIOD("P004", "Leave end date must not be before its start date.", HttpStatus.BAD_REQUEST),

    // --- session and promotion (S001 ~ S099) ---
    CLASS_NOT_FOUND("S001", "Class not found.", HttpStatus.NOT_FOUND),
    SESSION_NOT_FOUND("S002", "Academic session not found for branch.", HttpStatus.NOT_FOUND),
    TEMPLATE_BRANCH_MISMATCH("S003", "Fee template belongs to a different branch.", HttpStatus.BAD_REQUEST);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;
}
