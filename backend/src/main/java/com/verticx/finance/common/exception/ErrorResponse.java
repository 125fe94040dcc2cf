package com.verticx.finance.common.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    private int status;
    private String code;
    private String message;
    private String path;
    private Map<String, String> validationErrors;

    public ErrorResponse(int status, String code, String message, String path) {
        this(status, code, message, path, null);
    }
}
