package com.mouse.surebet.dto;

import lombok.Value;

import java.time.Instant;

@Value
public class ApiError {
    String code;
    String message;
    String path;
    Instant timestamp;
}
