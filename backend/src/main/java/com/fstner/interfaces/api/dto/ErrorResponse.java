package com.fstner.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
