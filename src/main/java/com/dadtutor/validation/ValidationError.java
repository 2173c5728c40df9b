package com.dadtutor.validation;

public record ValidationError(String code, String field, String message) {}
