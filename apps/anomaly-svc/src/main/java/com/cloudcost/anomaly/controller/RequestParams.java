package com.cloudcost.anomaly.controller;

import com.cloudcost.anomaly.tracing.RequestContextHolder;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

final class RequestParams {

    private RequestParams() {
    }

    static LocalDate requireDate(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must be provided (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid " + name + " format, expected YYYY-MM-DD: '" + value + "'");
        }
    }

    static LocalDate optionalDate(String name, String value) {
        return value == null || value.isBlank() ? null : requireDate(name, value);
    }

    static BigDecimal money(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    static String traceId() {
        return RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
    }
}
