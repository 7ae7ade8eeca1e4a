package com.cloudcost.anomaly.model;

public class InvalidGroupingException extends IllegalArgumentException {

    public InvalidGroupingException(String message) {
        super(message);
    }
}
