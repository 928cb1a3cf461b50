package com.example.engage.service;

public record SendResult(Status status, String reason) {

    public enum Status {
        DELIVERED,
        NOT_CONNECTED,
        FAILED
    }

    private static final SendResult DELIVERED_RESULT = new SendResult(Status.DELIVERED, null);
    private static final SendResult NOT_CONNECTED_RESULT = new SendResult(Status.NOT_CONNECTED, "not connected");

    public static SendResult delivered() {
        return DELIVERED_RESULT;
    }

    public static SendResult notConnected() {
        return NOT_CONNECTED_RESULT;
    }

    public static SendResult failed(String reason) {
        return new SendResult(Status.FAILED, reason);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }
}
