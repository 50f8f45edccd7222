package com.authgate.backend.auth.dto;

public record StatusResponse(String status) {

    public static StatusResponse ok() { return new StatusResponse("ok"); }

    public static StatusResponse verified() { return new StatusResponse("verified"); }
}
