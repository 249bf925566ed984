package com.openforge.aacsecurity.auth.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OkResponse(boolean ok, String message) {

    public static OkResponse success() {
        return new OkResponse(true, null);
    }

    public static OkResponse success(String message) {
        return new OkResponse(true, message);
    }
}
