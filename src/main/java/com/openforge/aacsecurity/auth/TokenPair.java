package com.openforge.aacsecurity.auth;

public record TokenPair(String accessToken, String refreshToken) {}
