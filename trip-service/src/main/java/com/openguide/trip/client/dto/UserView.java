package com.openguide.trip.client.dto;

public record UserView(
        Long id,
        String name,
        String email,
        String role
) {
    public boolean isTourist() {
        return "tourist".equalsIgnoreCase(role);
    }
}
