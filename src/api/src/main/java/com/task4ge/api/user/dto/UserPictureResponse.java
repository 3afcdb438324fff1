package com.task4ge.api.user.dto;

public record UserPictureResponse(String url) {
}
