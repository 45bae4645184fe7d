package com.teamcode.backend.dto;

import com.teamcode.backend.entity.User;

public record UserProfileDto(
        Long id,
        String name,
        String email,
        String anonymousId,
        boolean teacher,
        boolean admin
) {
    public static UserProfileDto from(User user) {
        return new UserProfileDto(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getAnonymousId(),
                Boolean.TRUE.equals(user.getTeacher()),
                Boolean.TRUE.equals(user.getAdmin())
        );
    }
}
