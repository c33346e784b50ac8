package com.example.smartroll.enums;

public enum UserRole {
    STUDENT,
    INSTRUCTOR,
    ADMIN
}
