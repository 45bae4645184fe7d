package com.teamcode.backend.entity;

public enum DependencyOperator {
    OR,
    AND
}
