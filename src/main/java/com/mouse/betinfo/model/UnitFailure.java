package com.mouse.betinfo.model;

public record UnitFailure(String unit, String errorType, String message) {

    public static UnitFailure of(String unit, Throwable error) {
        return new UnitFailure(unit, error.getClass().getSimpleName(), error.getMessage());
    }
}
