package com.mouse.betinfo.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BetSide {
    HOME("home"),

    AWAY("away");

    private final String value;

    public static BetSide fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (BetSide side : values()) {
            if (side.value.equalsIgnoreCase(value) || side.name().equalsIgnoreCase(value)) {
                return side;
            }
        }
        return null;
    }
}
