package com.mouse.betinfo.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Embeddable
@Getter
@EqualsAndHashCode
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(staticName = "of")
public class FinalScore {

    @Column(name = "home_score", nullable = false)
    private int home;

    @Column(name = "away_score", nullable = false)
    private int away;

    public boolean isTie() {
        return home == away;
    }

    public boolean homeWon() {
        return home > away;
    }
}
