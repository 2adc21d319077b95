package com.mouse.betinfo.interfaces;

import com.mouse.betinfo.model.GameResult;

import java.util.Optional;

public interface OutcomeSource {

    String sourceName();

    /**
     * @return empty while the game is not final
     */
    Optional<GameResult> fetchResult(String gameId);
}
