package com.lawnsim.engine;

import com.lawnsim.model.GameState;

/**
 * Anything that can hand out a {@link GameState}: a running simulator, a saved file, a live game reader.
 */
public interface GameStateSource {
    GameState snapshot();
}
