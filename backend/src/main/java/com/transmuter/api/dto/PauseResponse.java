package com.transmuter.api.dto;

import com.transmuter.domain.ActionType;

public record PauseResponse(String asset, ActionType action, boolean paused) {
}
