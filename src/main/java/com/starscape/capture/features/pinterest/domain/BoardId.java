package com.starscape.capture.features.pinterest.domain;

import com.starscape.capture.common.domain.Guard;
import com.starscape.capture.common.domain.Identifier;

public record BoardId(String value) implements Identifier {

    public BoardId {
        Guard.requireNonBlank("boardId", value);
    }

    public static BoardId of(String value) {
        return new BoardId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
