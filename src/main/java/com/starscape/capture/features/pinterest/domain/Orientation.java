package com.starscape.capture.features.pinterest.domain;

public enum Orientation {
    LANDSCAPE,
    PORTRAIT,
    SQUARE
}
