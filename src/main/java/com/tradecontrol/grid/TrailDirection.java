package com.tradecontrol.grid;

public enum TrailDirection {
    UP,
    DOWN
}
