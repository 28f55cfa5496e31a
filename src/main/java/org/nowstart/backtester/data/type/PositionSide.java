package org.nowstart.backtester.data.type;

public enum PositionSide {
    FLAT,
    LONG,
    SHORT
}
