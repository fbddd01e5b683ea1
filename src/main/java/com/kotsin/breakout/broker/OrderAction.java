package com.kotsin.breakout.broker;

import com.kotsin.breakout.model.Side;

public enum OrderAction {
    BUY,
    SELL;

    public static OrderAction opening(Side side) {
        return side == Side.LONG ? BUY : SELL;
    }

    public static OrderAction closing(Side side) {
        return side == Side.LONG ? SELL : BUY;
    }
}
