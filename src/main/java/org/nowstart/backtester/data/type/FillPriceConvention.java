package org.nowstart.backtester.data.type;

/**
 * Price at which an order decided on bar {@code i} is filled.
 */
public enum FillPriceConvention {
    /** Fill at the open of bar {@code i + 1}. */
    NEXT_OPEN,
    /** Fill immediately at the close of bar {@code i}. */
    SIGNAL_CLOSE
}
