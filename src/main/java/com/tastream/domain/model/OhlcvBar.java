package com.tastream.domain.model;

/**
 * A complete OHLCV sample. Required by volume-driven indicators (OBV, MFI).
 */
public interface OhlcvBar extends PriceBar {

    double getOpen();

    double getVolume();
}
