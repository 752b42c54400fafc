package com.tastream.indicator;

/** Implemented by indicators driven by a window length. */
public interface Period {

    int getPeriod();
}
