package com.tastream.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Root of an indicator set configuration file: a name and the indicators to compute
 * for every bar of one stream.
 */
@Data
public class IndicatorSetConfig {

    private String name;

    /** Whether the set is enabled. Defaults to true. */
    private boolean enabled = true;

    private List<IndicatorDefinition> indicators = new ArrayList<>();
}
