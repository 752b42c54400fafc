package com.tastream.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_PARAMETER("INVALID_PARAMETER", "invalid parameter"),
    DATA_ITEM_INCOMPLETE("DATA_ITEM_INCOMPLETE", "data item is incomplete"),
    DATA_ITEM_INVALID("DATA_ITEM_INVALID", "data item is invalid"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", "indicator configuration could not be loaded");

    private final String code;
    private final String description;
}
