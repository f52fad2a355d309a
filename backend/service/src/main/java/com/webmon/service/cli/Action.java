package com.webmon.service.cli;

public enum Action {
    MONITOR,
    DROP_TABLES,
    HELP
}
