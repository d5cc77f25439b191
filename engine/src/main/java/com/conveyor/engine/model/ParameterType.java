package com.conveyor.engine.model;

/** Declared type of a run parameter. */
public enum ParameterType {
    STRING,
    CHOICE,     // one of a fixed list of allowed values
    BOOLEAN     // "true" or "false", case-insensitive
}
