package io.sqlsugar.variable;

public enum VariableType {
    STRING,
    NUMBER,
    BOOLEAN,
    DATE,
    DATETIME,
    JSON,
    UUID,
    EMAIL,
    URL
}
