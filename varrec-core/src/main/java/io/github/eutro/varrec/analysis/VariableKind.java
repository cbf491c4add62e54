package io.github.eutro.varrec.analysis;

public enum VariableKind {
    REGISTER,
    STACK,
    TEMPORARY,
}
