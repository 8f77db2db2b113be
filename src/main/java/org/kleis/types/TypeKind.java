package org.kleis.types;

public enum TypeKind {
    PRIMITIVE,
    VARIABLE,
    FUNCTION,
    NAMED,
    FOR_ALL
}
