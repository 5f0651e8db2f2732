package com.vidnyan.cga.domain.extraction;

public enum DeclarationKind {
    CLASS,
    INTERFACE,
    ENUM,
    RECORD
}
