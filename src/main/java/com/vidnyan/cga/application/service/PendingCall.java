package com.vidnyan.cga.application.service;

import com.vidnyan.cga.domain.extraction.CallExtraction;
import com.vidnyan.cga.domain.model.CallReference;
import com.vidnyan.cga.domain.model.FunctionRecord;

/**
 * An unresolved call reference paired with the extraction facts the resolver needs.
 * {@code index} is the position of the reference within the caller's call list.
 */
public record PendingCall(
    CallReference reference,
    CallExtraction call,
    FunctionRecord caller,
    int index
) {}
