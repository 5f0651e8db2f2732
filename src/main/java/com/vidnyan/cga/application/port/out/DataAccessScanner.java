package com.vidnyan.cga.application.port.out;

import com.vidnyan.cga.domain.model.DataAccessFact;
import com.vidnyan.cga.domain.model.Language;

import java.util.List;

/**
 * Port for finding direct table accesses in a source file.
 */
public interface DataAccessScanner {

    List<DataAccessFact> scan(String source, String file, Language language);
}
