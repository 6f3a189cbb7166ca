package com.kreasipositif.wpsprocessor.sif;

import java.util.List;

/**
 * A parsed SIF file: one header followed by its salary detail records, in file order.
 */
public record SifDocument(SifHeader header, List<SifDetail> details) {

    public SifDocument {
        details = List.copyOf(details);
    }
}
