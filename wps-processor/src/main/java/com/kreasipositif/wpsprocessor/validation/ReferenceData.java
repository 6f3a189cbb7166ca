package com.kreasipositif.wpsprocessor.validation;

import java.util.Set;

/**
 * Named lookup collections consulted by REFERENCE rules (e.g. {@code bank-routing-codes}).
 */
public interface ReferenceData {

    boolean contains(String collection, String value);

    Set<String> collections();
}
