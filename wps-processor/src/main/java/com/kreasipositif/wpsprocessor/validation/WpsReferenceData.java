package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.client.BankDirectory;
import com.kreasipositif.wpsprocessor.config.WpsProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reference collections for REFERENCE rules: {@value #BANK_ROUTING_CODES} is answered by the
 * bank registry, every other collection comes from {@code wps.reference-data}. Unknown
 * collections contain nothing.
 */
@Component
public class WpsReferenceData implements ReferenceData {

    public static final String BANK_ROUTING_CODES = "bank-routing-codes";

    private final BankDirectory bankDirectory;
    private final Map<String, Set<String>> staticCollections;

    public WpsReferenceData(BankDirectory bankDirectory, WpsProperties properties) {
        this.bankDirectory = bankDirectory;
        this.staticCollections = properties.getReferenceData().entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> Set.copyOf(nonNull(e.getValue()))));
    }

    @Override
    public boolean contains(String collection, String value) {
        if (BANK_ROUTING_CODES.equals(collection)) {
            return bankDirectory.isKnownRoutingCode(value);
        }
        return staticCollections.getOrDefault(collection, Set.of()).contains(value);
    }

    @Override
    public Set<String> collections() {
        Set<String> names = new LinkedHashSet<>(staticCollections.keySet());
        names.add(BANK_ROUTING_CODES);
        return names;
    }

    private static List<String> nonNull(List<String> values) {
        return values == null ? List.of() : values;
    }
}
