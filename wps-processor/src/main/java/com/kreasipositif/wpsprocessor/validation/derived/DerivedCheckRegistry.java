package com.kreasipositif.wpsprocessor.validation.derived;

import com.kreasipositif.wpsprocessor.exception.InvalidRuleDefinitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Looks up {@link DerivedCheck} beans by name.
 */
@Slf4j
@Component
public class DerivedCheckRegistry {

    private final Map<String, DerivedCheck> checks;

    public DerivedCheckRegistry(List<DerivedCheck> checks) {
        this.checks = checks.stream().collect(Collectors.toUnmodifiableMap(DerivedCheck::name, Function.identity()));
        log.info("Registered {} derived validation checks: {}", this.checks.size(), this.checks.keySet());
    }

    public Optional<DerivedCheck> find(String name) {
        return Optional.ofNullable(checks.get(name));
    }

    public DerivedCheck require(String name) {
        return find(name).orElseThrow(() -> new InvalidRuleDefinitionException(
                "Unknown derived check '%s' (known: %s)".formatted(name, checks.keySet())));
    }

    public Set<String> names() {
        return checks.keySet();
    }
}
