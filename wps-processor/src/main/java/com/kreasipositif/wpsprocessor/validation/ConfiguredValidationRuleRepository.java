package com.kreasipositif.wpsprocessor.validation;

import com.kreasipositif.wpsprocessor.config.WpsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Rule repository seeded from {@code wps.validation.rules}. The rule set can be replaced at
 * runtime; the replacement is built and checked in full before it becomes visible, and readers
 * always see one complete set.
 */
@Slf4j
@Component
public class ConfiguredValidationRuleRepository implements ValidationRuleRepository {

    private static final Comparator<ValidationRule> ORDER =
            Comparator.comparingInt(ValidationRule::getSequence).thenComparing(ValidationRule::getCode);

    private final ValidationRuleFactory factory;
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public ConfiguredValidationRuleRepository(ValidationRuleFactory factory, WpsProperties properties) {
        this.factory = factory;
        replaceAll(properties.getValidation().getRules());
    }

    @Override
    public List<ValidationRule> listActiveRules(RuleScope scope) {
        return current.get().rules().stream()
                .filter(ValidationRule::isActive)
                .filter(r -> r.getScope() == scope)
                .toList();
    }

    @Override
    public List<ValidationRule> listActiveRules() {
        return current.get().rules().stream()
                .filter(ValidationRule::isActive)
                .toList();
    }

    public List<ValidationRuleDefinition> listDefinitions() {
        return current.get().definitions();
    }

    public void replaceAll(List<ValidationRuleDefinition> definitions) {
        List<ValidationRule> rules = factory.build(definitions).stream().sorted(ORDER).toList();
        current.set(new Snapshot(List.copyOf(definitions), rules));
        log.info("Loaded {} validation rule(s), {} active", rules.size(),
                rules.stream().filter(ValidationRule::isActive).count());
    }

    private record Snapshot(List<ValidationRuleDefinition> definitions, List<ValidationRule> rules) {
    }
}
