package com.kreasipositif.wpsprocessor.controller;

import com.kreasipositif.wpsprocessor.validation.ConfiguredValidationRuleRepository;
import com.kreasipositif.wpsprocessor.validation.ValidationRuleDefinition;
import com.kreasipositif.wpsprocessor.validation.derived.DerivedCheckRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Set;

@Slf4j
@RestController
@RequestMapping("/api/v1/wps/validation-rules")
@RequiredArgsConstructor
@Tag(name = "Validation Rules", description = "Inspect and replace the declarative rule set")
public class ValidationRuleController {

    private final ConfiguredValidationRuleRepository ruleRepository;
    private final DerivedCheckRegistry derivedChecks;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List rule definitions")
    public ResponseEntity<List<ValidationRuleDefinition>> list() {
        return ResponseEntity.ok(ruleRepository.listDefinitions());
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Replace the rule set",
            description = """
                    The new set is built and checked in full before it replaces the current one;
                    an unknown field or derived check rejects the whole request (400).
                    Evaluations already running keep the rules they started with.
                    """)
    public ResponseEntity<List<ValidationRuleDefinition>> replace(
            @RequestBody List<ValidationRuleDefinition> definitions) {
        ruleRepository.replaceAll(definitions);
        log.info("Validation rule set replaced over REST: {} rule(s)", definitions.size());
        return ResponseEntity.ok(ruleRepository.listDefinitions());
    }

    @GetMapping(value = "/derived-checks", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Names of the derived checks usable by CALCULATION, BUSINESS and COMPLIANCE rules")
    public ResponseEntity<Set<String>> derivedChecks() {
        return ResponseEntity.ok(derivedChecks.names());
    }
}
