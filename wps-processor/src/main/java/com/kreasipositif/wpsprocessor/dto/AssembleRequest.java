package com.kreasipositif.wpsprocessor.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.HashSet;
import java.util.Set;

@Getter
@Setter
@NoArgsConstructor
@Schema(description = "Restricts line assembly to some employees; empty means the whole workforce")
public class AssembleRequest {

    @Schema(example = "[\"EMP-0001\", \"EMP-0002\"]")
    private Set<String> employeeRefs = new HashSet<>();
}
