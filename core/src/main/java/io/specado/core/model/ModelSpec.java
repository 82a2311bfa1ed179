package io.specado.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One model declared by a provider spec.
 *
 * <p>
 * Endpoint and input-mode collections are enum-keyed so iteration order is
 * the enum declaration order, independent of document order.
 *
 * @param id                    model identifier, unique within the provider
 * @param aliases               alternative identifiers
 * @param family                model family
 * @param endpoints             declared endpoints by capability
 * @param inputModes            input modes set to {@code true}
 * @param toolsSupported        whether function tools are accepted
 * @param jsonNativeParam       whether {@code response_format} is a native
 *                              parameter
 * @param jsonStrategy          structured output strategy
 * @param systemPromptLocation  where the system prompt goes
 * @param constraints           request constraints, never null
 * @param fieldMappings         canonical body field to provider field name
 * @param responseNormalization response paths, may be null
 */
public record ModelSpec(
        String id,
        List<String> aliases,
        String family,
        Map<Capability, EndpointDescriptor> endpoints,
        Set<InputMode> inputModes,
        boolean toolsSupported,
        boolean jsonNativeParam,
        JsonOutputStrategy jsonStrategy,
        SystemPromptLocation systemPromptLocation,
        ModelConstraints constraints,
        Map<String, String> fieldMappings,
        ResponseNormalization responseNormalization) {

    public ModelSpec {
        Objects.requireNonNull(id, "model id must not be null");
        aliases = aliases != null ? List.copyOf(aliases) : List.of();
        Map<Capability, EndpointDescriptor> endpointCopy = new EnumMap<>(Capability.class);
        if (endpoints != null) {
            endpointCopy.putAll(endpoints);
        }
        endpoints = Collections.unmodifiableMap(endpointCopy);
        Set<InputMode> modeCopy = EnumSet.noneOf(InputMode.class);
        if (inputModes != null) {
            modeCopy.addAll(inputModes);
        }
        inputModes = Collections.unmodifiableSet(modeCopy);
        jsonStrategy = jsonStrategy != null ? jsonStrategy : JsonOutputStrategy.NONE;
        systemPromptLocation = systemPromptLocation != null ? systemPromptLocation : SystemPromptLocation.MESSAGES;
        constraints = constraints != null ? constraints : ModelConstraints.NONE;
        fieldMappings = fieldMappings != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(fieldMappings))
                : Map.of();
    }
}
