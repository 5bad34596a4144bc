package com.vidnyan.codeguard.adapter.out.pattern;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vidnyan.codeguard.domain.exception.PatternConfigurationException;
import com.vidnyan.codeguard.domain.model.Severity;
import com.vidnyan.codeguard.domain.model.ViolationType;
import com.vidnyan.codeguard.domain.pattern.CodingStandards;
import com.vidnyan.codeguard.domain.pattern.DefensivePatterns;
import com.vidnyan.codeguard.domain.pattern.ExternalCallSpec;
import com.vidnyan.codeguard.domain.pattern.IntegrationSettings;
import com.vidnyan.codeguard.domain.pattern.OperationRequirement;
import com.vidnyan.codeguard.domain.pattern.PatternLibrary;
import com.vidnyan.codeguard.domain.pattern.PatternRule;
import com.vidnyan.codeguard.domain.pattern.RequiredElement;
import com.vidnyan.codeguard.domain.pattern.SecurityPatterns;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the pattern library from a YAML or JSON file.
 * <p>
 * A missing or malformed file falls back to {@link PatternLibrary#builtInDefaults()};
 * a valid file may leave out whole sections or single keys, which then keep their
 * built-in values.
 */
@Slf4j
@Component
public class PatternLibraryLoader {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final ResourceLoader resourceLoader = new DefaultResourceLoader();

    @Value("${codeguard.patterns.location:classpath:patterns/default-patterns.yml}")
    private String location = "classpath:patterns/default-patterns.yml";

    public PatternLibraryLoader(ObjectMapper objectMapper) {
        this.jsonMapper = configure(objectMapper.copy());
        this.yamlMapper = configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
    }

    public PatternLibrary load() {
        return load(location);
    }

    /**
     * Load from a Spring resource location ({@code classpath:}, {@code file:} or a plain path).
     */
    public PatternLibrary load(String resourceLocation) {
        try {
            PatternLibrary library = parse(resourceLocation);
            log.info("Loaded {} pattern rules from {}", library.ruleCount(), resourceLocation);
            return library;
        } catch (PatternConfigurationException e) {
            log.warn("Falling back to built-in patterns: {}", e.getMessage());
            return PatternLibrary.builtInDefaults();
        }
    }

    PatternLibrary parse(String resourceLocation) {
        Resource resource = resourceLoader.getResource(resourceLocation);
        if (!resource.exists()) {
            throw new PatternConfigurationException("Pattern file not found: " + resourceLocation);
        }
        ObjectMapper mapper = resourceLocation.endsWith(".json") ? jsonMapper : yamlMapper;
        PatternFileDto dto;
        try (InputStream in = resource.getInputStream()) {
            dto = mapper.readValue(in, PatternFileDto.class);
        } catch (IOException e) {
            throw new PatternConfigurationException("Malformed pattern file " + resourceLocation + ": "
                    + e.getMessage(), e);
        }
        if (dto == null) {
            throw new PatternConfigurationException("Empty pattern file: " + resourceLocation);
        }
        try {
            return mapToLibrary(dto, resourceLocation);
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new PatternConfigurationException("Invalid pattern file " + resourceLocation + ": "
                    + e.getMessage(), e);
        }
    }

    PatternLibrary mapToLibrary(PatternFileDto dto, String source) {
        PatternLibrary defaults = PatternLibrary.builtInDefaults();
        return new PatternLibrary(
                dto.businessLogicPatterns != null ? mapBusinessRules(dto.businessLogicPatterns) : defaults.businessRules(),
                dto.integrationFailures != null ? mapIntegrationRules(dto.integrationFailures) : defaults.integrationRules(),
                dto.defensive != null ? mapDefensive(dto.defensive, defaults.defensive()) : defaults.defensive(),
                dto.errorHandlingRequirements != null
                        ? mapRequirements(dto.errorHandlingRequirements) : defaults.errorHandlingRequirements(),
                dto.security != null ? mapSecurity(dto.security, defaults.security()) : defaults.security(),
                dto.standards != null ? mapStandards(dto.standards, defaults.standards()) : defaults.standards(),
                dto.integration != null ? mapIntegration(dto.integration, defaults.integration()) : defaults.integration(),
                source);
    }

    /**
     * Elements from {@code required_elements}, or from {@code must_specify} given
     * either in the same map form or as a list of element names, each name being
     * its own keyword.
     */
    private Map<String, ElementDto> elementsOf(BusinessRuleDto dto) {
        if (dto.requiredElements != null && !dto.requiredElements.isEmpty()) {
            return dto.requiredElements;
        }
        Map<String, ElementDto> elements = new LinkedHashMap<>();
        JsonNode mustSpecify = dto.mustSpecify;
        if (mustSpecify == null || mustSpecify.isNull()) {
            return elements;
        }
        if (mustSpecify.isObject()) {
            return yamlMapper.convertValue(mustSpecify, new TypeReference<LinkedHashMap<String, ElementDto>>() { });
        }
        Iterable<JsonNode> items = mustSpecify.isArray() ? mustSpecify : List.of(mustSpecify);
        for (JsonNode item : items) {
            if (!item.isTextual() || item.asText().isBlank()) {
                throw new PatternConfigurationException("must_specify entries must be element names: " + item);
            }
            ElementDto element = new ElementDto();
            element.keywords = List.of(item.asText().strip());
            elements.put(item.asText().strip(), element);
        }
        return elements;
    }

    private Map<String, PatternRule> mapBusinessRules(Map<String, BusinessRuleDto> dtos) {
        Map<String, PatternRule> rules = new LinkedHashMap<>();
        dtos.forEach((id, dto) -> {
            if (dto == null || isEmpty(dto.detectionPattern)) {
                throw new PatternConfigurationException("Business rule '" + id + "' has no detection_pattern");
            }
            Map<String, ElementDto> declared = elementsOf(dto);
            if (declared.isEmpty()) {
                throw new PatternConfigurationException(
                        "Business rule '" + id + "' has no required_elements or must_specify");
            }
            List<RequiredElement> elements = new ArrayList<>();
            declared.forEach((name, element) -> {
                if (element == null || isEmpty(element.keywords)) {
                    throw new PatternConfigurationException(
                            "Required element '" + name + "' of rule '" + id + "' has no keywords");
                }
                Severity severity = element.severity != null ? Severity.parse(element.severity, null) : null;
                elements.add(new RequiredElement(name, element.keywords, severity, element.fixStrategy));
            });
            rules.put(id, new PatternRule(id, dto.description, dto.detectionPattern, elements,
                    Severity.parse(dto.severity, Severity.CRITICAL), dto.fixStrategy, dto.testGeneration));
        });
        return rules;
    }

    private Map<String, PatternRule> mapIntegrationRules(Map<String, IntegrationRuleDto> dtos) {
        Map<String, PatternRule> rules = new LinkedHashMap<>();
        dtos.forEach((id, dto) -> {
            if (dto == null) {
                throw new PatternConfigurationException("Integration rule '" + id + "' is empty");
            }
            rules.put(id, new PatternRule(id, dto.description, orEmpty(dto.detectionPattern), List.of(),
                    Severity.parse(dto.severity, Severity.WARNING), dto.fixStrategy, dto.testGeneration));
        });
        return rules;
    }

    private DefensivePatterns mapDefensive(DefensiveDto dto, DefensivePatterns defaults) {
        int lookback = dto.lookbackLines != null ? dto.lookbackLines : defaults.lookbackLines();
        if (lookback < 0) {
            throw new PatternConfigurationException("lookback_lines must not be negative: " + lookback);
        }
        List<ExternalCallSpec> externalCalls = defaults.externalCalls();
        if (dto.externalCalls != null) {
            externalCalls = new ArrayList<>();
            for (ExternalCallDto call : dto.externalCalls) {
                externalCalls.add(mapExternalCall(call));
            }
        }
        return new DefensivePatterns(
                lookback,
                orDefault(dto.safeAccessors, defaults.safeAccessors()),
                orDefault(dto.safeReceivers, defaults.safeReceivers()),
                orDefault(dto.allowedPackages, defaults.allowedPackages()),
                orDefault(dto.emptyUnsafeCalls, defaults.emptyUnsafeCalls()),
                externalCalls,
                dto.conversions != null ? dto.conversions : defaults.conversions());
    }

    private ExternalCallSpec mapExternalCall(ExternalCallDto dto) {
        if (dto == null || dto.call == null || dto.call.isBlank()) {
            throw new PatternConfigurationException("external_calls entry without a call");
        }
        ViolationType type;
        try {
            type = dto.type != null ? ViolationType.fromId(dto.type) : ViolationType.EXTERNAL_CALL_SAFETY;
        } catch (IllegalArgumentException e) {
            throw new PatternConfigurationException(e.getMessage(), e);
        }
        return new ExternalCallSpec(dto.call.trim(), type, orEmpty(dto.timeoutMarkers),
                dto.minArgs != null ? dto.minArgs : 0,
                dto.description != null ? dto.description : "External call without a timeout");
    }

    private List<OperationRequirement> mapRequirements(Map<String, OperationDto> dtos) {
        List<OperationRequirement> requirements = new ArrayList<>();
        dtos.forEach((id, dto) -> {
            if (dto == null || (isEmpty(dto.methods) && isEmpty(dto.constructors))) {
                throw new PatternConfigurationException(
                        "Error handling requirement '" + id + "' has no methods or constructors");
            }
            requirements.add(new OperationRequirement(id, orEmpty(dto.receivers), orEmpty(dto.methods),
                    orEmpty(dto.constructors), Boolean.TRUE.equals(dto.acceptResources),
                    Severity.parse(dto.severity, Severity.CRITICAL),
                    dto.fixStrategy != null ? dto.fixStrategy : "Wrap the call in try/catch"));
        });
        return requirements;
    }

    private SecurityPatterns mapSecurity(SecurityDto dto, SecurityPatterns defaults) {
        return new SecurityPatterns(
                dto.sqlKeywords != null ? dto.sqlKeywords : defaults.sqlKeywords(),
                dto.piiKeywords != null ? dto.piiKeywords : defaults.piiKeywords(),
                orDefault(dto.loggerMethods, defaults.loggerMethods()),
                orDefault(dto.printCalls, defaults.printCalls()),
                orDefault(dto.endpointAnnotations, defaults.endpointAnnotations()),
                orDefault(dto.authorizationAnnotations, defaults.authorizationAnnotations()),
                orDefault(dto.publicEndpoints, defaults.publicEndpoints()));
    }

    private CodingStandards mapStandards(StandardsDto dto, CodingStandards defaults) {
        return new CodingStandards(
                orDefault(dto.errorCodes, defaults.errorCodes()),
                dto.timeoutsSeconds != null ? new HashSet<>(dto.timeoutsSeconds) : defaults.timeoutsSeconds(),
                orDefault(dto.unixTimestampCalls, defaults.unixTimestampCalls()),
                dto.datetimePatternPrefix != null ? dto.datetimePatternPrefix : defaults.datetimePatternPrefix());
    }

    private IntegrationSettings mapIntegration(IntegrationDto dto, IntegrationSettings defaults) {
        return new IntegrationSettings(
                dto.timeoutOverheadSeconds != null ? dto.timeoutOverheadSeconds : defaults.timeoutOverheadSeconds(),
                dto.errorHandlingKeywords != null ? dto.errorHandlingKeywords : defaults.errorHandlingKeywords(),
                dto.retryKeywords != null ? dto.retryKeywords : defaults.retryKeywords());
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }

    private static Set<String> orDefault(List<String> values, Set<String> defaults) {
        return values != null ? new HashSet<>(values) : defaults;
    }

    // DTO classes for YAML/JSON deserialization
    static class PatternFileDto {
        public Map<String, BusinessRuleDto> businessLogicPatterns;
        public Map<String, IntegrationRuleDto> integrationFailures;
        public DefensiveDto defensive;
        public Map<String, OperationDto> errorHandlingRequirements;
        public SecurityDto security;
        public StandardsDto standards;
        public IntegrationDto integration;
    }

    static class BusinessRuleDto {
        public String description;
        public List<String> detectionPattern;
        public String severity;
        public Map<String, ElementDto> requiredElements;
        public JsonNode mustSpecify;
        public String fixStrategy;
        public String testGeneration;
    }

    static class ElementDto {
        public List<String> keywords;
        public String severity;
        public String fixStrategy;
    }

    static class IntegrationRuleDto {
        public String description;
        public List<String> detectionPattern;
        public String severity;
        public String fixStrategy;
        public String testGeneration;
    }

    static class DefensiveDto {
        public Integer lookbackLines;
        public List<String> safeAccessors;
        public List<String> safeReceivers;
        public List<String> allowedPackages;
        public List<String> emptyUnsafeCalls;
        public List<ExternalCallDto> externalCalls;
        public List<String> conversions;
    }

    static class ExternalCallDto {
        public String call;
        public String type;
        public List<String> timeoutMarkers;
        public Integer minArgs;
        public String description;
    }

    static class OperationDto {
        public List<String> receivers;
        public List<String> methods;
        public List<String> constructors;
        public Boolean acceptResources;
        public String severity;
        public String fixStrategy;
    }

    static class SecurityDto {
        public List<String> sqlKeywords;
        public List<String> piiKeywords;
        public List<String> loggerMethods;
        public List<String> printCalls;
        public List<String> endpointAnnotations;
        public List<String> authorizationAnnotations;
        public List<String> publicEndpoints;
    }

    static class StandardsDto {
        public List<String> errorCodes;
        public List<Integer> timeoutsSeconds;
        public List<String> unixTimestampCalls;
        public String datetimePatternPrefix;
    }

    static class IntegrationDto {
        public Integer timeoutOverheadSeconds;
        public List<String> errorHandlingKeywords;
        public List<String> retryKeywords;
    }
}
