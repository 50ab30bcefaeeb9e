package com.eligibility.config;

import com.eligibility.exception.ConfigurationException;
import com.eligibility.exception.InvalidExpressionException;
import com.eligibility.expression.ExpressionJson;
import com.eligibility.expression.ExpressionValidator;
import com.eligibility.expression.ValidationResult;
import com.eligibility.rule.Requirement;
import com.eligibility.rule.RuleVersion;
import com.eligibility.rule.version.Conflict;
import com.eligibility.rule.version.ConflictDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the rule catalogue from YAML files.
 * <p>
 * Requirements carry either a JSON-logic {@code expression} (a YAML map or a
 * JSON string) or a text {@code condition-expr}. Every expression is
 * validated and published versions of a rule set must not overlap; any
 * problem fails the load.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load the catalogue from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the catalogue file
     * @return Loaded catalogue
     */
    public static RuleCatalog load(String path) {
        return load(path, new ExpressionValidator());
    }

    /**
     * Load the catalogue, validating expressions with the given limits.
     */
    public static RuleCatalog load(String path, ExpressionValidator validator) {
        log.info("Loading rule catalogue from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream, validator);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load rule catalogue from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    private static RuleCatalog parseYaml(InputStream inputStream, ExpressionValidator validator) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Rule catalogue is empty");
        }

        // The catalogue could be at root or under 'eligibility' key
        Map<String, Object> catalogue = root.containsKey("eligibility")
                ? (Map<String, Object>) root.get("eligibility")
                : root;

        String name = getString(catalogue, "name", "default-catalogue");
        String version = getString(catalogue, "version", "1.0");
        Instant loadedAt = Instant.now();

        List<Map<String, Object>> ruleSetList = (List<Map<String, Object>>) catalogue.get("rule-sets");
        if (ruleSetList == null || ruleSetList.isEmpty()) {
            log.warn("No rule-sets configured in catalogue {}", name);
            ruleSetList = List.of();
        }

        Map<String, List<RuleVersion>> ruleSets = new LinkedHashMap<>();
        Set<String> versionIds = new HashSet<>();
        int declared = 0;
        for (Map<String, Object> ruleSetMap : ruleSetList) {
            String ruleSetId = getString(ruleSetMap, "id", null);
            if (ruleSetId == null || ruleSetId.isBlank()) {
                throw new ConfigurationException("Rule set without id in catalogue " + name);
            }
            if (ruleSets.containsKey(ruleSetId)) {
                throw new ConfigurationException("Duplicate rule set id '" + ruleSetId + "'");
            }

            List<Map<String, Object>> versionList = (List<Map<String, Object>>) ruleSetMap.get("versions");
            List<RuleVersion> versions = new ArrayList<>();
            if (versionList != null) {
                for (Map<String, Object> versionMap : versionList) {
                    // creation order follows declaration order
                    Instant createdAt = loadedAt.plusMillis(declared++);
                    RuleVersion ruleVersion = parseVersion(ruleSetId, versionMap, createdAt, validator);
                    if (!versionIds.add(ruleVersion.id())) {
                        throw new ConfigurationException("Duplicate rule version id '" + ruleVersion.id() + "'");
                    }
                    versions.add(ruleVersion);
                }
            }

            List<Conflict> conflicts = ConflictDetector.publishedConflicts(versions);
            if (!conflicts.isEmpty()) {
                throw new ConfigurationException("Rule set '" + ruleSetId
                        + "' has overlapping published versions: " + conflicts);
            }
            ruleSets.put(ruleSetId, versions);
            log.debug("Parsed rule set {} with {} versions", ruleSetId, versions.size());
        }

        RuleCatalog result = new RuleCatalog(name, version, ruleSets);
        log.info("Loaded rule catalogue: {} v{} with {} rule sets, {} versions",
                name, version, ruleSets.size(), result.allVersions().size());
        return result;
    }

    @SuppressWarnings("unchecked")
    private static RuleVersion parseVersion(String ruleSetId, Map<String, Object> map, Instant createdAt,
                                            ExpressionValidator validator) {
        String id = getString(map, "id", null);
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Rule set '" + ruleSetId + "' has a version without id");
        }
        LocalDate from = getDate(map, "effective-from");
        if (from == null) {
            throw new ConfigurationException("Rule version '" + id + "' has no effective-from");
        }
        LocalDate to = getDate(map, "effective-to");
        if (to != null && to.isBefore(from)) {
            throw new ConfigurationException("Rule version '" + id + "' ends (" + to
                    + ") before it starts (" + from + ")");
        }
        boolean published = getBoolean(map, "published", false);
        long monotonicVersion = getLong(map, "monotonic-version", 1);

        List<Map<String, Object>> requirementList = (List<Map<String, Object>>) map.get("requirements");
        List<Requirement> requirements = new ArrayList<>();
        Set<String> codes = new HashSet<>();
        if (requirementList != null) {
            for (Map<String, Object> requirementMap : requirementList) {
                Requirement requirement = parseRequirement(id, requirementMap, validator);
                if (!codes.add(requirement.code())) {
                    throw new ConfigurationException("Rule version '" + id + "' has duplicate requirement code '"
                            + requirement.code() + "'");
                }
                requirements.add(requirement);
            }
        }
        if (requirements.isEmpty()) {
            log.warn("Rule version {} has no requirements; it can never produce an eligible verdict", id);
        }

        return new RuleVersion(id, ruleSetId, from, to, published, monotonicVersion, createdAt,
                published ? createdAt : null, requirements);
    }

    private static Requirement parseRequirement(String versionId, Map<String, Object> map,
                                                ExpressionValidator validator) {
        String code = getString(map, "code", null);
        if (code == null || code.isBlank()) {
            throw new ConfigurationException("Rule version '" + versionId + "' has a requirement without code");
        }
        String label = getString(map, "label", code);
        boolean mandatory = getBoolean(map, "mandatory", true);
        Object expression = parseExpressionBySyntax(versionId, code, map);

        ValidationResult validation = validator.validate(expression);
        if (!validation.ok()) {
            throw new ConfigurationException("Requirement '" + code + "' of rule version '" + versionId
                    + "' has an invalid expression: " + String.join("; ", validation.errors()));
        }
        return new Requirement(code, label, expression, mandatory);
    }

    private static Object parseExpressionBySyntax(String versionId, String code, Map<String, Object> map) {
        String conditionExpr = getString(map, "condition-expr", null);
        if (conditionExpr == null) {
            conditionExpr = getString(map, "conditionExpr", null);
        }
        boolean hasExpression = map.containsKey("expression");

        if (conditionExpr != null && hasExpression) {
            throw new ConfigurationException("Requirement '" + code + "' of rule version '" + versionId
                    + "' declares both expression and condition-expr");
        }
        if (conditionExpr != null) {
            try {
                return ConditionExpressionParser.parse(conditionExpr);
            } catch (InvalidExpressionException e) {
                throw new ConfigurationException("Requirement '" + code + "' of rule version '" + versionId
                        + "': " + e.getMessage(), e);
            }
        }
        if (!hasExpression) {
            throw new ConfigurationException("Requirement '" + code + "' of rule version '" + versionId
                    + "' needs an expression or condition-expr");
        }

        Object expression = map.get("expression");
        if (expression instanceof String json) {
            try {
                return ExpressionJson.parse(json);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Requirement '" + code + "' of rule version '" + versionId
                        + "': " + e.getMessage(), e);
            }
        }
        return expression;
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        return Long.parseLong(value.toString());
    }

    /**
     * Unquoted YAML dates arrive as {@link Date} at UTC midnight; quoted ones as ISO strings.
     */
    private static LocalDate getDate(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Date date) return date.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        if (value instanceof LocalDate date) return date;
        try {
            return LocalDate.parse(value.toString());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid date for " + key + ": '" + value + "'", e);
        }
    }
}
