package com.hierarchy.federation.ingest;

import com.fasterxml.jackson.databind.JsonNode;
import com.hierarchy.federation.api.FederationOptions;
import com.hierarchy.federation.core.model.LadderLevel;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.RecordKey;
import com.hierarchy.federation.core.model.SourceSystems;
import com.hierarchy.federation.rules.DefaultNormalizationRules;
import com.hierarchy.federation.rules.NormalizationEngine;
import com.hierarchy.federation.rules.Role;
import com.hierarchy.federation.rules.TitleCanonicalizer;
import com.hierarchy.federation.rules.TitleClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps one raw source record onto the canonical {@link PersonRecord}.
 *
 * <p>The mapping is pure: the same raw record and source tag always produce
 * an equal record. Identifiers are taken from the source as-is and never
 * generated here; a record without an identifier or a name is rejected with
 * a {@link ValidationException}.</p>
 */
public class RecordNormalizer {
    private static final Logger log = LoggerFactory.getLogger(RecordNormalizer.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NormalizationEngine nameEngine;
    private final TitleClassifier titleClassifier;
    private final Map<String, SourceSchema> schemas;

    public RecordNormalizer(NormalizationEngine nameEngine, TitleClassifier titleClassifier,
                            Map<String, SourceSchema> schemas) {
        this.nameEngine = nameEngine;
        this.titleClassifier = titleClassifier;
        this.schemas = Map.copyOf(schemas);
    }

    /**
     * Creates a normalizer from the title tables and schemas of the given options.
     */
    public static RecordNormalizer from(FederationOptions options) {
        TitleClassifier classifier = new TitleClassifier(
                new TitleCanonicalizer(options.getTitleSynonyms()),
                options.getLeadershipKeywords(),
                options.getManagerKeywords());
        return new RecordNormalizer(DefaultNormalizationRules.createDefaultEngine(), classifier,
                options.getSourceSchemas());
    }

    public PersonRecord normalize(JsonNode raw, String sourceSystem) {
        return normalize(raw, sourceSystem, -1);
    }

    /**
     * Normalizes one record.
     *
     * @param raw          the record in its source-native shape
     * @param sourceSystem the source tag
     * @param position     position of the record in its snapshot, used for error reporting
     * @throws ValidationException when the record cannot be identified
     */
    public PersonRecord normalize(JsonNode raw, String sourceSystem, int position) {
        if (sourceSystem == null || sourceSystem.isBlank()) {
            throw new IllegalArgumentException("sourceSystem is required");
        }
        if (raw == null || !raw.isObject()) {
            throw new ValidationException(sourceSystem, position, "Record is not an object");
        }
        SourceSchema schema = schemas.getOrDefault(sourceSystem, SourceSchema.defaults());

        String sourceId = scalar(raw, schema, SourceSchema.Field.ID);
        if (sourceId == null) {
            throw new ValidationException(sourceSystem, position, "Record has no source identifier");
        }
        String canonicalName = collapse(scalar(raw, schema, SourceSchema.Field.NAME));
        if (canonicalName == null) {
            throw new ValidationException(sourceSystem, position,
                    "Record " + sourceId + " has no name");
        }

        String title = collapse(scalar(raw, schema, SourceSchema.Field.TITLE));
        Integer level = level(raw, schema, sourceSystem, sourceId, position);

        if (SourceSystems.isLadder(sourceSystem)) {
            if (level == null) {
                level = LadderLevel.ofTitle(title).map(LadderLevel::level).orElseThrow(() ->
                        new ValidationException(sourceSystem, position,
                                "Ladder record " + sourceId + " has no level"));
            }
            if (!LadderLevel.isValid(level)) {
                throw new ValidationException(sourceSystem, position,
                        "Ladder record " + sourceId + " has level " + level + " outside "
                                + LadderLevel.MIN + ".." + LadderLevel.MAX);
            }
            if (title == null) {
                title = LadderLevel.ofLevel(level).map(LadderLevel::nativeTitle).orElse(null);
            }
        }

        String reportsToId = scalar(raw, schema, SourceSchema.Field.REPORTS_TO);
        List<String> aliases = aliases(raw, schema);
        Set<Role> roles = titleClassifier.classify(title);

        return PersonRecord.builder()
                .sourceSystem(sourceSystem)
                .sourceId(sourceId)
                .canonicalName(canonicalName)
                .normalizedNameKey(nameEngine.normalize(canonicalName))
                .title(title)
                .department(collapse(scalar(raw, schema, SourceSchema.Field.DEPARTMENT)))
                .level(level)
                .reportsTo(reportsToId != null ? RecordKey.of(sourceSystem, reportsToId) : null)
                .leadership(roles.contains(Role.LEADERSHIP))
                .manager(roles.contains(Role.MANAGER))
                .aliases(aliases)
                .normalizedAliasKeys(aliasKeys(aliases))
                .rawSource(raw)
                .build();
    }

    public NormalizationEngine getNameEngine() {
        return nameEngine;
    }

    public TitleClassifier getTitleClassifier() {
        return titleClassifier;
    }

    private Integer level(JsonNode raw, SourceSchema schema, String sourceSystem, String sourceId, int position) {
        JsonNode node = field(raw, schema, SourceSchema.Field.LEVEL).orElse(null);
        if (node == null) {
            return null;
        }
        // 3 and 3.0 are the same level; 3.5 is not a level
        if (node.isNumber() && node.canConvertToExactIntegral() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.textValue().trim());
            } catch (NumberFormatException e) {
                // Falls through to the malformed-level handling below
                log.debug("normalize.level.unparseable source={} id={} value='{}'",
                        sourceSystem, sourceId, node.textValue());
            }
        }
        if (SourceSystems.isLadder(sourceSystem)) {
            throw new ValidationException(sourceSystem, position,
                    "Ladder record " + sourceId + " has a malformed level");
        }
        return null;
    }

    private List<String> aliases(JsonNode raw, SourceSchema schema) {
        JsonNode node = field(raw, schema, SourceSchema.Field.ALIASES).orElse(null);
        if (node == null) {
            return List.of();
        }
        Set<String> aliases = new LinkedHashSet<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                String alias = collapse(element.isValueNode() && !element.isNull() ? element.asText() : null);
                if (alias != null) {
                    aliases.add(alias);
                }
            }
        } else if (node.isValueNode()) {
            String alias = collapse(node.asText());
            if (alias != null) {
                aliases.add(alias);
            }
        }
        return List.copyOf(aliases);
    }

    private List<String> aliasKeys(List<String> aliases) {
        List<String> keys = new ArrayList<>();
        for (String alias : aliases) {
            String key = nameEngine.normalize(alias);
            if (!key.isEmpty() && !keys.contains(key)) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static String scalar(JsonNode raw, SourceSchema schema, SourceSchema.Field field) {
        JsonNode node = field(raw, schema, field).orElse(null);
        if (node == null || !node.isValueNode()) {
            return null;
        }
        String text = node.isTextual() ? node.textValue() : node.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    private static Optional<JsonNode> field(JsonNode raw, SourceSchema schema, SourceSchema.Field field) {
        for (String name : schema.aliasesOf(field)) {
            JsonNode node = raw.get(name);
            if (node != null && !node.isNull() && !node.isMissingNode()) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    private static String collapse(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }
}
