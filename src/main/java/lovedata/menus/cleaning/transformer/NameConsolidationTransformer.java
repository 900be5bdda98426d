package lovedata.menus.cleaning.transformer;

import lombok.extern.slf4j.Slf4j;
import lovedata.menus.cleaning.model.MenuFields;
import lovedata.menus.cleaning.model.RawMenuRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Folds the three overlapping name columns into a single {@code name}.
 *
 * Transformations applied to each candidate:
 * 1. Enclosing double quotes removed ("\"The Dakota\"" -> "The Dakota")
 * 2. Placeholder text ("not given", ...) -> NULL
 * 3. location: trailing "; The" moved to the front
 * 4. sponsor: bracket/backslash noise removed, upper-cased, trailing "; THE" moved to the front
 *
 * The first non-null candidate in priority order wins. Audit compares the
 * winner with the raw {@code name} column.
 */
@Slf4j
public class NameConsolidationTransformer implements ColumnTransformer<String> {

    private static final Set<String> CANDIDATE_FIELDS =
            Set.of(MenuFields.LOCATION, MenuFields.NAME, MenuFields.SPONSOR);

    private final List<String> priority;
    private final List<String> placeholders;

    public NameConsolidationTransformer(List<String> priority, List<String> placeholders) {
        if (priority == null || priority.isEmpty()) {
            throw new IllegalArgumentException("Name priority must list at least one column");
        }
        for (String field : priority) {
            if (!CANDIDATE_FIELDS.contains(field)) {
                throw new IllegalArgumentException("Unsupported name source column: " + field
                        + " (expected one of " + CANDIDATE_FIELDS + ")");
            }
        }
        this.priority = List.copyOf(priority);
        this.placeholders = placeholders == null ? Collections.emptyList() : List.copyOf(placeholders);
    }

    @Override
    public String getFieldName() {
        return MenuFields.NAME;
    }

    @Override
    public List<String> getSourceFields() {
        return new ArrayList<>(priority);
    }

    @Override
    public FieldResult<String> transform(RawMenuRecord record) {
        String rawName = record.get(MenuFields.NAME);
        boolean hadContent = false;

        for (String field : priority) {
            String raw = record.get(field);
            if (NormalizationPrimitives.blankToNull(raw) == null) {
                continue;
            }
            hadContent = true;
            String candidate = cleanCandidate(field, raw);
            if (candidate != null) {
                return FieldResult.of(rawName, candidate);
            }
        }

        // Every populated candidate was a placeholder
        if (hadContent) {
            return FieldResult.fallback(rawName, null);
        }
        return FieldResult.of(rawName, null);
    }

    String cleanCandidate(String field, String raw) {
        String value;
        if (MenuFields.SPONSOR.equals(field)) {
            value = NormalizationPrimitives.stripBracketedNoise(raw);
            value = NormalizationPrimitives.uppercaseFold(value);
            value = NormalizationPrimitives.placeholderToNull(value, placeholders);
            value = NormalizationPrimitives.moveTrailingArticle(value, "THE");
        } else {
            value = NormalizationPrimitives.stripEnclosingQuotes(raw);
            value = NormalizationPrimitives.placeholderToNull(value, placeholders);
            if (MenuFields.LOCATION.equals(field)) {
                value = NormalizationPrimitives.moveTrailingArticle(value, "The");
            }
        }
        return NormalizationPrimitives.blankToNull(NormalizationPrimitives.collapseWhitespace(value));
    }
}
