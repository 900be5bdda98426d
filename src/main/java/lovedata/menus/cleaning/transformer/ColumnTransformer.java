package lovedata.menus.cleaning.transformer;

import lovedata.menus.cleaning.model.RawMenuRecord;

import java.util.List;

/**
 * Cleaning rule for one semantic field of a menu record.
 *
 * Implementations are built by {@code ColumnTransformerRegistry} from the
 * {@code cleaning.*} configuration and the loaded mapping tables. They must be:
 * - total: never throw on content, resolve every defect to a defined fallback
 * - pure: read the raw record only, hold no state that changes between calls
 * - thread-safe: one instance is shared by every worker shard of a run
 *
 * @param <T> type of the cleaned value
 */
public interface ColumnTransformer<T> {

    /**
     * Field name this transformer reports under in the audit report.
     */
    String getFieldName();

    /**
     * Clean the field for a single record.
     *
     * @param record raw source record (never modified)
     * @return new value plus audit information (never null)
     */
    FieldResult<T> transform(RawMenuRecord record);

    /**
     * Source columns the transformer reads. Every one of them must exist in
     * the raw record set or the run aborts as structurally defective.
     */
    default List<String> getSourceFields() {
        return List.of(getFieldName());
    }
}
