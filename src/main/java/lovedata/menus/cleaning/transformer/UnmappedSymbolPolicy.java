package lovedata.menus.cleaning.transformer;

/**
 * What to emit for a currency symbol the symbol table does not know.
 * Either way the symbol is reported as unmapped.
 */
public enum UnmappedSymbolPolicy {

    /** Keep the cleaned symbol as the currency code. */
    PASS_THROUGH,

    /** Emit NULL so currency_code stays inside the known code set. */
    REJECT_TO_NULL
}
