package lovedata.menus.cleaning.model;

/**
 * ISO-4217 codes (including retired pre-euro codes) that appear in the
 * menu collection. Code normalization only; no rates are attached.
 */
public enum CurrencyCode {
    USD, // US Dollar
    GBP, // Pound Sterling
    EUR, // Euro
    JPY, // Yen
    BEF, // Belgian Franc
    CAD, // Canadian Dollar
    CZK, // Czech Koruna
    AED, // UAE Dirham
    DEM, // Deutsche Mark
    GRD, // Greek Drachma
    NLG, // Dutch Guilder
    FRF, // French Franc
    HUF, // Hungarian Forint
    IEP, // Irish Pound
    SEK, // Swedish Krona
    ITL, // Italian Lira
    FIM, // Finnish Markka
    TWD, // Taiwan Dollar
    ESP, // Spanish Peseta
    GTQ, // Guatemalan Quetzal
    SAR, // Saudi Riyal
    PEN, // Peruvian Sol
    PLN; // Polish Zloty

    public static boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        for (CurrencyCode code : values()) {
            if (code.name().equals(value)) {
                return true;
            }
        }
        return false;
    }
}
