package lovedata.menus.cleaning.model;

/**
 * Closed set of venue categories a cleaned menu may carry.
 */
public enum VenueCategory {
    COMMERCIAL,
    SOCIAL,
    GOVERNMENT,
    MILITARY,
    EDUCATIONAL,
    PROFESSIONAL,
    FOREIGN;

    public static boolean isValid(String value) {
        if (value == null) {
            return false;
        }
        for (VenueCategory category : values()) {
            if (category.name().equals(value)) {
                return true;
            }
        }
        return false;
    }
}
