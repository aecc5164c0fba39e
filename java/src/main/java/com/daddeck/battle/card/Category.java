package com.daddeck.battle.card;

/**
 * The fifteen dad types a card can belong to.
 * Declaration order is the tie-break order wherever a dominant category is picked.
 */
public enum Category {
    BBQ_DICKTATOR("BBQ Dicktator"),
    FIX_IT_FUCKBOY("Fix-It Fuckboy"),
    GOLF_GONAD("Golf Gonad"),
    COUCH_CUMMANDER("Couch Cummander"),
    LAWN_LUNATIC("Lawn Lunatic"),
    CAR_COCK("Car Cock"),
    OFFICE_ORGASMS("Office Orgasms"),
    COOL_CUCKS("Cool Cucks"),
    COACH_CUMSTERS("Coach Cumsters"),
    CHEF_CUMSTERS("Chef Cumsters"),
    HOLIDAY_HORNDOGS("Holiday Horndogs"),
    WAREHOUSE_WANKERS("Warehouse Wankers"),
    VINTAGE_VAGABONDS("Vintage Vagabonds"),
    FASHION_FUCK("Fashion Fuck"),
    TECH_TWATS("Tech Twats");

    private final String displayName;

    Category(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * First word of the identifier, used for theme names ("BBQ" for BBQ_DICKTATOR).
     */
    public String getPrefix() {
        String name = name();
        if (name.startsWith("FIX_IT_")) {
            return "FIX_IT";
        }
        int idx = name.indexOf('_');
        return idx == -1 ? name : name.substring(0, idx);
    }
}
