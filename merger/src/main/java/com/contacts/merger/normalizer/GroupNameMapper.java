package com.contacts.merger.normalizer;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps the free-text group labels of the address-book export (some of them Arabic legacy
 * labels) onto the canonical label set.
 */
public final class GroupNameMapper {

    public static final String GROUP_DELIMITER = ":::";
    public static final String MY_CONTACTS = "* myContacts";
    public static final String DEFAULT_NEW_GROUP = "🧪 Lab ::: * myContacts";

    private static final String STARRED_SUFFIX = "::: * starred";
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    // substring replacement: a key must come before any shorter key it contains
    private static final Map<String, String> GROUP_MAP = new LinkedHashMap<>();

    static {
        GROUP_MAP.put("شركات ومندوبين ::: * myContacts", "🏢 Companies & Agents ::: * myContacts");
        GROUP_MAP.put("* family ::: * myContacts", "👨‍👩‍👧‍👦 Family ::: * myContacts");
        GROUP_MAP.put("lab ::: * myContacts", DEFAULT_NEW_GROUP);
        GROUP_MAP.put("اطباء ::: * myContacts", "🧑‍⚕️ Doctors ::: * myContacts");
        GROUP_MAP.put("وظائف ::: * myContacts", "💼 Jobs ::: * myContacts");
        GROUP_MAP.put("شخصي ::: * myContacts", "🏠 Personal ::: * myContacts");
    }

    private GroupNameMapper() {
    }

    public static String normalize(String raw) {
        String value = (raw == null ? "" : raw).trim().replace(STARRED_SUFFIX, "").trim();
        for (Map.Entry<String, String> entry : GROUP_MAP.entrySet()) {
            if (value.contains(entry.getKey())) {
                value = value.replace(entry.getKey(), entry.getValue());
            }
        }
        return value;
    }

    /**
     * @return true when one of the {@value #GROUP_DELIMITER}-separated labels mentions the
     * marker word, i.e. the record belongs to the group the merge is allowed to modify
     */
    public static boolean isMarkerGroup(String raw) {
        if (raw == null) {
            return false;
        }
        String marker = NameNormalizer.MARKER.toLowerCase(Locale.ROOT);
        for (String token : raw.split(Pattern.quote(GROUP_DELIMITER), -1)) {
            String cleaned = PUNCTUATION.matcher(token.trim().toLowerCase(Locale.ROOT)).replaceAll("");
            if (cleaned.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
