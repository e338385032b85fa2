package com.contacts.merger.merge;

import com.contacts.merger.model.MergeResult;
import com.contacts.merger.model.PrimaryContact;
import com.contacts.merger.model.SecondaryContact;
import com.contacts.merger.normalizer.PhoneNormalizer;

import java.util.Collections;
import java.util.Map;

/**
 * Consolidates address-book contacts and secondary-source contacts into one deduplicated set.
 * <p>
 * The merge runs five ordered passes:
 * <ol>
 *     <li>seed the working set from the primary source and index every phone number;</li>
 *     <li>merge primary records sharing a comparison key;</li>
 *     <li>merge records sharing a phone number;</li>
 *     <li>fold each secondary record into the record it matches (by phone, then by name) or add
 *     it as a new record;</li>
 *     <li>merge by shared phone number again over the enlarged set.</li>
 * </ol>
 * When records merge, the surviving record is the first unprotected one of the group, otherwise
 * the first one. Group order is the primary-source order for name matches and lexicographic
 * display-name order for phone matches.
 * <p>
 * The engine itself holds no merge state; each call works on its own session and may run
 * concurrently with other calls.
 */
public class ContactMergeEngine {

    private final PhoneNormalizer phoneNormalizer;
    private final String defaultNewGroup;

    public ContactMergeEngine(PhoneNormalizer phoneNormalizer, String defaultNewGroup) {
        this.phoneNormalizer = phoneNormalizer;
        this.defaultNewGroup = defaultNewGroup;
    }

    public MergeResult merge(Map<String, PrimaryContact> primary, Map<String, SecondaryContact> secondary) {
        MergeSession session = new MergeSession(phoneNormalizer, defaultNewGroup);
        return session.run(
                primary == null ? Collections.emptyMap() : primary,
                secondary == null ? Collections.emptyMap() : secondary);
    }

    public PhoneNormalizer getPhoneNormalizer() {
        return phoneNormalizer;
    }

    public String getDefaultNewGroup() {
        return defaultNewGroup;
    }
}
