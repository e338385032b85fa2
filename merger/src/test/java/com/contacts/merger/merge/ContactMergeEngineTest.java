package com.contacts.merger.merge;

import com.contacts.merger.model.AuditEntry;
import com.contacts.merger.model.ContactRecord;
import com.contacts.merger.model.ContactSource;
import com.contacts.merger.model.MergeResult;
import com.contacts.merger.model.MergeSummary;
import com.contacts.merger.model.PrimaryContact;
import com.contacts.merger.model.ProtectedSkip;
import com.contacts.merger.model.SecondaryContact;
import com.contacts.merger.normalizer.GroupNameMapper;
import com.contacts.merger.normalizer.NameNormalizer;
import com.contacts.merger.normalizer.PhoneNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ContactMergeEngineTest {

    private ContactMergeEngine engine;
    private Map<String, PrimaryContact> primary;
    private Map<String, SecondaryContact> secondary;

    @BeforeEach
    void setUp() {
        engine = new ContactMergeEngine(new PhoneNormalizer("+20"), GroupNameMapper.DEFAULT_NEW_GROUP);
        primary = new LinkedHashMap<>();
        secondary = new LinkedHashMap<>();
    }

    @Test
    void mergesPrimaryRecordsSharingAComparisonKeyIntoTheUnprotectedOne() {
        primary.put("John Smith", primary(true, "+2099"));
        primary.put("John Smith Lab", primary(false, "+2011"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("John Smith Lab");
        ContactRecord record = result.getMerged().get("John Smith Lab");
        assertThat(record.getNumbers()).containsExactlyInAnyOrder("+2011", "+2099");
        assertThat(record.isProtectedRecord()).isTrue();
        assertThat(record.getDuplicates()).containsExactly("John Smith");
        assertThat(result.getAbsorptions()).isEqualTo(1);
    }

    @Test
    void canonicalThatAbsorbedAProtectedRecordIsNoLongerEnriched() {
        primary.put("John Smith", primary(true, "+2099"));
        primary.put("John Smith Lab", primary(false, "+2011"));
        secondary.put("John Smith Lab", secondary("John Smith", "+2077"));

        MergeResult result = engine.merge(primary, secondary);

        ContactRecord record = result.getMerged().get("John Smith Lab");
        assertThat(record.isProtectedRecord()).isTrue();
        assertThat(record.getNumbers()).containsExactlyInAnyOrder("+2011", "+2099");
        assertThat(result.getAuditLog()).isEmpty();
        assertThat(result.getProtectedSkips()).extracting(ProtectedSkip::getProtectedName)
                .containsExactly("John Smith Lab");
    }

    @Test
    void mergesPrimaryRecordsSharingAPhone() {
        primary.put("Bob", primary(true, "+201000000001"));
        primary.put("Alice Lab", primary(false, "+201000000001", "+201000000009"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Alice Lab");
        ContactRecord record = result.getMerged().get("Alice Lab");
        assertThat(record.getNumbers()).containsExactlyInAnyOrder("+201000000001", "+201000000009");
        assertThat(record.isProtectedRecord()).isTrue();
        assertThat(record.getDuplicates()).contains("Bob");
    }

    @Test
    void firstHolderWinsWhenAllAreProtected() {
        primary.put("Bea", primary(true, "+2055"));
        primary.put("Ann", primary(true, "+2055"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Ann");
        assertThat(result.getMerged().get("Ann").getDuplicates()).containsExactly("Bea");
    }

    @Test
    void blankComparisonKeysAreNotMergedByName() {
        primary.put("Lab", primary(false, "+2071"));
        primary.put("LAB", primary(false, "+2072"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Lab", "LAB");
    }

    @Test
    void secondaryMatchedByNameUpdatesUnprotectedRecordAndIsAudited() {
        PrimaryContact jane = primary(false, "+201111111");
        jane.setFirstName("Jane");
        jane.getFieldSnapshot().put("First Name", "Jane");
        jane.getFieldSnapshot().put("Phone 1 - Value", "+201111111");
        primary.put("Jane Doe Lab", jane);
        secondary.put("Jane Doe Lab", secondary("Jane Doe", "01222222"));

        MergeResult result = engine.merge(primary, secondary);

        ContactRecord record = result.getMerged().get("Jane Doe Lab");
        assertThat(record.getNumbers()).containsExactlyInAnyOrder("+201111111", "+201222222");
        assertThat(record.getSources()).containsExactlyInAnyOrder(ContactSource.PRIMARY, ContactSource.SECONDARY);
        assertThat(record.getLastName()).isEqualTo("Lab");
        assertThat(record.getFirstName()).isEqualTo("Jane");

        assertThat(result.getAuditLog()).hasSize(1);
        AuditEntry entry = result.getAuditLog().get(0);
        assertThat(entry.getPrimaryName()).isEqualTo("Jane Doe Lab");
        assertThat(entry.getOriginalPrimaryRow()).containsEntry("Phone 1 - Value", "+201111111");
        assertThat(entry.getUpdateData().getAddedNumbers()).containsExactly("+201222222");
        assertThat(entry.getUpdateData().isAddedFirstName()).isFalse();
        assertThat(entry.getUpdateData().isAddedLastName()).isTrue();
        assertThat(entry.getUpdateData().getSecondaryOriginalName()).isEqualTo("Jane Doe");
        assertThat(entry.getFinalRow().getPhones()).containsExactly("+201111111", "+201222222");
        assertThat(entry.getFinalRow().getSources()).isEqualTo("Primary & Secondary");
        assertThat(entry.getFinalRow().getDuplicates()).isEqualTo("Jane Doe");
        assertThat(entry.getFinalRow().getGroupMembership()).isEqualTo(GroupNameMapper.DEFAULT_NEW_GROUP);
    }

    @Test
    void secondaryMatchedByNameLeavesProtectedRecordUntouched() {
        primary.put("Jane Doe", primary(true, "+201111111"));
        secondary.put("Jane Doe Lab", secondary("Jane Doe", "01222222"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Jane Doe");
        ContactRecord record = result.getMerged().get("Jane Doe");
        assertThat(record.getNumbers()).containsExactly("+201111111");
        assertThat(record.getSources()).containsExactly(ContactSource.PRIMARY);
        assertThat(result.getAuditLog()).isEmpty();

        assertThat(result.getProtectedSkips()).hasSize(1);
        ProtectedSkip skip = result.getProtectedSkips().get(0);
        assertThat(skip.getSecondaryName()).isEqualTo("Jane Doe Lab");
        assertThat(skip.getProtectedName()).isEqualTo("Jane Doe");
        assertThat(skip.getMatchedBy()).isEqualTo("name");
        assertThat(skip.getIgnoredNumbers()).containsExactly("+201222222");
    }

    @Test
    void secondaryMatchedByPhoneOnProtectedRecordIsSkipped() {
        primary.put("Dr Khaled", primary(true, "+201000000002"));
        secondary.put("Khaled Lab", secondary("Khaled", "01000000002", "01000000003"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Dr Khaled");
        assertThat(result.getMerged().get("Dr Khaled").getNumbers()).containsExactly("+201000000002");
        assertThat(result.getProtectedSkips()).extracting(ProtectedSkip::getMatchedBy)
                .containsExactly("phone +201000000002");
    }

    @Test
    void secondaryMatchedByPhoneRecordsOriginalNameAsDuplicate() {
        primary.put("Omar Lab", primary(false, "+201000000001"));
        secondary.put("Different Name Lab", secondary("Different Name", "01000000001"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Omar Lab");
        assertThat(result.getMerged().get("Omar Lab").getDuplicates()).containsExactly("Different Name");
        assertThat(result.getAuditLog()).hasSize(1);
        assertThat(result.getAuditLog().get(0).getUpdateData().getAddedNumbers()).isEmpty();
    }

    @Test
    void nameLookupFollowsAbsorbedRecords() {
        primary.put("Sam Lab", primary(false, "+201"));
        primary.put("Zed Lab", primary(false, "+201"));
        secondary.put("Zed Lab", secondary("Zed", "+209"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Sam Lab");
        assertThat(result.getMerged().get("Sam Lab").getNumbers()).containsExactlyInAnyOrder("+201", "+209");
        assertThat(result.getAuditLog()).extracting(AuditEntry::getPrimaryName).containsExactly("Sam Lab");
    }

    @Test
    void unmatchedSecondaryBecomesNewRecordInDefaultGroup() {
        primary.put("Bob", primary(true, "+2011"));
        secondary.put("Nour Lab", secondary("Nour", "01000000007"));

        MergeResult result = engine.merge(primary, secondary);

        ContactRecord record = result.getMerged().get("Nour Lab");
        assertThat(record).isNotNull();
        assertThat(record.getGroups()).containsExactly(GroupNameMapper.DEFAULT_NEW_GROUP);
        assertThat(record.getSources()).containsExactly(ContactSource.SECONDARY);
        assertThat(record.isProtectedRecord()).isFalse();
        assertThat(record.hasFieldSnapshot()).isFalse();
    }

    @Test
    void secondaryRecordsSharingAPhoneCollapse() {
        secondary.put("Ali Lab", secondary("Ali", "01000000005"));
        secondary.put("Aly Lab", secondary("Aly", "01000000005"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Ali Lab");
        assertThat(result.getAuditLog()).hasSize(1);
        assertThat(result.getAuditLog().get(0).getOriginalPrimaryRow()).isNull();
    }

    @Test
    void secondaryRecordsDifferingOnlyInCaseStaySeparate() {
        secondary.put("Ali Lab", secondary("Ali", "01000000001"));
        secondary.put("ALI Lab", secondary("ALI", "01000000002"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).containsOnlyKeys("Ali Lab", "ALI Lab");
        assertThat(result.getMerged().get("ALI Lab").getDuplicates()).containsExactly("Ali Lab");
        assertThat(result.getAuditLog()).isEmpty();
    }

    @Test
    void secondaryWithoutUsableNumberIsDropped() {
        secondary.put("Nobody Lab", secondary("Nobody", "junk"));

        MergeResult result = engine.merge(primary, secondary);

        assertThat(result.getMerged()).isEmpty();
        assertThat(result.getDroppedSecondary()).isEqualTo(1);
    }

    @Test
    void repeatedMergeGivesSameResultAndLeavesInputsAlone() {
        primary.put("John Smith", primary(true, "+2099"));
        primary.put("John Smith Lab", primary(false, "+2011"));
        primary.put("Bob", primary(true, "+2011"));
        secondary.put("Nour Lab", secondary("Nour", "01000000007"));

        MergeResult first = engine.merge(primary, secondary);
        MergeResult second = engine.merge(primary, secondary);

        assertThat(second.getMerged().keySet()).containsExactlyElementsOf(first.getMerged().keySet());
        first.getMerged().forEach((name, record) ->
                assertThat(second.getMerged().get(name).getNumbers()).isEqualTo(record.getNumbers()));
        assertThat(primary.get("John Smith").getNumbers()).containsExactly("+2099");
    }

    @Test
    void mergingTheOutputAgainChangesNothing() {
        primary.put("John Smith", primary(true, "+2099"));
        primary.put("John Smith Lab", primary(false, "+2011"));
        primary.put("Omar Lab", primary(false, "+201000000001"));
        secondary.put("Different Name Lab", secondary("Different Name", "01000000001", "01000000008"));
        secondary.put("Nour Lab", secondary("Nour", "01000000007"));
        MergeResult first = engine.merge(primary, secondary);

        Map<String, PrimaryContact> again = new LinkedHashMap<>();
        first.getMerged().forEach((name, record) -> again.put(name, PrimaryContact.builder()
                .numbers(new LinkedHashSet<>(record.getNumbers()))
                .groups(new LinkedHashSet<>(record.getGroups()))
                .protectedRecord(record.isProtectedRecord())
                .comparisonKey(record.getComparisonKey())
                .build()));
        MergeResult second = engine.merge(again, new LinkedHashMap<>());

        assertThat(second.getAbsorptions()).isZero();
        assertThat(second.getAuditLog()).isEmpty();
        assertThat(second.getMerged().keySet()).containsExactlyElementsOf(first.getMerged().keySet());
    }

    @Test
    void nullSourcesAreTreatedAsEmpty() {
        MergeResult result = engine.merge(null, null);

        assertThat(result.getMerged()).isEmpty();
        assertThat(result.getAuditLog()).isEmpty();
    }

    @Test
    void summaryCountsSources() {
        primary.put("Jane Doe Lab", primary(false, "+201111111"));
        primary.put("Bob", primary(true, "+2033"));
        secondary.put("Jane Doe Lab", secondary("Jane Doe", "01222222"));
        secondary.put("Nour Lab", secondary("Nour", "01000000007"));

        MergeResult result = engine.merge(primary, secondary);
        MergeSummary summary = MergeSummary.of(primary.size(), secondary.size(), result);

        assertThat(summary.getTotal()).isEqualTo(3);
        assertThat(summary.getNewContacts()).isEqualTo(1);
        assertThat(summary.getMerged()).isEqualTo(1);
        assertThat(summary.getProtectedContacts()).isEqualTo(1);
        assertThat(summary.getUpdated()).isEqualTo(1);
    }

    private static PrimaryContact primary(boolean protectedRecord, String... numbers) {
        Set<String> groups = new LinkedHashSet<>();
        groups.add(protectedRecord ? GroupNameMapper.MY_CONTACTS : "lab ::: * myContacts");
        return PrimaryContact.builder()
                .numbers(new LinkedHashSet<>(Arrays.asList(numbers)))
                .groups(groups)
                .protectedRecord(protectedRecord)
                .build();
    }

    private static SecondaryContact secondary(String originalName, String... numbers) {
        String[] parts = originalName.split(" ", 2);
        String display = NameNormalizer.normalizeDisplayName(originalName, true, false);
        return SecondaryContact.builder()
                .numbers(new LinkedHashSet<>(Arrays.asList(numbers)))
                .firstName(parts[0])
                .middleName(parts.length > 1 ? parts[1] : "")
                .lastName(NameNormalizer.MARKER)
                .originalName(originalName)
                .comparisonKey(NameNormalizer.comparisonKey(display))
                .build();
    }
}
