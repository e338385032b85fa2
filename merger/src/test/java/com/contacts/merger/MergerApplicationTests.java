package com.contacts.merger;

import com.contacts.merger.merge.ContactMergeEngine;
import com.contacts.merger.normalizer.GroupNameMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class MergerApplicationTests {

    @Autowired
    private ContactMergeEngine contactMergeEngine;

    @Test
    void contextLoadsWithConfiguredDefaults() {
        assertThat(contactMergeEngine.getDefaultNewGroup()).isEqualTo(GroupNameMapper.DEFAULT_NEW_GROUP);
        assertThat(contactMergeEngine.getPhoneNormalizer().getDefaultCountryCode()).isEqualTo("+20");
    }
}
