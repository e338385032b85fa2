package com.contacts.merger.configration;

import com.contacts.merger.merge.ContactMergeEngine;
import com.contacts.merger.normalizer.GroupNameMapper;
import com.contacts.merger.normalizer.PhoneNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    @Bean
    public PhoneNormalizer phoneNormalizer(@Value("${merger.default-country-code:+20}") String defaultCountryCode) {
        return new PhoneNormalizer(defaultCountryCode);
    }

    @Bean
    public ContactMergeEngine contactMergeEngine(PhoneNormalizer phoneNormalizer,
                                                 @Value("${merger.default-new-group:" + GroupNameMapper.DEFAULT_NEW_GROUP + "}") String defaultNewGroup) {
        return new ContactMergeEngine(phoneNormalizer, defaultNewGroup);
    }
}
