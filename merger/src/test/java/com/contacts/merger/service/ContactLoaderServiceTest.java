package com.contacts.merger.service;

import com.contacts.merger.model.PrimaryContact;
import com.contacts.merger.model.PrimarySourceData;
import com.contacts.merger.model.SecondaryContact;
import com.contacts.merger.normalizer.GroupNameMapper;
import com.contacts.merger.normalizer.PhoneNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ContactLoaderServiceTest {

    @TempDir
    Path tempDir;

    private ContactLoaderService loader;

    @BeforeEach
    void setUp() {
        PhoneNormalizer phoneNormalizer = new PhoneNormalizer("+20");
        loader = new ContactLoaderService(new TabularFileReader(), phoneNormalizer, new SecondaryContactFactory(phoneNormalizer));
    }

    @Test
    void loadsPrimaryRowsWithProtectionAndMarker() throws IOException {
        Path file = tempDir.resolve("google.csv");
        Files.writeString(file, String.join("\n",
                "Name,First Name,Last Name,Labels,Phone 1 - Value,Phone 2 - Value",
                "Mona Ali,Mona,Ali,lab ::: * myContacts,01011111111 ::: 01022222222,",
                "Dr Hany,Dr,Hany,* myContacts,0501234567,",
                ",Karim,,,01033333333,",
                ",,,,01044444444,"
        ) + "\n", StandardCharsets.UTF_8);

        PrimarySourceData data = loader.loadPrimary(file);
        Map<String, PrimaryContact> contacts = data.getContacts();

        assertThat(data.getColumns()).startsWith("Name", "First Name");
        assertThat(contacts).containsOnlyKeys("Mona Ali Lab", "Dr Hany", "Karim");

        PrimaryContact mona = contacts.get("Mona Ali Lab");
        assertThat(mona.isProtectedRecord()).isFalse();
        assertThat(mona.getNumbers()).containsExactly("+201011111111", "+201022222222");
        assertThat(mona.getGroups()).containsExactly(GroupNameMapper.DEFAULT_NEW_GROUP);
        assertThat(mona.getComparisonKey()).isEqualTo("mona ali");
        assertThat(mona.getFieldSnapshot()).containsEntry("First Name", "Mona");

        assertThat(contacts.get("Dr Hany").isProtectedRecord()).isTrue();
        assertThat(contacts.get("Dr Hany").getNumbers()).containsExactly("+966501234567");
        assertThat(contacts.get("Karim").getGroups()).containsExactly(GroupNameMapper.MY_CONTACTS);
    }

    @Test
    void loadsSecondaryRowsByFirstColumnName() throws IOException {
        Path file = tempDir.resolve("clinic.csv");
        Files.writeString(file, String.join("\n",
                "patientnamear,patientphone,patienttel",
                "Ahmed Samir Lab,01055555555,",
                "Ahmed Samir,,01066666666",
                "No Phone,,"
        ) + "\n", StandardCharsets.UTF_8);

        Map<String, SecondaryContact> contacts = loader.loadSecondary(file);

        assertThat(contacts).containsOnlyKeys("Ahmed Samir Lab");
        SecondaryContact ahmed = contacts.get("Ahmed Samir Lab");
        assertThat(ahmed.getNumbers()).containsExactly("+201066666666");
        assertThat(ahmed.getOriginalName()).isEqualTo("Ahmed Samir");
        assertThat(ahmed.getFirstName()).isEqualTo("Ahmed");
        assertThat(ahmed.getLastName()).isEqualTo("Lab");
    }
}
