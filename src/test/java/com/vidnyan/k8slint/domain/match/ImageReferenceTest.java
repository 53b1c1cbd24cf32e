package com.vidnyan.k8slint.domain.match;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ImageReferenceTest {

    @ParameterizedTest
    @CsvSource({
            "nginx,                                   true,  Always",
            "nginx:latest,                            true,  Always",
            "nginx:1.21,                              false, IfNotPresent",
            "registry.example.com:5000/team/app,      true,  Always",
            "registry.example.com:5000/team/app:2.0,  false, IfNotPresent",
            "nginx@sha256:abc123,                     false, IfNotPresent",
            "nginx:latest@sha256:abc123,              false, IfNotPresent"
    })
    void parse_ShouldDecideLatestAndDefaultPullPolicy(String image, boolean latest, String policy) {
        ImageReference reference = ImageReference.parse(image);

        assertEquals(latest, reference.resolvesToLatest());
        assertEquals(policy, reference.defaultPullPolicy());
    }

    @Test
    void parse_ShouldNotMistakeRegistryPortForTag() {
        ImageReference reference = ImageReference.parse("localhost:5000/app");

        assertEquals("localhost:5000/app", reference.repository());
        assertNull(reference.tag());
    }
}
