package io.procjobs.backend.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationContactEncoderTest {

    @Test
    void encode_ShouldNormalizeCaseAndWhitespace() {
        NotificationContactEncoder encoder = new NotificationContactEncoder("salt");

        String encoded = encoder.encode("  Alice@Example.org ");

        assertThat(encoded).isEqualTo(encoder.encode("alice@example.org"));
        assertThat(encoded).hasSize(64).doesNotContain("alice");
    }

    @Test
    void encode_DifferentSalt_ShouldGiveDifferentValue() {
        assertThat(new NotificationContactEncoder("a").encode("alice@example.org"))
                .isNotEqualTo(new NotificationContactEncoder("b").encode("alice@example.org"));
    }

    @Test
    void encode_BlankContact_ShouldReturnNull() {
        NotificationContactEncoder encoder = new NotificationContactEncoder(null);

        assertThat(encoder.encode(null)).isNull();
        assertThat(encoder.encode("  ")).isNull();
    }
}
