package com.cloudcostbuddy.normalization;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class ServiceNameCanonicalizerTest {

    private final ServiceNameCanonicalizer canonicalizer = new ServiceNameCanonicalizer();

    @Nested
    @DisplayName("Label table")
    class LabelTableTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "Amazon Elastic Compute Cloud - Compute, Compute",
                "Virtual Machines, Compute",
                "Compute Engine, Compute",
                "Amazon Simple Storage Service, Storage",
                "Cloud Storage, Storage",
                "SQL Database, Database",
                "Amazon CloudFront, CDN",
                "BigQuery, Analytics",
                "AWS Lambda, Serverless",
                "Azure Kubernetes Service, Containers"
        })
        @DisplayName("Should map known provider labels to their bucket")
        void shouldMapKnownLabels(String label, String expected) {
            assertThat(canonicalizer.canonicalize(label)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Should match labels that contain a known name, ignoring case")
        void shouldMatchBySubstring() {
            assertThat(canonicalizer.canonicalize("amazon simple storage service (us-east-1)"))
                    .isEqualTo("Storage");
        }
    }

    @Nested
    @DisplayName("Unknown labels")
    class UnknownLabelTests {

        @Test
        @DisplayName("Should strip vendor prefixes and capitalize")
        void shouldCleanUnknownLabel() {
            assertThat(canonicalizer.canonicalize("Amazon   sagemaker")).isEqualTo("Sagemaker");
            assertThat(canonicalizer.canonicalize("google vertex ai")).isEqualTo("Vertex ai");
        }

        @Test
        @DisplayName("Should strip stacked prefixes")
        void shouldStripStackedPrefixes() {
            assertThat(canonicalizer.canonicalize("Google Cloud Pub/Sub")).isEqualTo("Pub/Sub");
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   ", "\t"})
        @DisplayName("Should fall back to Unknown Service when nothing is left")
        void shouldReturnUnknownForBlank(String label) {
            assertThat(canonicalizer.canonicalize(label)).isEqualTo(ServiceNameCanonicalizer.UNKNOWN_SERVICE);
        }
    }

    @Nested
    @DisplayName("Idempotence")
    class IdempotenceTests {

        @ParameterizedTest
        @ValueSource(strings = {
                "Amazon Elastic Compute Cloud - Compute", "Virtual Machines", "BigQuery",
                "Amazon sagemaker", "azure cloud shell", "Google Cloud Pub/Sub", "x", "Other",
                "Unknown Service", "  cloud   cloud dataflow ", "Data Transfer"
        })
        @DisplayName("Canonicalizing twice should equal canonicalizing once")
        void shouldBeIdempotent(String label) {
            String once = canonicalizer.canonicalize(label);

            assertThat(canonicalizer.canonicalize(once)).isEqualTo(once);
        }

        @Test
        @DisplayName("Should recognize taxonomy names")
        void shouldRecognizeTaxonomyNames() {
            assertThat(canonicalizer.isTaxonomyName("Compute")).isTrue();
            assertThat(canonicalizer.isTaxonomyName("Sagemaker")).isFalse();
        }
    }
}
