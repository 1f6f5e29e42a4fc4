package com.intteq.rabbit.wire.endpoint;

import com.intteq.rabbit.wire.exception.InvalidIdentifierException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QueueNameResolver")
class QueueNameResolverTest {

    private final QueueNameResolver resolver = new QueueNameResolver();

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("Consumer suffix is replaced by .event and lower-cased")
        void resolve_ConsumerSuffix_EventSegment() {
            assertThat(resolver.resolve("ProductCreatedConsumer", "dev"))
                    .isEqualTo("dev.productcreated.event.v1");
            assertThat(resolver.resolve("OrderShippedConsumer", "prod"))
                    .isEqualTo("prod.ordershipped.event.v1");
        }

        @Test
        @DisplayName("name without the suffix is used unmodified")
        void resolve_NoSuffix_NameKept() {
            assertThat(resolver.resolve("AuditTrail", "qa")).isEqualTo("qa.audittrail.v1");
        }

        @Test
        @DisplayName("only a trailing suffix is replaced")
        void resolve_SuffixInMiddle_NotReplaced() {
            assertThat(resolver.resolve("ConsumerRegisteredConsumer", "dev"))
                    .isEqualTo("dev.consumerregistered.event.v1");
            assertThat(resolver.resolve("ConsumerRegistered", "dev"))
                    .isEqualTo("dev.consumerregistered.v1");
        }

        @Test
        @DisplayName("prefix is used as given")
        void resolve_PrefixNotNormalized() {
            assertThat(resolver.resolve("ProductCreatedConsumer", "Team-A"))
                    .isEqualTo("Team-A.productcreated.event.v1");
        }

        @Test
        @DisplayName("same inputs always give the same address")
        void resolve_Deterministic() {
            String first = resolver.resolve("InvoicePaidConsumer", "dev");
            String second = resolver.resolve("InvoicePaidConsumer", "dev");

            assertThat(first).isEqualTo(second);
        }
    }

    @Nested
    @DisplayName("invalid identifiers")
    class Invalid {

        @Test
        @DisplayName("empty type name → InvalidIdentifierException")
        void resolve_Empty_Throws() {
            assertThatThrownBy(() -> resolver.resolve("", "dev"))
                    .isInstanceOf(InvalidIdentifierException.class)
                    .hasMessageContaining("must not be empty");
        }

        @Test
        @DisplayName("null type name → InvalidIdentifierException")
        void resolve_Null_Throws() {
            assertThatThrownBy(() -> resolver.resolve((String) null, "dev"))
                    .isInstanceOf(InvalidIdentifierException.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"Product Created", "1stConsumer", "order-shipped", "  "})
        @DisplayName("malformed type name → InvalidIdentifierException")
        void resolve_Malformed_Throws(String typeName) {
            assertThatThrownBy(() -> resolver.resolve(typeName, "dev"))
                    .isInstanceOf(InvalidIdentifierException.class);
        }

        @Test
        @DisplayName("suffix alone leaves nothing to name the queue after")
        void resolve_SuffixOnly_Throws() {
            assertThatThrownBy(() -> resolver.resolve("Consumer", "dev"))
                    .isInstanceOf(InvalidIdentifierException.class)
                    .hasMessageContaining("nothing left");
        }

        @Test
        @DisplayName("null prefix → NullPointerException")
        void resolve_NullPrefix_Throws() {
            assertThatThrownBy(() -> resolver.resolve("ProductCreatedConsumer", null))
                    .isInstanceOf(NullPointerException.class);
        }
    }
}
