package dk.cloudcreate.streamstore.common.correlation;

import dk.cloudcreate.streamstore.common.types.*;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CorrelationTest {

    @Test
    void a_caused_correlation_inherits_the_correlation_id_and_uses_the_source_message_id_as_causation_id() {
        // Given
        var source = new TestMessage(MessageId.random(), CorrelationId.random(), MessageId.random());

        // When
        var correlation = Correlation.causedBy(source);

        // Then
        assertThat(correlation.correlationId).isEqualTo(source.correlationId);
        assertThat(correlation.causationId).isEqualTo(source.messageId);
        assertThat(source.causedCorrelation()).isEqualTo(correlation);
    }

    @Test
    void isCarriedBy_only_matches_messages_with_the_exact_same_correlation_and_causation() {
        var source      = new TestMessage(MessageId.random(), CorrelationId.random(), null);
        var correlation = Correlation.causedBy(source);

        var caused    = new TestMessage(MessageId.random(), correlation.correlationId, correlation.causationId);
        var unrelated = new TestMessage(MessageId.random(), correlation.correlationId, MessageId.random());

        assertThat(correlation.isCarriedBy(caused)).isTrue();
        assertThat(correlation.isCarriedBy(unrelated)).isFalse();
        assertThat(correlation.isCarriedBy(null)).isFalse();
    }

    @Test
    void a_source_without_correlation_id_is_rejected() {
        var source = new TestMessage(MessageId.random(), null, null);

        assertThatThrownBy(() -> Correlation.causedBy(source))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void a_new_chain_uses_the_starting_message_id_as_correlation_id() {
        var messageId = MessageId.random();

        assertThat(CorrelationId.startedBy(messageId).value()).isEqualTo(messageId.value());
    }

    private static class TestMessage implements CorrelatedMessage {
        final MessageId     messageId;
        final CorrelationId correlationId;
        final MessageId     causationId;

        TestMessage(MessageId messageId, CorrelationId correlationId, MessageId causationId) {
            this.messageId = messageId;
            this.correlationId = correlationId;
            this.causationId = causationId;
        }

        @Override
        public MessageId messageId() {
            return messageId;
        }

        @Override
        public CorrelationId correlationId() {
            return correlationId;
        }

        @Override
        public MessageId causationId() {
            return causationId;
        }
    }
}
