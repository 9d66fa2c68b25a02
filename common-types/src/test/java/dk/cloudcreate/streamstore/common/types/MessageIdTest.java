package dk.cloudcreate.streamstore.common.types;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class MessageIdTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void ids_with_the_same_value_are_equal() {
        var uuid = UUID.randomUUID();

        assertThat(MessageId.of(uuid)).isEqualTo(MessageId.of(uuid.toString()));
        assertThat(MessageId.of(uuid).hashCode()).isEqualTo(MessageId.of(uuid).hashCode());
        assertThat(MessageId.random()).isNotEqualTo(MessageId.random());
    }

    @Test
    void ids_are_serialized_as_their_plain_uuid_string() throws Exception {
        var messageId     = MessageId.random();
        var correlationId = CorrelationId.random();

        var messageIdJson     = objectMapper.writeValueAsString(messageId);
        var correlationIdJson = objectMapper.writeValueAsString(correlationId);

        assertThat(messageIdJson).isEqualTo("\"" + messageId + "\"");
        assertThat(objectMapper.readValue(messageIdJson, MessageId.class)).isEqualTo(messageId);
        assertThat(objectMapper.readValue(correlationIdJson, CorrelationId.class)).isEqualTo(correlationId);
    }

    @Test
    void a_value_that_is_not_a_uuid_is_rejected() {
        assertThatThrownBy(() -> MessageId.of("not-a-uuid"))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
