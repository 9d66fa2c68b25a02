package dk.cloudcreate.streamstore.aggregates.correlated;

import dk.cloudcreate.streamstore.aggregates.AggregateInstanceFactory;
import dk.cloudcreate.streamstore.aggregates.bank.*;
import dk.cloudcreate.streamstore.common.correlation.CorrelatedMessage;
import dk.cloudcreate.streamstore.common.types.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class CorrelatedAggregateTest {

    @Test
    void events_carry_the_correlation_of_the_source_message() {
        // Given
        var command = BankCommand.start();

        // When
        var account = new Account(UUID.randomUUID(), "Alice", command);
        account.credit(new BigDecimal("10"));

        // Then
        assertThat(account.pendingEvents()).hasSize(2);
        for (var event : account.pendingEvents()) {
            var message = (CorrelatedMessage) event;
            assertThat(message.messageId()).isNotNull().isNotEqualTo(command.messageId());
            assertThat(message.correlationId()).isEqualTo(command.correlationId());
            assertThat(message.causationId()).isEqualTo(command.messageId());
        }
        assertThat(((CorrelatedMessage) account.pendingEvents().get(0)).messageId())
                .isNotEqualTo(((CorrelatedMessage) account.pendingEvents().get(1)).messageId());
        assertThat(account.balance()).isEqualByComparingTo("10");
    }

    @Test
    void changing_the_source_applies_the_new_correlation_to_later_events() {
        // Given
        var first   = BankCommand.start();
        var account = new Account(UUID.randomUUID(), "Bob", first);
        account.takeEvents();
        var second = BankCommand.causedBy(first);

        // When
        account.source(second).credit(BigDecimal.ONE);

        // Then
        var credited = (AccountCredited) account.pendingEvents().get(0);
        assertThat(credited.causationId()).isEqualTo(second.messageId());
        assertThat(credited.correlationId()).isEqualTo(first.correlationId());
        assertThat(account.source()).containsSame(second);
    }

    @Test
    void the_source_cannot_change_while_events_are_pending() {
        var account = new Account(UUID.randomUUID(), "Carol", BankCommand.start());

        assertThatThrownBy(() -> account.source(BankCommand.start()))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void setting_the_same_source_again_is_allowed_while_events_are_pending() {
        var command = BankCommand.start();
        var account = new Account(UUID.randomUUID(), "Dave", command);

        assertThatCode(() -> account.source(command)).doesNotThrowAnyException();
    }

    @Test
    void a_source_without_correlation_id_is_rejected() {
        var account = AggregateInstanceFactory.objenesisFactory().create(Account.class);
        var source = new CorrelatedMessage() {
            private final MessageId messageId = MessageId.random();

            @Override
            public MessageId messageId() {
                return messageId;
            }

            @Override
            public CorrelationId correlationId() {
                return null;
            }

            @Override
            public MessageId causationId() {
                return null;
            }
        };

        assertThatThrownBy(() -> account.source(source))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void creating_an_aggregate_without_a_source_is_rejected() {
        assertThatThrownBy(() -> new Account(UUID.randomUUID(), "Eve", null))
                .isExactlyInstanceOf(NullPointerException.class);
    }

    @Test
    void raising_events_without_a_source_is_rejected() {
        var account = AggregateInstanceFactory.objenesisFactory().create(Account.class);

        assertThatThrownBy(() -> account.credit(BigDecimal.ONE))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void a_rejected_debit_raises_no_event() {
        var account = new Account(UUID.randomUUID(), "Frank", BankCommand.start());

        assertThatThrownBy(() -> account.debit(BigDecimal.TEN))
                .isExactlyInstanceOf(Account.InsufficientFundsException.class);
        assertThat(account.pendingEvents()).hasSize(1);
    }
}
