package dk.cloudcreate.streamstore.aggregates.repository;

import dk.cloudcreate.streamstore.aggregates.*;
import dk.cloudcreate.streamstore.aggregates.bank.*;
import dk.cloudcreate.streamstore.aggregates.cart.ShoppingCart;
import dk.cloudcreate.streamstore.common.correlation.CorrelatedMessage;
import dk.cloudcreate.streamstore.connection.*;
import dk.cloudcreate.streamstore.naming.*;
import dk.cloudcreate.streamstore.serializer.EventMetaData;
import dk.cloudcreate.streamstore.serializer.json.JacksonEventSerializer;
import org.junit.jupiter.api.*;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class StreamStoreRepositoryTest {
    private RecordingStreamStoreConnection connection;
    private StreamNameBuilder              streamNameBuilder;
    private JacksonEventSerializer         serializer;
    private StreamStoreRepository          repository;

    @BeforeEach
    void setup() {
        connection = new RecordingStreamStoreConnection();
        connection.start();
        streamNameBuilder = new PrefixedCamelCaseStreamNameBuilder("bank");
        serializer = new JacksonEventSerializer();
        repository = new StreamStoreRepository(connection, streamNameBuilder, serializer);
    }

    @AfterEach
    void cleanup() {
        connection.stop();
    }

    @Test
    void credits_saved_by_separate_commands_are_loaded_back_with_their_causation() {
        // Given
        var accountId = UUID.randomUUID();
        var open      = BankCommand.start();
        repository.save(new Account(accountId, "Alice", open));

        var commands = new ArrayList<BankCommand>();
        for (var amount : List.of("7", "13", "31")) {
            var command = BankCommand.causedBy(open);
            commands.add(command);
            var account = repository.getById(Account.class, accountId).source(command);
            account.credit(new BigDecimal(amount));
            repository.save(account);
        }

        // When
        var account = repository.getById(Account.class, accountId);

        // Then
        assertThat(account.balance()).isEqualByComparingTo("51");
        assertThat(account.owner()).isEqualTo("Alice");
        assertThat(account.version()).isEqualTo(3);
        assertThat(account.hasPendingEvents()).isFalse();

        var recorded = connection.readStreamForward(streamNameBuilder.generateForAggregate(Account.class, accountId), 0, 10).events;
        assertThat(recorded).hasSize(4);
        for (var i = 1; i < recorded.size(); i++) {
            var event = (CorrelatedMessage) serializer.deserialize(recorded.get(i));
            assertThat(event.causationId()).isEqualTo(commands.get(i - 1).messageId());
            assertThat(event.correlationId()).isEqualTo(open.correlationId());
            assertThat(serializer.deserializeMetaData(recorded.get(i).metadata).causationId()).hasValue(commands.get(i - 1).messageId());
        }
    }

    @Test
    void a_specific_version_is_loaded_with_exactly_that_many_events() {
        // Given
        var accountId = createAccountWithCredits("7", "13", "31");

        // When
        var account = repository.getById(Account.class, accountId, 2);

        // Then
        assertThat(account.version()).isEqualTo(1);
        assertThat(account.balance()).isEqualByComparingTo("7");
    }

    @Test
    void a_version_beyond_the_end_of_the_stream_is_rejected() {
        // Given
        var accountId = createAccountWithCredits("7");

        // When
        var thrown = catchThrowableOfType(() -> repository.getById(Account.class, accountId, 5), AggregateVersionException.class);

        // Then
        assertThat(thrown.requiredVersion).isEqualTo(5);
        assertThat(thrown.actualVersion).isEqualTo(2);
        assertThat(repository.tryGetById(Account.class, accountId, 5)).isEmpty();
        assertThat(repository.tryGetById(Account.class, accountId, 2)).isPresent();
    }

    @Test
    void a_version_below_one_is_rejected() {
        var accountId = createAccountWithCredits();

        assertThatThrownBy(() -> repository.getById(Account.class, accountId, 0))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loading_an_aggregate_that_was_never_saved_fails_with_not_found() {
        var accountId = UUID.randomUUID();

        var thrown = catchThrowableOfType(() -> repository.getById(Account.class, accountId), AggregateNotFoundException.class);

        assertThat(thrown).isExactlyInstanceOf(AggregateNotFoundException.class);
        assertThat(thrown.aggregateId).isEqualTo(accountId);
        assertThat(thrown.streamName).isEqualTo(streamNameBuilder.generateForAggregate(Account.class, accountId));
        assertThat(repository.tryGetById(Account.class, accountId)).isEmpty();
        assertThatThrownBy(() -> repository.getById(Account.class, accountId, 1))
                .isExactlyInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void saving_a_stale_aggregate_fails_with_a_concurrency_conflict() {
        // Given
        var accountId = createAccountWithCredits();
        var first     = repository.getById(Account.class, accountId).source(BankCommand.start());
        var second    = repository.getById(Account.class, accountId).source(BankCommand.start());
        first.credit(BigDecimal.ONE);
        second.credit(BigDecimal.TEN);
        repository.save(first);

        // When
        var thrown = catchThrowableOfType(() -> repository.save(second), OptimisticAggregateConcurrencyException.class);

        // Then
        assertThat(thrown.expectedVersion).isEqualTo(0);
        assertThat(thrown.actualVersion).isEqualTo(1);
        assertThat(thrown).hasCauseExactlyInstanceOf(WrongExpectedVersionException.class);
        assertThat(second.hasPendingEvents()).isTrue();
        assertThat(repository.getById(Account.class, accountId).balance()).isEqualByComparingTo("1");
    }

    @Test
    void creating_an_aggregate_whose_stream_already_has_events_fails() {
        // Given
        var accountId = createAccountWithCredits();
        var duplicate = new Account(accountId, "Mallory", BankCommand.start());

        // Then
        assertThatThrownBy(() -> repository.save(duplicate))
                .isExactlyInstanceOf(AggregateAlreadyExistsException.class);
        assertThat(duplicate.hasPendingEvents()).isTrue();
        assertThat(repository.getById(Account.class, accountId).owner()).isEqualTo("Alice");
    }

    @Test
    void small_page_and_batch_sizes_load_and_save_every_event() {
        // Given
        repository = new StreamStoreRepository(connection,
                                               streamNameBuilder,
                                               serializer,
                                               AggregateInstanceFactory.defaultConstructorFactory(),
                                               RepositoryConfiguration.builder()
                                                                      .readPageSize(2)
                                                                      .maxAppendBatchSize(3)
                                                                      .build());
        var accountId = UUID.randomUUID();
        var account   = new Account(accountId, "Alice", BankCommand.start());
        for (var i = 1; i <= 10; i++) {
            account.credit(BigDecimal.valueOf(i));
        }

        // When
        repository.save(account);
        var loaded = repository.getById(Account.class, accountId);

        // Then
        assertThat(connection.appendedBatchSizes).containsExactly(3, 3, 3, 2);
        assertThat(loaded.version()).isEqualTo(10);
        assertThat(loaded.balance()).isEqualByComparingTo("55");
        assertThat(account.hasPendingEvents()).isFalse();
    }

    @Test
    void a_failure_after_some_batches_were_appended_is_reported_as_a_partial_save() {
        // Given
        repository = new StreamStoreRepository(connection,
                                               streamNameBuilder,
                                               serializer,
                                               AggregateInstanceFactory.defaultConstructorFactory(),
                                               RepositoryConfiguration.builder().maxAppendBatchSize(3).build());
        var accountId = UUID.randomUUID();
        var account   = new Account(accountId, "Alice", BankCommand.start());
        for (var i = 0; i < 6; i++) {
            account.credit(BigDecimal.ONE);
        }
        connection.failAppendNumber = 2;

        // When
        var thrown = catchThrowableOfType(() -> repository.save(account), AggregatePartiallySavedException.class);

        // Then
        assertThat(thrown.persistedEvents).isEqualTo(3);
        assertThat(thrown.totalEvents).isEqualTo(7);
        assertThat(thrown).hasCauseExactlyInstanceOf(StreamStoreConnectionException.class);
        assertThat(account.pendingEvents()).hasSize(7);
        assertThat(repository.getById(Account.class, accountId).version()).isEqualTo(2);
    }

    @Test
    void a_failure_of_the_first_append_is_propagated_unchanged() {
        var account = new Account(UUID.randomUUID(), "Alice", BankCommand.start());
        connection.failAppendNumber = 1;

        assertThatThrownBy(() -> repository.save(account))
                .isExactlyInstanceOf(StreamStoreConnectionException.class);
        assertThat(account.hasPendingEvents()).isTrue();
    }

    @Test
    void saving_without_pending_events_does_nothing() {
        // Given
        var accountId = createAccountWithCredits("5");
        var account   = repository.getById(Account.class, accountId);
        var appends   = connection.appendCalls.get();

        // When
        repository.save(account);

        // Then
        assertThat(connection.appendCalls.get()).isEqualTo(appends);
    }

    @Test
    void every_event_of_a_save_carries_the_commit_id_and_custom_headers() {
        // Given
        var accountId = UUID.randomUUID();
        var account   = new Account(accountId, "Alice", BankCommand.start());
        account.credit(BigDecimal.ONE);
        var commitId = UUID.randomUUID();

        // When
        repository.save(account, commitId, headers -> headers.put("Tenant", "acme"));

        // Then
        var metaData = connection.readStreamForward(streamNameBuilder.generateForAggregate(Account.class, accountId), 0, 10)
                                 .events
                                 .stream()
                                 .map(event -> serializer.deserializeMetaData(event.metadata))
                                 .collect(Collectors.toList());
        assertThat(metaData).hasSize(2);
        assertThat(metaData).allSatisfy(headers -> {
            assertThat(headers.commitId()).hasValue(commitId);
            assertThat(headers.get("Tenant")).hasValue("acme");
            assertThat(headers.get(EventMetaData.AGGREGATE_TYPE)).hasValue("Account");
            assertThat(headers.aggregateJavaType()).hasValue(Account.class.getName());
        });
    }

    @Test
    void updateToCurrent_applies_events_saved_by_others() {
        // Given
        var accountId = createAccountWithCredits("10");
        var stale     = repository.getById(Account.class, accountId);
        var other     = repository.getById(Account.class, accountId).source(BankCommand.start());
        other.credit(new BigDecimal("5"));
        other.debit(new BigDecimal("3"));
        repository.save(other);

        // When
        var updated = repository.updateToCurrent(stale);

        // Then
        assertThat(updated).isSameAs(stale);
        assertThat(stale.version()).isEqualTo(3);
        assertThat(stale.balance()).isEqualByComparingTo("12");
    }

    @Test
    void updateToCurrent_rejects_an_aggregate_with_pending_events() {
        var account = repository.getById(Account.class, createAccountWithCredits()).source(BankCommand.start());
        account.credit(BigDecimal.ONE);

        assertThatThrownBy(() -> repository.updateToCurrent(account))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void a_soft_deleted_aggregate_is_reported_as_deleted_and_can_be_recreated() {
        // Given
        var accountId = createAccountWithCredits("5");
        var account   = repository.getById(Account.class, accountId);

        // When
        repository.delete(account);

        // Then
        assertThatThrownBy(() -> repository.getById(Account.class, accountId))
                .isExactlyInstanceOf(AggregateDeletedException.class);
        assertThat(repository.tryGetById(Account.class, accountId)).isEmpty();

        // And
        repository.save(new Account(accountId, "Bob", BankCommand.start()));
        var recreated = repository.getById(Account.class, accountId);
        assertThat(recreated.owner()).isEqualTo("Bob");
        assertThat(recreated.version()).isEqualTo(0);
        assertThat(recreated.balance()).isEqualByComparingTo("0");
    }

    @Test
    void a_hard_deleted_aggregate_can_never_be_created_again() {
        // Given
        var accountId = createAccountWithCredits("5");
        repository.hardDelete(repository.getById(Account.class, accountId));

        // Then
        assertThatThrownBy(() -> repository.getById(Account.class, accountId))
                .isExactlyInstanceOf(AggregateDeletedException.class);
        assertThatThrownBy(() -> repository.save(new Account(accountId, "Bob", BankCommand.start())))
                .isExactlyInstanceOf(AggregateDeletedException.class);
    }

    @Test
    void deleting_a_stale_aggregate_fails_with_a_concurrency_conflict() {
        // Given
        var accountId = createAccountWithCredits();
        var stale     = repository.getById(Account.class, accountId);
        var current   = repository.getById(Account.class, accountId).source(BankCommand.start());
        current.credit(BigDecimal.ONE);
        repository.save(current);

        // Then
        assertThatThrownBy(() -> repository.delete(stale))
                .isExactlyInstanceOf(OptimisticAggregateConcurrencyException.class);
        assertThat(repository.getById(Account.class, accountId).version()).isEqualTo(1);
    }

    @Test
    void deleting_an_aggregate_with_pending_events_is_rejected() {
        var account = new Account(UUID.randomUUID(), "Alice", BankCommand.start());

        assertThatThrownBy(() -> repository.delete(account))
                .isExactlyInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> repository.hardDelete(account))
                .isExactlyInstanceOf(IllegalStateException.class);
    }

    @Test
    void events_that_result_in_another_aggregate_id_are_rejected() {
        // Given
        var accountId = UUID.randomUUID();
        var created   = new AccountCreated(BankCommand.start().causedCorrelation(), UUID.randomUUID(), "Alice");
        connection.appendToStream(streamNameBuilder.generateForAggregate(Account.class, accountId),
                                  ExpectedVersion.NO_STREAM,
                                  List.of(serializer.serialize(created)));

        // Then
        assertThatThrownBy(() -> repository.getById(Account.class, accountId))
                .isExactlyInstanceOf(AggregateException.class);
    }

    @Test
    void aggregates_without_a_no_args_constructor_require_another_instance_factory() {
        // Given
        var cart = new ShoppingCart("cart-1");
        cart.addItem("apple", 3);
        repository.save(cart);

        // Then
        assertThatThrownBy(() -> repository.getById(ShoppingCart.class, "cart-1"))
                .isExactlyInstanceOf(AggregateException.class);

        // When
        var objenesisRepository = new StreamStoreRepository(connection,
                                                            streamNameBuilder,
                                                            serializer,
                                                            AggregateInstanceFactory.objenesisFactory(),
                                                            RepositoryConfiguration.defaultConfiguration());
        var loaded = objenesisRepository.getById(ShoppingCart.class, "cart-1");

        // Then
        assertThat(loaded.items()).containsEntry("apple", 3);
        assertThat(loaded.version()).isEqualTo(1);
    }

    @Test
    void aggregates_are_created_using_the_registered_factory() {
        // Given
        var accountId = createAccountWithCredits("4");
        var factories = new AggregateFactoryRegistry().register(Account.class, Account::empty);
        var registryRepository = new StreamStoreRepository(connection,
                                                           streamNameBuilder,
                                                           serializer,
                                                           factories,
                                                           RepositoryConfiguration.defaultConfiguration());

        // When
        var account = registryRepository.getById(Account.class, accountId);

        // Then
        assertThat(account.balance()).isEqualByComparingTo("4");
    }

    private UUID createAccountWithCredits(String... amounts) {
        var accountId = UUID.randomUUID();
        var account   = new Account(accountId, "Alice", BankCommand.start());
        for (var amount : amounts) {
            account.credit(new BigDecimal(amount));
        }
        repository.save(account);
        return accountId;
    }
}
