package dk.cloudcreate.streamstore.connection.postgresql;

import dk.cloudcreate.streamstore.bus.EventsAppended;
import dk.cloudcreate.streamstore.connection.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@Testcontainers
class PostgresqlStreamStoreConnectionIT {
    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("stream-store-db")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                            jdbi;
    private PostgresqlStreamStoreConnection connection;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        connection = new PostgresqlStreamStoreConnection(jdbi, PostgresqlStreamStoreConfiguration.builder()
                                                                                                 .connectionName("TestStore")
                                                                                                 .build());
        connection.start();
    }

    @AfterEach
    void cleanup() {
        if (connection != null) {
            connection.close();
        }
    }

    @Test
    void starting_twice_is_harmless_and_the_tables_are_created_once() {
        connection.stop();
        connection.start();
        try (var secondConnection = new PostgresqlStreamStoreConnection(jdbi)) {
            secondConnection.start();
        }

        assertThat(connection.isStarted()).isTrue();
        assertThat(jdbi.<String, RuntimeException>withHandle(handle -> handle.select("SELECT to_regclass('stream_events')").mapTo(String.class).one())).isEqualTo("stream_events");
    }

    @Test
    void appended_events_are_read_back_with_all_their_data() {
        // Given
        var eventData = event("AccountOpened", "{\"owner\":\"Jane\"}");

        // When
        var result = connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, List.of(eventData, event("AccountCredited", "{\"amount\":10}")));

        // Then
        assertThat(result.nextExpectedVersion).isEqualTo(1);
        var slice = connection.readStreamForward("account-1", 0, 10);
        assertThat(slice.status).isEqualTo(SliceReadStatus.SUCCESS);
        assertThat(slice.events).hasSize(2);
        assertThat(slice.lastEventNumber).isEqualTo(1);
        assertThat(slice.isEndOfStream).isTrue();

        var first = slice.events.get(0);
        assertThat(first.streamName).isEqualTo("account-1");
        assertThat(first.eventNumber).isEqualTo(0);
        assertThat(first.eventId).isEqualTo(eventData.eventId);
        assertThat(first.eventType).isEqualTo("AccountOpened");
        assertThat(new String(first.payload, StandardCharsets.UTF_8)).isEqualTo("{\"owner\":\"Jane\"}");
        assertThat(first.metadata).isEqualTo(eventData.metadata);
        assertThat(first.isJson).isTrue();
        assertThat(first.created.toInstant()).isEqualTo(result.appendedEvents.get(0).created.toInstant());
    }

    @Test
    void reads_are_paged() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(5));

        // When
        var firstPage  = connection.readStreamForward("account-1", 0, 3);
        var secondPage = connection.readStreamForward("account-1", firstPage.nextEventNumber, 3);

        // Then
        assertThat(firstPage.events).extracting(recordedEvent -> recordedEvent.eventNumber).containsExactly(0L, 1L, 2L);
        assertThat(firstPage.isEndOfStream).isFalse();
        assertThat(secondPage.events).extracting(recordedEvent -> recordedEvent.eventNumber).containsExactly(3L, 4L);
        assertThat(secondPage.isEndOfStream).isTrue();
    }

    @Test
    void reading_an_unknown_stream_returns_a_not_found_slice() {
        assertThat(connection.readStreamForward("account-unknown", 0, 10).status).isEqualTo(SliceReadStatus.STREAM_NOT_FOUND);
    }

    @Test
    void a_stale_expected_version_is_rejected() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(2));

        // Then
        var thrown = catchThrowableOfType(() -> connection.appendToStream("account-1", 0, events(1)), WrongExpectedVersionException.class);
        assertThat(thrown.actualVersion).isEqualTo(1);
        assertThatThrownBy(() -> connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(1)))
                .isExactlyInstanceOf(WrongExpectedVersionException.class);
        assertThatThrownBy(() -> connection.appendToStream("account-2", ExpectedVersion.STREAM_EXISTS, events(1)))
                .isExactlyInstanceOf(WrongExpectedVersionException.class);
        assertThat(connection.readStreamForward("account-1", 0, 10).events).hasSize(2);
        assertThat(connection.readStreamForward("account-2", 0, 10).status).isEqualTo(SliceReadStatus.STREAM_NOT_FOUND);
    }

    @Test
    void concurrent_appends_with_the_same_expected_version_only_succeed_once() throws Exception {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(1));
        var executor = Executors.newFixedThreadPool(5);

        // When
        try {
            var outcomes = executor.invokeAll(IntStream.range(0, 5)
                                                       .mapToObj(i -> (Callable<Boolean>) () -> {
                                                           try {
                                                               connection.appendToStream("account-1", 0, events(1));
                                                               return true;
                                                           } catch (WrongExpectedVersionException e) {
                                                               return false;
                                                           }
                                                       })
                                                       .collect(Collectors.toList()));

            // Then
            var successes = 0;
            for (var outcome : outcomes) {
                if (outcome.get()) {
                    successes++;
                }
            }
            assertThat(successes).isEqualTo(1);
            assertThat(connection.readStreamForward("account-1", 0, 10).events).hasSize(2);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void soft_deleted_streams_report_deleted_and_can_be_recreated_from_event_zero() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(3));

        // When
        connection.deleteStream("account-1", 2);

        // Then
        assertThat(connection.readStreamForward("account-1", 0, 10).status).isEqualTo(SliceReadStatus.STREAM_DELETED);
        assertThat(connection.readStreamForward("$ce-account", 0, 10).status).isEqualTo(SliceReadStatus.STREAM_NOT_FOUND);

        // And when
        var result = connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(1));

        // Then
        assertThat(result.nextExpectedVersion).isEqualTo(0);
        assertThat(connection.readStreamForward("account-1", 0, 10).events).hasSize(1);
    }

    @Test
    void hard_deleted_streams_can_never_be_written_again() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(1));

        // When
        connection.hardDeleteStream("account-1", 0);

        // Then
        assertThat(connection.readStreamForward("account-1", 0, 10).status).isEqualTo(SliceReadStatus.STREAM_DELETED);
        assertThatThrownBy(() -> connection.appendToStream("account-1", ExpectedVersion.ANY, events(1)))
                .isExactlyInstanceOf(StreamDeletedException.class);
        assertThatThrownBy(() -> connection.deleteStream("account-1", ExpectedVersion.ANY))
                .isExactlyInstanceOf(StreamDeletedException.class);
    }

    @Test
    void hard_deleting_a_stream_that_never_existed_leaves_a_tombstone() {
        connection.hardDeleteStream("account-9", ExpectedVersion.NO_STREAM);

        assertThat(connection.readStreamForward("account-9", 0, 10).status).isEqualTo(SliceReadStatus.STREAM_DELETED);
        assertThatThrownBy(() -> connection.appendToStream("account-9", ExpectedVersion.NO_STREAM, events(1)))
                .isExactlyInstanceOf(StreamDeletedException.class);
    }

    @Test
    void category_and_event_type_projections_follow_the_append_order() {
        // Given
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, List.of(event("Opened", "{}"), event("Credited", "{}")));
        connection.appendToStream("account-2", ExpectedVersion.NO_STREAM, List.of(event("Opened", "{}")));
        connection.appendToStream("customer-1", ExpectedVersion.NO_STREAM, List.of(event("Opened", "{}")));

        // When
        var category        = connection.readStreamForward("$ce-account", 0, 10);
        var eventType       = connection.readStreamForward("$et-Opened", 0, 10);
        var eventTypeSecond = connection.readStreamForward("$et-Opened", 1, 1);

        // Then
        assertThat(category.events).extracting(recordedEvent -> recordedEvent.streamName).containsExactly("account-1", "account-1", "account-2");
        assertThat(category.lastEventNumber).isEqualTo(2);
        assertThat(eventType.events).extracting(recordedEvent -> recordedEvent.streamName).containsExactly("account-1", "account-2", "customer-1");
        assertThat(eventTypeSecond.events).extracting(recordedEvent -> recordedEvent.streamName).containsExactly("account-2");
        assertThat(eventTypeSecond.isEndOfStream).isFalse();
    }

    @Test
    void system_streams_cannot_be_written() {
        assertThatThrownBy(() -> connection.appendToStream("$ce-account", ExpectedVersion.ANY, events(1)))
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void subscribers_are_notified_after_the_append_has_been_committed() {
        // Given
        var notifications = new CopyOnWriteArrayList<EventsAppended>();
        connection.localEventBus().addAsyncSubscriber(eventsAppended -> {
            var slice = connection.readStreamForward(eventsAppended.streamName, 0, 10);
            assertThat(slice.events).hasSizeGreaterThanOrEqualTo(eventsAppended.events.size());
            notifications.add(eventsAppended);
        });

        // When
        connection.appendToStream("account-1", ExpectedVersion.NO_STREAM, events(2));

        // Then
        await().atMost(Duration.ofSeconds(5))
               .untilAsserted(() -> assertThat(notifications).hasSize(1));
        assertThat(notifications.get(0).events).hasSize(2);
        assertThat(notifications.get(0).connectionName).isEqualTo("TestStore");
    }

    @Test
    void invalid_table_names_are_rejected() {
        assertThatThrownBy(() -> PostgresqlStreamStoreConfiguration.builder().eventsTableName("events; DROP TABLE streams").build())
                .isExactlyInstanceOf(IllegalArgumentException.class);
    }

    private static EventData event(String eventType, String json) {
        return new EventData(UUID.randomUUID(),
                             eventType,
                             json.getBytes(StandardCharsets.UTF_8),
                             "{\"CommitId\":\"c1\"}".getBytes(StandardCharsets.UTF_8),
                             true);
    }

    private static List<EventData> events(int count) {
        return IntStream.range(0, count)
                        .mapToObj(i -> event("Event" + i, "{\"index\":" + i + "}"))
                        .collect(Collectors.toList());
    }
}
