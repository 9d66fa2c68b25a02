package dk.cloudcreate.streamstore.naming;

/**
 * Deterministic mapping from aggregate types and ids to the names of the streams they are persisted in.<br>
 * Stream names are stored externally, so an implementation's naming convention must never change once streams have been written.
 */
public interface StreamNameBuilder {
    /**
     * @param aggregateType the aggregate type
     * @param aggregateId   the id of the aggregate instance
     * @return the name of the stream the aggregate instance is persisted in
     */
    String generateForAggregate(Class<?> aggregateType, Object aggregateId);

    /**
     * @param aggregateType the aggregate type
     * @return the name of the category stream that contains the events of every instance of <code>aggregateType</code>
     */
    String generateForCategory(Class<?> aggregateType);

    /**
     * @param eventTypeName the event type tag
     * @return the name of the stream that contains every event with the given event type
     */
    String generateForEventType(String eventTypeName);
}
