package dk.cloudcreate.streamstore.naming;

import dk.cloudcreate.streamstore.connection.SystemStreams;

import java.util.*;
import java.util.concurrent.*;

import static com.google.common.base.Preconditions.*;

/**
 * {@link StreamNameBuilder} that names streams after the aggregate's simple class name in camelCase,
 * optionally placed in a lower case prefix namespace:
 * <ul>
 *     <li>Aggregate stream: <code>[prefix.]camelCaseTypeName-{id}</code></li>
 *     <li>Category stream: <code>$ce-[prefix.]camelCaseTypeName</code></li>
 *     <li>Event type stream: <code>$et-{eventTypeName}</code></li>
 * </ul>
 * A {@link UUID} id is rendered in its canonical dashed form, any other id using its {@link Object#toString()}.<br>
 * Example: <code>new PrefixedCamelCaseStreamNameBuilder("Bank").generateForAggregate(Account.class, id)</code> gives
 * <code>bank.account-0b4e7a1c-52f4-4c7f-a9a5-d07e0d3b6e21</code>
 * <p>
 * A builder instance binds every category name to the first aggregate type and id type it was generated for. Another aggregate type with the
 * same simple name, or the same aggregate type used with ids of a different type, would produce clashing stream names and is rejected with an
 * {@link IllegalArgumentException}.
 */
public class PrefixedCamelCaseStreamNameBuilder implements StreamNameBuilder {
    private static final char PREFIX_SEPARATOR = '.';

    private final Optional<String>                  prefix;
    private final ConcurrentMap<String, Class<?>>   categoryOwners  = new ConcurrentHashMap<>();
    private final ConcurrentMap<Class<?>, Class<?>> aggregateIdTypes = new ConcurrentHashMap<>();

    /**
     * Create a builder without a prefix namespace
     */
    public PrefixedCamelCaseStreamNameBuilder() {
        this.prefix = Optional.empty();
    }

    /**
     * Create a builder that places all streams in the <code>prefix</code> namespace (the prefix is lower cased)
     *
     * @param prefix the prefix. Must not be null or blank and must not contain the category separator '-'
     */
    public PrefixedCamelCaseStreamNameBuilder(String prefix) {
        checkArgument(prefix != null && !prefix.isBlank(), "A prefix must be provided and it must not be blank");
        var trimmedPrefix = prefix.trim();
        checkArgument(trimmedPrefix.indexOf(SystemStreams.CATEGORY_SEPARATOR) < 0,
                      "The prefix '%s' must not contain '%s'", prefix, SystemStreams.CATEGORY_SEPARATOR);
        this.prefix = Optional.of(trimmedPrefix.toLowerCase(Locale.ROOT));
    }

    public Optional<String> prefix() {
        return prefix;
    }

    @Override
    public String generateForAggregate(Class<?> aggregateType, Object aggregateId) {
        checkNotNull(aggregateId, "No aggregateId provided");
        var id = aggregateId.toString();
        checkArgument(!id.isBlank(), "aggregateId '%s' resolves to a blank stream id", aggregateId);
        var categoryName = categoryName(aggregateType);
        var idType       = aggregateIdTypes.computeIfAbsent(aggregateType, type -> aggregateId.getClass());
        checkArgument(idType.equals(aggregateId.getClass()),
                      "Aggregate type '%s' already uses ids of type '%s' but got id '%s' of type '%s'",
                      aggregateType.getName(), idType.getName(), aggregateId, aggregateId.getClass().getName());
        return categoryName + SystemStreams.CATEGORY_SEPARATOR + id;
    }

    @Override
    public String generateForCategory(Class<?> aggregateType) {
        return SystemStreams.categoryStream(categoryName(aggregateType));
    }

    @Override
    public String generateForEventType(String eventTypeName) {
        checkArgument(eventTypeName != null && !eventTypeName.isBlank(), "An eventTypeName must be provided");
        return SystemStreams.eventTypeStream(eventTypeName);
    }

    private String categoryName(Class<?> aggregateType) {
        checkNotNull(aggregateType, "No aggregateType provided");
        var camelCaseName = toCamelCase(aggregateType.getSimpleName());
        var categoryName = prefix.map(value -> value + PREFIX_SEPARATOR + camelCaseName)
                                 .orElse(camelCaseName);
        var owner = categoryOwners.computeIfAbsent(categoryName, name -> aggregateType);
        checkArgument(owner.equals(aggregateType),
                      "Category '%s' of aggregate type '%s' is already used by aggregate type '%s'",
                      categoryName, aggregateType.getName(), owner.getName());
        return categoryName;
    }

    static String toCamelCase(String name) {
        checkArgument(name != null && !name.isEmpty(), "Cannot derive a stream name from an anonymous type");
        if (name.length() == 1) {
            return name.toLowerCase(Locale.ROOT);
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    @Override
    public String toString() {
        return "PrefixedCamelCaseStreamNameBuilder{" +
                "prefix=" + prefix.orElse("<none>") +
                '}';
    }
}
