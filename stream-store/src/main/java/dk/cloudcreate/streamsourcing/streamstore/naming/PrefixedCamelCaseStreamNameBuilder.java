package dk.cloudcreate.streamsourcing.streamstore.naming;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * {@link StreamNameBuilder} that generates stream names using the following formats:
 * <ul>
 *     <li>Aggregate: <code>[lowercaseprefix.]camelCaseAggregateName-aggregateIdWithoutDashes</code></li>
 *     <li>Category: <code>$ce-[lowercaseprefix.]camelCaseAggregateName</code></li>
 *     <li>Event type: <code>$et-eventType</code></li>
 * </ul>
 * Example: <code>new PrefixedCamelCaseStreamNameBuilder("Banking").generateForAggregate(Account.class, id)</code> yields
 * <code>banking.account-96370d8277ae4ccab626091775ed01bb</code>
 */
public final class PrefixedCamelCaseStreamNameBuilder implements StreamNameBuilder {
    private final String prefix;

    /**
     * Create a builder that generates stream names without a prefix
     */
    public PrefixedCamelCaseStreamNameBuilder() {
        this.prefix = "";
    }

    /**
     * Create a builder that generates stream names prefixed by the lower cased <code>prefix</code>
     *
     * @param prefix the prefix. Must contain non-whitespace characters - use {@link #PrefixedCamelCaseStreamNameBuilder()} if you don't want a prefix
     */
    public PrefixedCamelCaseStreamNameBuilder(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Provide a prefix or use the default constructor instead");
        }
        this.prefix = prefix.toLowerCase(Locale.ROOT) + ".";
    }

    @Override
    public String generateForAggregate(Class<?> aggregateType, UUID aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        return prefix + toCamelCase(aggregateType.getSimpleName()) + "-" + aggregateId.toString().replace("-", "");
    }

    @Override
    public String generateForCategory(Class<?> aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return "$ce-" + prefix + toCamelCase(aggregateType.getSimpleName());
    }

    @Override
    public String generateForEventType(String eventType) {
        requireNonNull(eventType, "No eventType provided");
        return "$et-" + eventType;
    }

    private static String toCamelCase(String name) {
        if (name.isEmpty()) {
            return name;
        }
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }

    @Override
    public String toString() {
        return "PrefixedCamelCaseStreamNameBuilder{" +
                "prefix='" + prefix + '\'' +
                '}';
    }
}
