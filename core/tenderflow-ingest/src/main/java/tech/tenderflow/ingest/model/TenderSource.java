package tech.tenderflow.ingest.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The closed set of tender sources the pipeline understands.
 *
 * <p>Each source owns the classification-key aliases its scrapers publish under and is
 * bound to exactly one {@link TenderMessage} subtype. Aliases are matched case-insensitively.
 */
public enum TenderSource {
    ETENDERS("eTenders", ETenderMessage.class, "etenderscrape", "etenderlambda"),
    ESKOM("Eskom", EskomTenderMessage.class, "eskomtenderscrape", "eskomlambda"),
    TRANSNET("Transnet", TransnetTenderMessage.class, "transnettenderscrape", "transnetlambda");

    private static final Map<String, TenderSource> BY_ALIAS = Arrays.stream(values())
        .flatMap(source -> source.aliases.stream().map(alias -> Map.entry(alias, source)))
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private final String displayName;
    private final Class<? extends TenderMessage> messageType;
    private final List<String> aliases;

    TenderSource(String displayName, Class<? extends TenderMessage> messageType, String... aliases) {
        this.displayName = displayName;
        this.messageType = messageType;
        this.aliases = List.of(aliases);
    }

    /**
     * Name used in tags, prompt lookups and outgoing group keys, e.g. {@code "eTenders"}.
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Type the router deserializes this source's bodies into.
     */
    public Class<? extends TenderMessage> messageType() {
        return messageType;
    }

    /**
     * Resolve a classification key such as {@code "eTenderScrape"}. Null and unknown keys resolve to empty.
     */
    public static Optional<TenderSource> fromClassificationKey(String classificationKey) {
        if (classificationKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_ALIAS.get(classificationKey.trim().toLowerCase(Locale.ROOT)));
    }
}
