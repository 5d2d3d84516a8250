package com.nana.reconcile.widget;

import com.nana.reconcile.store.Attribute;
import com.nana.reconcile.store.AttributeKind;
import com.nana.reconcile.store.ModelStore;
import com.nana.reconcile.util.ReconcileConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the widget for a model attribute.
 *
 * <p>WIDGET ARGUMENTS (all optional):
 * <ul>
 *   <li>{@value #ARG_FORMAT}: a pattern or list of patterns for date and
 *       time attributes.</li>
 *   <li>{@value #ARG_FIELD}: key attribute on the related model
 *       (default {@code id}).</li>
 *   <li>{@value #ARG_SEPARATOR}: member separator for many-to-many
 *       (default {@code ,}).</li>
 *   <li>{@value #ARG_REQUIRED}: {@code true} makes an unmatched foreign key
 *       an error.</li>
 * </ul>
 * An unknown argument name is rejected.
 */
public class WidgetFactory {

    private static final Logger log = LoggerFactory.getLogger(WidgetFactory.class);

    public static final String ARG_FORMAT = "format";
    public static final String ARG_FIELD = "field";
    public static final String ARG_SEPARATOR = "separator";
    public static final String ARG_REQUIRED = "required";

    private static final Set<String> KNOWN_ARGS = Set.of(ARG_FORMAT, ARG_FIELD, ARG_SEPARATOR, ARG_REQUIRED);

    private static final String DEFAULT_KEY_FIELD = "id";

    private final ReconcileConfig config;

    public WidgetFactory(ReconcileConfig config) {
        this.config = config;
    }

    /**
     * @param attribute the attribute a field is generated for
     * @param args      widget arguments; may be empty
     * @return a widget converting values of that attribute
     */
    public Widget<?> forAttribute(Attribute<?, ?> attribute, Map<String, Object> args) {
        checkArgs(attribute.getName(), args);
        return switch (attribute.getKind()) {
            case FOREIGN_KEY -> foreignKey(attribute.getRelatedStore(), args);
            case MANY_TO_MANY -> manyToMany(attribute.getRelatedStore(), args);
            default -> forKind(attribute.getKind(), args);
        };
    }

    /**
     * @param kind a scalar kind
     * @param args widget arguments; only {@value #ARG_FORMAT} applies
     * @throws IllegalArgumentException for relation kinds
     */
    public Widget<?> forKind(AttributeKind kind, Map<String, Object> args) {
        return switch (kind) {
            case STRING -> new CharWidget();
            case INTEGER -> new IntegerWidget();
            case DECIMAL -> new DecimalWidget();
            case BOOLEAN -> new BooleanWidget();
            case DATE -> new DateWidget(formats(args, config.getDateInputFormats()));
            case DATETIME -> new DateTimeWidget(formats(args, config.getDateTimeInputFormats()));
            case TIME -> new TimeWidget(formats(args, config.getTimeInputFormats()));
            case FOREIGN_KEY, MANY_TO_MANY ->
                    throw new IllegalArgumentException("No scalar widget for relation kind " + kind + ".");
        };
    }

    private <R> ForeignKeyWidget<R> foreignKey(ModelStore<R> store, Map<String, Object> args) {
        String field = (String) args.getOrDefault(ARG_FIELD, DEFAULT_KEY_FIELD);
        boolean required = Boolean.TRUE.equals(args.get(ARG_REQUIRED));
        return new ForeignKeyWidget<>(store, field, required, keyWidget(store, field));
    }

    private <R> ManyToManyWidget<R> manyToMany(ModelStore<R> store, Map<String, Object> args) {
        String field = (String) args.getOrDefault(ARG_FIELD, DEFAULT_KEY_FIELD);
        String separator = (String) args.getOrDefault(ARG_SEPARATOR, ManyToManyWidget.DEFAULT_SEPARATOR);
        return new ManyToManyWidget<>(store, separator, field, keyWidget(store, field));
    }

    private Widget<?> keyWidget(ModelStore<?> store, String field) {
        Attribute<?, ?> key = store.getSchema().resolveAttribute(field);
        if (key.getKind().isRelation()) {
            throw new IllegalArgumentException("Relation key '" + field + "' must be a scalar attribute.");
        }
        return forKind(key.getKind(), Map.of());
    }

    @SuppressWarnings("unchecked")
    private static List<String> formats(Map<String, Object> args, List<String> defaults) {
        Object format = args.get(ARG_FORMAT);
        if (format == null) {
            return defaults;
        }
        if (format instanceof String) {
            return List.of((String) format);
        }
        return List.copyOf((List<String>) format);
    }

    private static void checkArgs(String attribute, Map<String, Object> args) {
        for (String name : args.keySet()) {
            if (!KNOWN_ARGS.contains(name)) {
                throw new IllegalArgumentException("Unknown widget argument '" + name
                        + "' for attribute '" + attribute + "'.");
            }
        }
        if (!args.isEmpty()) {
            log.debug("Widget arguments for '{}': {}", attribute, args);
        }
    }
}
